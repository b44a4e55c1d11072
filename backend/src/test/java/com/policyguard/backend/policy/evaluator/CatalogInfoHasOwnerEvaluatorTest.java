package com.policyguard.backend.policy.evaluator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.GitHubErrorKind;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import com.policyguard.backend.policy.PolicyFinding;
import com.policyguard.backend.policy.PolicyTypes;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class CatalogInfoHasOwnerEvaluatorTest {

  private static final RemoteRepository REPO =
      new RemoteRepository(42L, "service", "acme/service", false);

  @Mock private RepositoryGateway gateway;

  private CatalogInfoHasOwnerEvaluator evaluator;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    evaluator = new CatalogInfoHasOwnerEvaluator(gateway);
  }

  @Test
  void missingFileIsCompliant() {
    when(gateway.readFile(42L, "catalog-info.yaml")).thenReturn(Optional.empty());

    assertThat(evaluator.evaluate(REPO)).isEmpty();
  }

  @Test
  void ownerPresentIsCompliant() {
    when(gateway.readFile(42L, "catalog-info.yaml"))
        .thenReturn(
            Optional.of(
                """
                apiVersion: backstage.io/v1alpha1
                kind: Component
                metadata:
                  name: service
                spec:
                  type: service
                  owner: team-platform
                """));

    assertThat(evaluator.evaluate(REPO)).isEmpty();
  }

  @Test
  void blankOwnerIsViolation() {
    when(gateway.readFile(42L, "catalog-info.yaml"))
        .thenReturn(Optional.of("spec:\n  type: service\n  owner: \"  \"\n"));

    Optional<PolicyFinding> finding = evaluator.evaluate(REPO);

    assertThat(finding).isPresent();
    assertThat(finding.get().policyType()).isEqualTo(PolicyTypes.CATALOG_INFO_HAS_OWNER);
    assertThat(finding.get().detail()).contains("spec.owner");
  }

  @Test
  void missingSpecSectionIsViolation() {
    when(gateway.readFile(42L, "catalog-info.yaml"))
        .thenReturn(Optional.of("metadata:\n  name: service\n"));

    assertThat(evaluator.evaluate(REPO)).isPresent();
  }

  @Test
  void unparsableContentIsViolationNotError() {
    when(gateway.readFile(42L, "catalog-info.yaml"))
        .thenReturn(Optional.of("spec: [unclosed\n  owner: team"));

    Optional<PolicyFinding> finding = evaluator.evaluate(REPO);

    assertThat(finding).isPresent();
    assertThat(finding.get().detail()).contains("could not be parsed");
  }

  @Test
  void gatewayErrorsPropagate() {
    when(gateway.readFile(42L, "catalog-info.yaml"))
        .thenThrow(new GitHubClientException("rate limited", GitHubErrorKind.RATE_LIMITED, 403));

    assertThatThrownBy(() -> evaluator.evaluate(REPO)).isInstanceOf(GitHubClientException.class);
  }
}
