package com.policyguard.backend.remediation;

import static com.policyguard.backend.support.TestFields.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.policyguard.backend.compliance.domain.ActionOutcome;
import com.policyguard.backend.compliance.domain.Policy;
import com.policyguard.backend.compliance.domain.PolicyViolation;
import com.policyguard.backend.compliance.domain.TrackedRepository;
import com.policyguard.backend.compliance.persistence.PolicyViolationRepository;
import com.policyguard.backend.configuration.AppConfig;
import com.policyguard.backend.configuration.ConfigurationProvider;
import com.policyguard.backend.configuration.PolicyConfig;
import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.GitHubErrorKind;
import com.policyguard.backend.github.RemoteIssue;
import com.policyguard.backend.github.RemoteRepository;
import com.policyguard.backend.github.RepositoryGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

class RemediationExecutorTest {

  private static final long SCAN_ID = 11L;

  @Mock private PolicyViolationRepository violationRepository;
  @Mock private ConfigurationProvider configurationProvider;
  @Mock private ActionLogWriter actionLogWriter;
  @Mock private RepositoryGateway gateway;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<Recorded> recorded = new ArrayList<>();
  private RemediationExecutor executor;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    executor =
        new RemediationExecutor(
            violationRepository,
            configurationProvider,
            actionLogWriter,
            meterRegistry,
            List.of(
                new CreateIssueAction(gateway),
                new ArchiveRepositoryAction(gateway),
                new LogOnlyAction(),
                new CommentOnPullRequestsAction(new PullRequestFeedback(gateway)),
                new BlockPullRequestsAction(new PullRequestFeedback(gateway))));
    when(configurationProvider.getConfig(false)).thenReturn(new AppConfig("acme/admins", List.of()));
    when(actionLogWriter.record(any(RemediationContext.class), anyString(), any(ActionResult.class)))
        .thenAnswer(
            invocation -> {
              recorded.add(
                  new Recorded(
                      invocation.getArgument(0),
                      invocation.getArgument(1),
                      invocation.getArgument(2)));
              return true;
            });
  }

  @Test
  void createsIssueWhenNoneIsOpen() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "create-issue")));
    when(gateway.listOpenIssues(100L, "policy-violation")).thenReturn(List.of());
    when(gateway.createIssue(
            eq(100L), eq("Compliance Violation: AGENTS.md required"), anyString(), anyList()))
        .thenReturn(
            new RemoteIssue(
                17, "Compliance Violation: AGENTS.md required", "https://github.com/acme/svc/issues/17", List.of()));

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(recorded).singleElement().satisfies(entry -> {
      assertThat(entry.actionType()).isEqualTo("create-issue");
      assertThat(entry.result().outcome()).isEqualTo(ActionOutcome.SUCCESS);
      assertThat(entry.result().details()).contains("issues/17");
    });
    verify(gateway)
        .createIssue(
            eq(100L),
            anyString(),
            anyString(),
            eq(List.of("policy-violation", "compliance")));
  }

  @Test
  void matchingOpenIssueIsNotDuplicated() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "create-issue")));
    when(gateway.listOpenIssues(100L, "policy-violation"))
        .thenReturn(
            List.of(
                new RemoteIssue(
                    4, "compliance violation: agents.md REQUIRED", "https://github.com/acme/svc/issues/4", List.of("policy-violation"))));

    executor.processActionsForScan(SCAN_ID);

    verify(gateway, never()).createIssue(anyLong(), anyString(), anyString(), anyList());
    assertThat(recorded).singleElement().satisfies(entry -> {
      assertThat(entry.result().outcome()).isEqualTo(ActionOutcome.SKIPPED);
      assertThat(entry.result().details()).contains("#4");
    });
  }

  @Test
  void configuredIssueTemplateIsUsed() {
    PolicyConfig config =
        new PolicyConfig(
            "AGENTS.md required",
            "has-agents-md",
            List.of("create-issue"),
            new PolicyConfig.IssueDetails("Add AGENTS.md", "Please add it", List.of("docs")),
            null,
            null);
    when(configurationProvider.getConfig(false)).thenReturn(new AppConfig("acme/admins", List.of(config)));
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "create-issue")));
    when(gateway.listOpenIssues(100L, "docs")).thenReturn(List.of());
    when(gateway.createIssue(100L, "Add AGENTS.md", "Please add it", List.of("docs")))
        .thenReturn(new RemoteIssue(2, "Add AGENTS.md", "https://github.com/acme/svc/issues/2", List.of("docs")));

    executor.processActionsForScan(SCAN_ID);

    verify(gateway).createIssue(100L, "Add AGENTS.md", "Please add it", List.of("docs"));
  }

  @Test
  void alreadyArchivedRepositoryIsSkippedWithoutArchiveCall() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "archive-repo")));
    when(gateway.getSettings(100L))
        .thenReturn(Optional.of(new RemoteRepository(100L, "svc", "acme/svc", true)));

    executor.processActionsForScan(SCAN_ID);

    verify(gateway, never()).archiveRepository(anyLong());
    assertThat(recorded).singleElement().satisfies(entry ->
        assertThat(entry.result().outcome()).isEqualTo(ActionOutcome.SKIPPED));
  }

  @Test
  void forbiddenArchiveIsRecordedAsFailure() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "archive_repo")));
    when(gateway.getSettings(100L))
        .thenReturn(Optional.of(new RemoteRepository(100L, "svc", "acme/svc", false)));
    doThrow(new GitHubClientException("Must have admin rights", GitHubErrorKind.FORBIDDEN, 403))
        .when(gateway)
        .archiveRepository(100L);

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.failed()).isEqualTo(1);
    assertThat(recorded).singleElement().satisfies(entry -> {
      assertThat(entry.actionType()).isEqualTo("archive-repo");
      assertThat(entry.result().outcome()).isEqualTo(ActionOutcome.FAILED);
      assertThat(entry.result().details()).contains("FORBIDDEN");
    });
  }

  @Test
  void oneFailingActionDoesNotStopTheRest() {
    givenViolations(
        violation(1L, 100L, "first", policy(3L, "has_agents_md", "create-issue")),
        violation(2L, 200L, "second", policy(3L, "has_agents_md", "create-issue")));
    when(gateway.listOpenIssues(100L, "policy-violation"))
        .thenThrow(new RuntimeException("connection reset"));
    when(gateway.listOpenIssues(200L, "policy-violation")).thenReturn(List.of());
    when(gateway.createIssue(eq(200L), anyString(), anyString(), anyList()))
        .thenReturn(new RemoteIssue(1, "t", "https://github.com/acme/second/issues/1", List.of()));

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(recorded)
        .extracting(entry -> entry.result().outcome())
        .containsExactly(ActionOutcome.FAILED, ActionOutcome.SUCCESS);
  }

  @Test
  void failedAuditWriteCountsAsFailureAndLaterRowsContinue() {
    givenViolations(
        violation(1L, 100L, "first", policy(3L, "has_agents_md", "log-only")),
        violation(2L, 200L, "second", policy(3L, "has_agents_md", "log-only")));
    when(actionLogWriter.record(any(RemediationContext.class), anyString(), any(ActionResult.class)))
        .thenAnswer(
            invocation -> {
              RemediationContext context = invocation.getArgument(0);
              if ("first".equals(context.repositoryName())) {
                throw new DataAccessResourceFailureException("connection lost");
              }
              recorded.add(
                  new Recorded(context, invocation.getArgument(1), invocation.getArgument(2)));
              return true;
            });

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(recorded)
        .extracting(entry -> entry.context().repositoryName())
        .containsExactly("second");
  }

  @Test
  void failedDuplicateCheckCountsAsFailure() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "log-only")));
    when(actionLogWriter.alreadyLogged(any(RemediationContext.class), eq("log-only")))
        .thenThrow(new DataAccessResourceFailureException("connection lost"));

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.failed()).isEqualTo(1);
    assertThat(recorded).isEmpty();
  }

  @Test
  void violationWithoutRepositoryIsCountedAndSkipped() {
    PolicyViolation broken = violation(1L, 100L, "svc", policy(3L, "has_agents_md", "log-only"));
    setField(broken, "repository", null);
    givenViolations(broken, violation(2L, 200L, "second", policy(3L, "has_agents_md", "log-only")));

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.succeeded()).isEqualTo(1);
  }

  @Test
  void unknownActionIsRecordedAsFailure() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "notify-slack")));

    executor.processActionsForScan(SCAN_ID);

    assertThat(recorded).singleElement().satisfies(entry -> {
      assertThat(entry.actionType()).isEqualTo("notify-slack");
      assertThat(entry.result().outcome()).isEqualTo(ActionOutcome.FAILED);
    });
  }

  @Test
  void everyBoundActionRunsIndependently() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "log-only", "comment-on-prs")));
    when(gateway.listOpenPullRequests(100L)).thenReturn(List.of());

    executor.processActionsForScan(SCAN_ID);

    assertThat(recorded)
        .extracting(Recorded::actionType, entry -> entry.result().outcome())
        .containsExactly(
            tuple("log-only", ActionOutcome.SUCCESS),
            tuple("comment-on-prs", ActionOutcome.SKIPPED));
  }

  @Test
  void actionAlreadyLoggedForTheScanIsNotRepeated() {
    givenViolations(violation(1L, 100L, "svc", policy(3L, "has_agents_md", "archive-repo")));
    when(actionLogWriter.alreadyLogged(any(RemediationContext.class), eq("archive-repo")))
        .thenReturn(true);

    RemediationReport report = executor.processActionsForScan(SCAN_ID);

    assertThat(report.alreadyProcessed()).isEqualTo(1);
    assertThat(recorded).isEmpty();
    verify(gateway, never()).getSettings(anyLong());
  }

  private void givenViolations(PolicyViolation... violations) {
    when(violationRepository.findByScanIdWithDetails(SCAN_ID)).thenReturn(List.of(violations));
  }

  private static Policy policy(long id, String key, String... actions) {
    Policy policy = new Policy(key, "AGENTS.md required");
    policy.setActionList(List.of(actions));
    setField(policy, "id", id);
    return policy;
  }

  private static PolicyViolation violation(
      long repositoryId, long githubId, String name, Policy policy) {
    TrackedRepository repository = new TrackedRepository(githubId, name);
    setField(repository, "id", repositoryId);
    try {
      java.lang.reflect.Constructor<PolicyViolation> constructor =
          PolicyViolation.class.getDeclaredConstructor();
      constructor.setAccessible(true);
      PolicyViolation violation = constructor.newInstance();
      setField(violation, "repository", repository);
      setField(violation, "policy", policy);
      setField(violation, "detail", "AGENTS.md is missing from the repository root");
      return violation;
    } catch (ReflectiveOperationException exception) {
      throw new RuntimeException(exception);
    }
  }

  private record Recorded(RemediationContext context, String actionType, ActionResult result) {}
}
