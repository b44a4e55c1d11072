package com.policyguard.backend.auth;

import com.policyguard.backend.configuration.ConfigurationNotFoundException;
import com.policyguard.backend.configuration.ConfigurationProvider;
import com.policyguard.backend.configuration.InvalidConfigurationException;
import com.policyguard.backend.github.GitHubClientException;
import com.policyguard.backend.github.RepositoryGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides whether a signed-in user may operate the service: the user must be an active member of
 * the configured {@code org/team-slug}. Any configuration or remote failure denies access.
 */
@Service
public class TeamAuthorizationService {

  private static final Logger log = LoggerFactory.getLogger(TeamAuthorizationService.class);

  private final ConfigurationProvider configurationProvider;
  private final RepositoryGateway repositoryGateway;

  public TeamAuthorizationService(
      ConfigurationProvider configurationProvider, RepositoryGateway repositoryGateway) {
    this.configurationProvider = configurationProvider;
    this.repositoryGateway = repositoryGateway;
  }

  public boolean isUserAuthorized(String userToken) {
    if (!StringUtils.hasText(userToken)) {
      return false;
    }
    String authorizedTeam;
    try {
      authorizedTeam = configurationProvider.getConfig(false).authorizedTeam();
    } catch (ConfigurationNotFoundException | InvalidConfigurationException ex) {
      log.warn("Denying access: configuration unavailable ({})", ex.getMessage());
      return false;
    }
    int separator = authorizedTeam == null ? -1 : authorizedTeam.indexOf('/');
    if (separator <= 0 || separator == authorizedTeam.length() - 1) {
      log.warn(
          "Denying access: authorized team '{}' is not in the form org/team-slug", authorizedTeam);
      return false;
    }
    String organization = authorizedTeam.substring(0, separator).trim();
    String teamSlug = authorizedTeam.substring(separator + 1).trim();
    try {
      return repositoryGateway.isUserInTeam(userToken, organization, teamSlug);
    } catch (GitHubClientException ex) {
      log.warn(
          "Denying access: team membership check for {} failed ({})", authorizedTeam, ex.getKind());
      return false;
    }
  }
}
