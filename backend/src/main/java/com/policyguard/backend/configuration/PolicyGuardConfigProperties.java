package com.policyguard.backend.configuration;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "policy-guard.config")
public class PolicyGuardConfigProperties {

  private AccessControl accessControl = new AccessControl();
  private List<Policy> policies = new ArrayList<>();

  public AccessControl getAccessControl() {
    return accessControl;
  }

  public void setAccessControl(AccessControl accessControl) {
    this.accessControl = accessControl;
  }

  public List<Policy> getPolicies() {
    return policies;
  }

  public void setPolicies(List<Policy> policies) {
    this.policies = policies;
  }

  public static class AccessControl {

    private String authorizedTeam;

    public String getAuthorizedTeam() {
      return authorizedTeam;
    }

    public void setAuthorizedTeam(String authorizedTeam) {
      this.authorizedTeam = authorizedTeam;
    }
  }

  public static class Policy {

    private String name;
    private String type;
    private List<String> actions = new ArrayList<>();
    private IssueDetails issueDetails;
    private String prCommentMessage;
    private String statusCheckName;

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public List<String> getActions() {
      return actions;
    }

    public void setActions(List<String> actions) {
      this.actions = actions;
    }

    public IssueDetails getIssueDetails() {
      return issueDetails;
    }

    public void setIssueDetails(IssueDetails issueDetails) {
      this.issueDetails = issueDetails;
    }

    public String getPrCommentMessage() {
      return prCommentMessage;
    }

    public void setPrCommentMessage(String prCommentMessage) {
      this.prCommentMessage = prCommentMessage;
    }

    public String getStatusCheckName() {
      return statusCheckName;
    }

    public void setStatusCheckName(String statusCheckName) {
      this.statusCheckName = statusCheckName;
    }
  }

  public static class IssueDetails {

    private String title;
    private String body;
    private List<String> labels = new ArrayList<>();

    public String getTitle() {
      return title;
    }

    public void setTitle(String title) {
      this.title = title;
    }

    public String getBody() {
      return body;
    }

    public void setBody(String body) {
      this.body = body;
    }

    public List<String> getLabels() {
      return labels;
    }

    public void setLabels(List<String> labels) {
      this.labels = labels;
    }
  }
}
