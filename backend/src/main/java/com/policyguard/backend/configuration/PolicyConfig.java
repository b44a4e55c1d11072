package com.policyguard.backend.configuration;

import java.util.List;

public record PolicyConfig(
    String name,
    String type,
    List<String> actions,
    IssueDetails issueDetails,
    PrCommentDetails prCommentDetails,
    BlockPrsDetails blockPrsDetails) {

  public PolicyConfig {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("policy type must not be blank");
    }
    type = type.trim();
    name = name == null || name.isBlank() ? type : name.trim();
    actions =
        actions == null
            ? List.of()
            : actions.stream().filter(a -> a != null && !a.isBlank()).map(String::trim).toList();
  }

  public record IssueDetails(String title, String body, List<String> labels) {

    public IssueDetails {
      labels = labels == null ? List.of() : List.copyOf(labels);
    }
  }

  public record PrCommentDetails(String message) {}

  public record BlockPrsDetails(String statusCheckName) {}
}
