package com.policyguard.backend.github;

import java.util.List;

public record RemoteIssue(int number, String title, String htmlUrl, List<String> labels) {

  public RemoteIssue {
    labels = labels == null ? List.of() : List.copyOf(labels);
  }
}
