package com.policyguard.backend.github;

import java.util.Locale;

public record RemoteComment(String authorLogin, String authorType, String body) {

  public boolean isFromBot() {
    if ("Bot".equalsIgnoreCase(authorType)) {
      return true;
    }
    return authorLogin != null && authorLogin.toLowerCase(Locale.ROOT).endsWith("[bot]");
  }
}
