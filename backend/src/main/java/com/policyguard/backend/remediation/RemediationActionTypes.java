package com.policyguard.backend.remediation;

import java.util.Locale;

public final class RemediationActionTypes {

  public static final String CREATE_ISSUE = "create-issue";
  public static final String ARCHIVE_REPO = "archive-repo";
  public static final String LOG_ONLY = "log-only";
  public static final String COMMENT_ON_PRS = "comment-on-prs";
  public static final String BLOCK_PRS = "block-prs";

  private RemediationActionTypes() {}

  /** Lower-case with '_' read as '-'. */
  public static String normalize(String action) {
    if (action == null) {
      return "";
    }
    return action.trim().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
