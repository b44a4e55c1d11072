package com.policyguard.backend.policy;

import java.util.Locale;

public final class PolicyTypes {

  public static final String HAS_AGENTS_MD = "has_agents_md";
  public static final String HAS_CATALOG_INFO_YAML = "has_catalog_info_yaml";
  public static final String CORRECT_WORKFLOW_PERMISSIONS = "correct_workflow_permissions";
  public static final String CATALOG_INFO_HAS_OWNER = "catalog_info_has_owner";

  private PolicyTypes() {}

  /** Canonical form of a type tag: trimmed, lower-case, with '-' read as '_'. */
  public static String normalize(String type) {
    if (type == null) {
      return "";
    }
    return type.trim().toLowerCase(Locale.ROOT).replace('-', '_');
  }
}
