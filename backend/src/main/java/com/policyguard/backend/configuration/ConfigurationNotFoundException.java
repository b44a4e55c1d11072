package com.policyguard.backend.configuration;

public class ConfigurationNotFoundException extends RuntimeException {

  public ConfigurationNotFoundException(String message) {
    super(message);
  }
}
