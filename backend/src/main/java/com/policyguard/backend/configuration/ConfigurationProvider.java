package com.policyguard.backend.configuration;

public interface ConfigurationProvider {

  /**
   * Returns the active configuration.
   *
   * @throws ConfigurationNotFoundException when no configuration is available
   * @throws InvalidConfigurationException when the configuration fails validation
   */
  AppConfig getConfig(boolean forceRefresh);
}
