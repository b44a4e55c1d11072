package com.policyguard.backend;

import com.policyguard.backend.config.GitHubAppProperties;
import com.policyguard.backend.config.JobWorkerProperties;
import com.policyguard.backend.config.ScanProperties;
import com.policyguard.backend.configuration.PolicyGuardConfigProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
  GitHubAppProperties.class,
  ScanProperties.class,
  JobWorkerProperties.class,
  PolicyGuardConfigProperties.class
})
public class PolicyGuardApplication {

  public static void main(String[] args) {
    SpringApplication.run(PolicyGuardApplication.class, args);
  }
}
