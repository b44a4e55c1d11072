package com.policyguard.backend.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JobWorkerConfiguration {

  @Bean(name = "jobWorkerExecutor", destroyMethod = "shutdown")
  public ExecutorService jobWorkerExecutor(JobWorkerProperties properties) {
    int concurrency = properties.getMaxConcurrency();
    ThreadFactory threadFactory =
        new ThreadFactory() {
          private final AtomicInteger index = new AtomicInteger();

          @Override
          public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("policy-job-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
          }
        };

    return Executors.newFixedThreadPool(concurrency, threadFactory);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
