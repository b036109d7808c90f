package com.flamingo.ai.reportextract.config;

import java.util.concurrent.ThreadPoolExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the batch worker pool. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final ExtractionConfig extractionConfig;

  @Bean(name = "documentExtractionExecutor")
  public ThreadPoolTaskExecutor documentExtractionExecutor() {
    int workers = Math.max(1, extractionConfig.getBatch().getWorkers());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(extractionConfig.getBatch().getQueueCapacity());
    executor.setThreadNamePrefix("doc-extract-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
