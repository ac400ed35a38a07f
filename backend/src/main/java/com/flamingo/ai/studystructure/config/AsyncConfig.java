package com.flamingo.ai.studystructure.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for executors used during extraction. */
@Configuration
public class AsyncConfig {

  @Bean(name = "pageRetrievalExecutor")
  public Executor pageRetrievalExecutor(StructureConfig structureConfig) {
    int parallelism = Math.max(1, structureConfig.getPageRetrieval().getParallelism());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(parallelism);
    executor.setMaxPoolSize(parallelism);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("page-fetch-");
    executor.initialize();
    return executor;
  }
}
