package com.scholary.mix.analyzer.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for batch comparisons.
 *
 * <p>Sets up a bounded thread pool for song/mix comparisons. When the queue is full the pool
 * rejects the submission; {@code MixAnalysisService} then waits for an earlier comparison and
 * resubmits, so every comparison runs on a worker under its time limit.
 */
@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisConfig {

  @Bean(name = "analysisExecutor")
  public Executor analysisExecutor(AnalysisProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueSize());
    executor.setThreadNamePrefix("analysis-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.initialize();
    return executor;
  }
}
