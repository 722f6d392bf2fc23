package com.scholary.vocalization.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the pipeline thread pools.
 *
 * <p>The worker pool runs one pipeline task per admitted job; its bounded queue is the job queue,
 * and a full queue fails new jobs with QUEUE_FULL. Workers block on inference calls running in the
 * separate inference pool, which lets them enforce the job timeout. The inference pool has headroom
 * for calls that keep running after a timeout because the backend ignores interrupts.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "inferenceExecutor")
  public ThreadPoolTaskExecutor inferenceExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads() * 2);
    executor.setQueueCapacity(properties.workerThreads());
    executor.setThreadNamePrefix("inference-");
    executor.initialize();
    return executor;
  }
}
