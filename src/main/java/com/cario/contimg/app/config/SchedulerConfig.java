package com.cario.contimg.app.config;

import com.cario.contimg.app.scheduler.GroupFormationScheduler;
import com.cario.contimg.app.scheduler.IngestDirectoryScheduler;
import com.cario.contimg.app.scheduler.PublishScheduler;
import com.cario.contimg.app.service.GroupFormationService;
import com.cario.contimg.app.service.IngestQueueService;
import com.cario.contimg.app.service.PublishService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:4}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("pipeline-scheduler-");

    // Log any uncaught exception thrown by @Scheduled methods
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));

    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);

    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);

    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  /** Blocking filesystem moves run here so callers can enforce a deadline on them. */
  @Bean
  public ThreadPoolTaskExecutor storageIoExecutor(PipelineProperties props) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    int threads = Math.max(1, props.getStorage().getIoThreads());
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("storage-io-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    log.info("storageIoExecutor initialized threads={}", threads);
    return executor;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "pipeline.ingest",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public IngestDirectoryScheduler ingestDirectoryScheduler(
      IngestQueueService queue, PipelineProperties props) {
    return new IngestDirectoryScheduler(queue, props.getIngest());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "pipeline.grouping",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public GroupFormationScheduler groupFormationScheduler(GroupFormationService formation) {
    return new GroupFormationScheduler(formation);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "pipeline.publish",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public PublishScheduler publishScheduler(PublishService publish) {
    return new PublishScheduler(publish);
  }
}
