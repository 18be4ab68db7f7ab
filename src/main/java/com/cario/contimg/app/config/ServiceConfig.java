package com.cario.contimg.app.config;

import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.repository.jdbc.GroupRepository;
import com.cario.contimg.app.repository.jdbc.IngestUnitRepository;
import com.cario.contimg.app.repository.jdbc.ProductRepository;
import com.cario.contimg.app.repository.jdbc.SchemaMigrator;
import com.cario.contimg.app.service.FileSystemStorageMover;
import com.cario.contimg.app.service.GroupFormationService;
import com.cario.contimg.app.service.GroupIdGenerator;
import com.cario.contimg.app.service.IngestQueueService;
import com.cario.contimg.app.service.ProductRegistryService;
import com.cario.contimg.app.service.PublishService;
import com.cario.contimg.app.service.StageExecutionService;
import com.cario.contimg.app.service.StageHandler;
import com.cario.contimg.app.service.StorageMover;
import com.cario.contimg.app.service.WorkerCommandStageHandler;
import com.cario.contimg.app.worker.CommandRunner;
import com.cario.contimg.app.worker.ContainerWorkerLauncher;
import com.cario.contimg.app.worker.LocalWorkerLauncher;
import com.cario.contimg.app.worker.WorkerLauncher;
import com.cario.contimg.app.worker.WorkerSessionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final PipelineProperties props;
  private final JdbcTemplate jdbcTemplate;

  // -------------------
  // Infrastructure
  // -------------------

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TransactionTemplate transactionTemplate(PlatformTransactionManager txManager) {
    return new TransactionTemplate(txManager);
  }

  @Bean(initMethod = "migrate")
  public SchemaMigrator schemaMigrator() {
    return new SchemaMigrator(jdbcTemplate);
  }

  // -------------------
  // Repositories
  // -------------------

  @Bean
  @DependsOn("schemaMigrator")
  public IngestUnitRepository ingestUnitRepository() {
    return new IngestUnitRepository(jdbcTemplate);
  }

  @Bean
  @DependsOn("schemaMigrator")
  public GroupRepository groupRepository() {
    return new GroupRepository(jdbcTemplate);
  }

  @Bean
  @DependsOn("schemaMigrator")
  public ProductRepository productRepository(ObjectMapper om) {
    return new ProductRepository(jdbcTemplate, om);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public IngestQueueService ingestQueueService(
      IngestUnitRepository units, TransactionTemplate tx, Clock clock) {
    return new IngestQueueService(units, tx, clock);
  }

  @Bean
  public GroupFormationService groupFormationService(
      IngestQueueService ingestQueue, GroupRepository groups, TransactionTemplate tx, Clock clock) {
    return new GroupFormationService(
        ingestQueue, groups, tx, new GroupIdGenerator(clock), props, clock);
  }

  @Bean
  public ProductRegistryService productRegistryService(
      ProductRepository products, TransactionTemplate tx, Clock clock) {
    return new ProductRegistryService(products, tx, props, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public StorageMover storageMover() {
    return new FileSystemStorageMover();
  }

  @Bean
  public PublishService publishService(
      ProductRepository products,
      TransactionTemplate tx,
      StorageMover mover,
      @Qualifier("storageIoExecutor") AsyncTaskExecutor storageIoExecutor,
      Clock clock)
      throws IOException {
    PipelineProperties.Storage storage = props.getStorage();
    Files.createDirectories(Paths.get(storage.getStagingRoot()));
    Files.createDirectories(Paths.get(storage.getProductionRoot()));
    log.info(
        "publish.roots staging={} production={} maxAttempts={}",
        storage.getStagingRoot(),
        storage.getProductionRoot(),
        props.getPublish().getMaxAttempts());
    return new PublishService(products, tx, mover, storageIoExecutor, props, clock);
  }

  // -------------------
  // Worker
  // -------------------

  @Bean
  public CommandRunner commandRunner() {
    return new CommandRunner(props.getWorker().getKillGrace());
  }

  @Bean
  public WorkerLauncher workerLauncher(CommandRunner runner, Clock clock) {
    PipelineProperties.Worker worker = props.getWorker();
    if ("container".equalsIgnoreCase(worker.getLauncher())) {
      log.info(
          "worker.launcher container runtime={} image={}", worker.getRuntime(), worker.getImage());
      return new ContainerWorkerLauncher(runner, worker, clock);
    }
    log.info("worker.launcher local workDir={}", worker.getWorkDir());
    return new LocalWorkerLauncher(runner, worker.getWorkDir(), clock);
  }

  @Bean(destroyMethod = "stop")
  public WorkerSessionManager workerSessionManager(WorkerLauncher launcher, Clock clock) {
    PipelineProperties.Worker worker = props.getWorker();
    return new WorkerSessionManager(
        launcher,
        worker.getCommandTimeout(),
        worker.getRestartWindow(),
        worker.getMaxRestartsInWindow(),
        clock);
  }

  @Bean
  @ConditionalOnProperty(prefix = "pipeline.worker", name = "stage-command-stage")
  public WorkerCommandStageHandler workerCommandStageHandler(WorkerSessionManager worker) {
    PipelineProperties.Worker settings = props.getWorker();
    return new WorkerCommandStageHandler(
        worker,
        PipelineStage.fromValue(settings.getStageCommandStage()),
        settings.getStageCommand(),
        settings.getCommandTimeout());
  }

  @Bean
  public StageExecutionService stageExecutionService(
      ProductRegistryService registry, ObjectProvider<StageHandler> handlers) {
    return new StageExecutionService(
        registry, handlers.orderedStream().collect(Collectors.toList()));
  }
}
