package com.cario.contimg.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.contimg.app.TestTables;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductType;
import com.cario.contimg.app.worker.CommandRunner;
import com.cario.contimg.app.worker.LocalWorkerLauncher;
import com.cario.contimg.app.worker.WorkerSessionManager;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class StageExecutionServiceTest {

  @Autowired private ProductRegistryService registry;

  @Autowired private JdbcTemplate jdbc;

  @BeforeEach
  void clean() {
    TestTables.clear(jdbc);
    registry.register(
        Product.builder()
            .dataId("ms-1")
            .dataType(ProductType.CONVERTED_SET)
            .stagingPath("/stage/ms/ms-1.ms")
            .build());
  }

  @Test
  void successfulHandlerAdvancesStageAndMergesMetadata() {
    StageExecutionService stages =
        new StageExecutionService(
            registry, List.of(handler(PipelineStage.CALIBRATED, p -> Map.of("solints", "inf"))));

    Product p = stages.advance("ms-1", PipelineStage.CALIBRATED);

    assertEquals(PipelineStage.CALIBRATED, p.getStage());
    assertEquals("inf", p.getMetadata().get("solints"));
    assertFalse(p.getMetadata().containsKey(StageExecutionService.LAST_STAGE_ERROR));
  }

  @Test
  void failedHandlerRecordsErrorAndKeepsStage() {
    StageExecutionService stages =
        new StageExecutionService(
            registry,
            List.of(
                handler(
                    PipelineStage.CALIBRATED,
                    p -> {
                      throw new PipelineException(ErrorKind.TOOL_FAILURE, "bandpass diverged");
                    })));

    PipelineException e =
        assertThrows(
            PipelineException.class, () -> stages.advance("ms-1", PipelineStage.CALIBRATED));
    assertEquals(ErrorKind.TOOL_FAILURE, e.getKind());

    Product p = registry.get("ms-1");
    assertEquals(PipelineStage.CONVERTED, p.getStage());
    assertEquals(
        "calibrated: bandpass diverged",
        p.getMetadata().get(StageExecutionService.LAST_STAGE_ERROR));
  }

  @Test
  void handlerErrorSurvivesUnrecordableMetadata() {
    String corrupt = "not json";
    jdbc.update("UPDATE products SET metadata_json = ? WHERE data_id = ?", corrupt, "ms-1");
    StageExecutionService stages =
        new StageExecutionService(
            registry,
            List.of(
                handler(
                    PipelineStage.CALIBRATED,
                    p -> {
                      throw new PipelineException(ErrorKind.TOOL_FAILURE, "bandpass diverged");
                    })));

    PipelineException e =
        assertThrows(
            PipelineException.class, () -> stages.advance("ms-1", PipelineStage.CALIBRATED));

    assertEquals(ErrorKind.TOOL_FAILURE, e.getKind());
    assertEquals(1, e.getSuppressed().length);
    assertEquals(
        corrupt,
        jdbc.queryForObject(
            "SELECT metadata_json FROM products WHERE data_id = 'ms-1'", String.class));
  }

  @Test
  void stageWithoutHandlerIsNotFound() {
    StageExecutionService stages = new StageExecutionService(registry, List.of());

    PipelineException e =
        assertThrows(PipelineException.class, () -> stages.advance("ms-1", PipelineStage.IMAGED));
    assertEquals(ErrorKind.NOT_FOUND, e.getKind());
    assertTrue(stages.supportedStages().isEmpty());
  }

  @Test
  void goingBackwardsIsRefused() {
    registry.updateStage("ms-1", PipelineStage.IMAGED, Map.of());
    StageExecutionService stages =
        new StageExecutionService(
            registry, List.of(handler(PipelineStage.CALIBRATED, p -> Map.of())));

    PipelineException e =
        assertThrows(
            PipelineException.class, () -> stages.advance("ms-1", PipelineStage.CALIBRATED));
    assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind());
  }

  @Test
  void twoHandlersForOneStageAreRejected() {
    assertThrows(
        IllegalStateException.class,
        () ->
            new StageExecutionService(
                registry,
                List.of(
                    handler(PipelineStage.IMAGED, p -> Map.of()),
                    handler(PipelineStage.IMAGED, p -> Map.of()))));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void workerCommandHandlerRunsInSession() {
    WorkerSessionManager worker =
        new WorkerSessionManager(
            new LocalWorkerLauncher(
                new CommandRunner(Duration.ofSeconds(1)), null, Clock.systemUTC()),
            Duration.ofSeconds(30),
            Duration.ofMinutes(10),
            3,
            Clock.systemUTC());
    try {
      StageExecutionService stages =
          new StageExecutionService(
              registry,
              List.of(
                  new WorkerCommandStageHandler(
                      worker,
                      PipelineStage.CALIBRATED,
                      List.of("sh", "-c", "echo {dataId} {stagingPath}"),
                      Duration.ofSeconds(30))));

      Product p = stages.advance("ms-1", PipelineStage.CALIBRATED);

      assertEquals(PipelineStage.CALIBRATED, p.getStage());
      assertEquals("ms-1 /stage/ms/ms-1.ms", p.getMetadata().get("calibrated.stdoutTail"));
      assertEquals(0, ((Number) p.getMetadata().get("calibrated.exitCode")).intValue());
    } finally {
      worker.stop();
    }
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void nonZeroExitIsToolFailure() {
    WorkerSessionManager worker =
        new WorkerSessionManager(
            new LocalWorkerLauncher(
                new CommandRunner(Duration.ofSeconds(1)), null, Clock.systemUTC()),
            Duration.ofSeconds(30),
            Duration.ofMinutes(10),
            3,
            Clock.systemUTC());
    try {
      WorkerCommandStageHandler handler =
          new WorkerCommandStageHandler(
              worker,
              PipelineStage.IMAGED,
              List.of("sh", "-c", "echo 'no visibilities' >&2; exit 4"),
              Duration.ofSeconds(30));

      PipelineException e =
          assertThrows(PipelineException.class, () -> handler.execute(registry.get("ms-1")));
      assertEquals(ErrorKind.TOOL_FAILURE, e.getKind());
      assertTrue(e.getMessage().contains("exited 4: no visibilities"));
    } finally {
      worker.stop();
    }
  }

  @Test
  void outputTailKeepsTheEnd() {
    String longOutput = "x".repeat(1000) + "done";

    String tail = WorkerCommandStageHandler.tail(longOutput);

    assertEquals(WorkerCommandStageHandler.OUTPUT_TAIL_CHARS, tail.length());
    assertTrue(tail.endsWith("done"));
  }

  private static StageHandler handler(
      PipelineStage stage, Function<Product, Map<String, Object>> body) {
    return new StageHandler() {
      @Override
      public PipelineStage stage() {
        return stage;
      }

      @Override
      public Map<String, Object> execute(Product product) {
        return body.apply(product);
      }
    };
  }
}
