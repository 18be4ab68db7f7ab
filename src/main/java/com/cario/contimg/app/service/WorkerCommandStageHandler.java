package com.cario.contimg.app.service;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.worker.ExecResult;
import com.cario.contimg.app.worker.WorkerSessionManager;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a configured command in the worker session. {@code {stagingPath}} is replaced by the
 * worker-visible staging path and {@code {dataId}} by the product id.
 */
public class WorkerCommandStageHandler implements StageHandler {

  static final int OUTPUT_TAIL_CHARS = 400;

  private final WorkerSessionManager worker;
  private final PipelineStage stage;
  private final List<String> template;
  private final Duration timeout;

  public WorkerCommandStageHandler(
      WorkerSessionManager worker, PipelineStage stage, List<String> template, Duration timeout) {
    if (template == null || template.isEmpty()) {
      throw new IllegalArgumentException("command template must not be empty");
    }
    this.worker = worker;
    this.stage = stage;
    this.template = List.copyOf(template);
    this.timeout = timeout;
  }

  @Override
  public PipelineStage stage() {
    return stage;
  }

  @Override
  public Map<String, Object> execute(Product product) {
    String workerPath = worker.toWorkerPath(Paths.get(product.getStagingPath()));
    List<String> command =
        template.stream()
            .map(
                arg ->
                    arg.replace("{stagingPath}", workerPath)
                        .replace("{dataId}", product.getDataId()))
            .collect(Collectors.toList());
    ExecResult result = worker.exec(command, timeout);
    if (!result.isSuccess()) {
      throw new PipelineException(
          ErrorKind.TOOL_FAILURE,
          command.get(0) + " exited " + result.getExitCode() + ": " + tail(result.getStderr()));
    }
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put(stage.value() + ".exitCode", result.getExitCode());
    meta.put(stage.value() + ".durationMs", result.getDurationMs());
    meta.put(stage.value() + ".stdoutTail", tail(result.getStdout()));
    return meta;
  }

  static String tail(String text) {
    if (text == null) {
      return "";
    }
    String trimmed = text.trim();
    return trimmed.length() <= OUTPUT_TAIL_CHARS
        ? trimmed
        : trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
  }
}
