package com.cario.contimg.app.service;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * Runs the registered {@link StageHandler} for a product and records the result on the registry
 * row. A failed handler leaves the stage unchanged and stores the error under {@code
 * lastStageError}.
 */
@Log4j2
public class StageExecutionService {

  static final String LAST_STAGE_ERROR = "lastStageError";

  private final ProductRegistryService registry;
  private final Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);

  public StageExecutionService(ProductRegistryService registry, List<StageHandler> handlers) {
    this.registry = registry;
    for (StageHandler h : handlers) {
      StageHandler previous = this.handlers.put(h.stage(), h);
      if (previous != null) {
        throw new IllegalStateException("Two handlers for stage " + h.stage());
      }
    }
  }

  public Set<PipelineStage> supportedStages() {
    return handlers.keySet();
  }

  public Product advance(String dataId, PipelineStage stage) {
    StageHandler handler = handlers.get(stage);
    if (handler == null) {
      throw new PipelineException(ErrorKind.NOT_FOUND, "No handler for stage " + stage.value());
    }
    Product product = registry.get(dataId);
    if (!product.getStage().canAdvanceTo(stage)) {
      throw new PipelineException(
          ErrorKind.INVALID_TRANSITION,
          "Product " + dataId + " is at " + product.getStage().value() + ", past " + stage.value());
    }

    log.info("stage.start dataId={} stage={}", dataId, stage.value());
    Map<String, Object> produced;
    try {
      produced = handler.execute(product);
    } catch (RuntimeException e) {
      Map<String, Object> error = new HashMap<>();
      error.put(LAST_STAGE_ERROR, registry.truncate(stage.value() + ": " + e.getMessage()));
      try {
        registry.updateMetadata(dataId, error);
      } catch (RuntimeException recordFailure) {
        e.addSuppressed(recordFailure);
      }
      log.warn("stage.failed dataId={} stage={} msg={}", dataId, stage.value(), e.getMessage());
      throw e;
    }

    Map<String, Object> patch = new LinkedHashMap<>();
    if (produced != null) {
      patch.putAll(produced);
    }
    patch.put(LAST_STAGE_ERROR, null);
    Product updated = registry.updateStage(dataId, stage, patch);
    log.info("stage.ok dataId={} stage={}", dataId, stage.value());
    return updated;
  }
}
