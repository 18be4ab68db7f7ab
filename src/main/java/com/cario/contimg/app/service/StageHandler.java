package com.cario.contimg.app.service;

import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import java.util.Map;

/**
 * Does the work that moves a product into one stage. Implementations must be safe to run again
 * for the same product.
 */
public interface StageHandler {

  PipelineStage stage();

  /** @return metadata to merge into the product when the stage completes */
  Map<String, Object> execute(Product product);
}
