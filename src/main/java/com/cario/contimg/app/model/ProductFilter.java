package com.cario.contimg.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional criteria for listing products; null fields do not filter. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductFilter {

  private ProductStatus status;

  private ProductType dataType;

  private PipelineStage stage;

  private String groupId;

  private String parentDataId;

  @Builder.Default private int limit = 500;

  public static ProductFilter all() {
    return ProductFilter.builder().build();
  }
}
