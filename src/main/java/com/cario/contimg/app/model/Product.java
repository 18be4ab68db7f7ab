package com.cario.contimg.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registry row for one derived artifact (converted set, calibrated set, image or combined
 * product).
 *
 * <p>Products are addressed by {@code dataId}; the paths are storage locations only. Rows are never
 * deleted, a product that cannot be published ends in {@link ProductStatus#FAILED}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

  private Long id;

  private String dataId;

  private ProductType dataType;

  private PipelineStage stage;

  private String stagingPath;

  /** Null until published. */
  private String publishedPath;

  @Builder.Default private ProductStatus status = ProductStatus.STAGING;

  private int publishAttempts;

  /** Last publish error, truncated. */
  private String publishError;

  /** Lineage: the group this product was derived from, if any. */
  private String groupId;

  /** Lineage: the product this one was derived from, if any. */
  private String parentDataId;

  @Builder.Default private QaStatus qaStatus = QaStatus.PENDING;

  @Builder.Default private ValidationStatus validationStatus = ValidationStatus.PENDING;

  private boolean finalized;

  @Builder.Default private boolean autoPublish = true;

  /** auto | manual, set when published. */
  private String publishMode;

  private Map<String, Object> metadata;

  /** Stored metadata could not be parsed; updates leave the stored JSON untouched. */
  @JsonIgnore private boolean metadataUnreadable;

  private Instant createdAt;

  private Instant updatedAt;

  private Instant publishedAt;

  /** Set when the row enters {@link ProductStatus#PUBLISHING}; used to detect stuck rows. */
  private Instant publishingStartedAt;
}
