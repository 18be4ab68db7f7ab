package com.cario.contimg.app.service;

import com.cario.contimg.app.config.PipelineProperties;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.AttentionReport;
import com.cario.contimg.app.model.AutoPublishCheck;
import com.cario.contimg.app.model.Lineage;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductFilter;
import com.cario.contimg.app.model.ProductStatus;
import com.cario.contimg.app.model.QaStatus;
import com.cario.contimg.app.model.ValidationStatus;
import com.cario.contimg.app.repository.jdbc.ProductRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Product registry: registration, stage tracking, finalization, auto-publish criteria and lineage.
 *
 * <p>Every read-modify-write takes the row lock first, so concurrent updates to one product are
 * serialized and never lose each other's changes.
 */
@Log4j2
public class ProductRegistryService {

  public static final String REL_DERIVED_FROM = "derived_from";
  public static final String REL_GROUP_OUTPUT = "group_output";

  private final ProductRepository products;
  private final TransactionTemplate tx;
  private final PipelineProperties.Publish publishSettings;
  private final Clock clock;

  public ProductRegistryService(
      ProductRepository products,
      TransactionTemplate tx,
      PipelineProperties props,
      Clock clock) {
    this.products = products;
    this.tx = tx;
    this.publishSettings = props.getPublish();
    this.clock = clock;
  }

  /**
   * Registers a new product in staging. Lineage edges to the parent product and source group are
   * recorded with it.
   *
   * @throws PipelineException {@link ErrorKind#DUPLICATE_DATA_ID} if the id is taken
   */
  public Product register(Product request) {
    if (request.getDataId() == null || request.getDataId().isBlank()) {
      throw new IllegalArgumentException("dataId must not be blank");
    }
    if (request.getDataType() == null) {
      throw new IllegalArgumentException("dataType is required");
    }
    if (request.getStagingPath() == null || request.getStagingPath().isBlank()) {
      throw new IllegalArgumentException("stagingPath must not be blank");
    }
    Instant now = clock.instant();
    Product row =
        request.toBuilder()
            .id(null)
            .stage(
                request.getStage() != null
                    ? request.getStage()
                    : PipelineStage.initialFor(request.getDataType()))
            .status(ProductStatus.STAGING)
            .publishedPath(null)
            .publishAttempts(0)
            .publishError(null)
            .publishMode(null)
            .publishedAt(null)
            .publishingStartedAt(null)
            .qaStatus(request.getQaStatus() != null ? request.getQaStatus() : QaStatus.PENDING)
            .validationStatus(
                request.getValidationStatus() != null
                    ? request.getValidationStatus()
                    : ValidationStatus.PENDING)
            .metadata(
                request.getMetadata() == null
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(request.getMetadata()))
            .createdAt(now)
            .updatedAt(now)
            .build();
    try {
      tx.executeWithoutResult(
          status -> {
            products.insert(row);
            if (row.getParentDataId() != null) {
              products.link(row.getParentDataId(), row.getDataId(), REL_DERIVED_FROM, now);
            }
            if (row.getGroupId() != null) {
              products.link(row.getGroupId(), row.getDataId(), REL_GROUP_OUTPUT, now);
            }
          });
    } catch (DuplicateKeyException e) {
      throw new PipelineException(
          ErrorKind.DUPLICATE_DATA_ID, "Product already registered: " + row.getDataId(), e);
    }
    log.info(
        "registry.register dataId={} type={} stage={} groupId={}",
        row.getDataId(),
        row.getDataType().value(),
        row.getStage().value(),
        row.getGroupId());
    return get(row.getDataId());
  }

  public Product get(String dataId) {
    return products
        .findByDataId(dataId)
        .orElseThrow(() -> PipelineException.notFound("Product", dataId));
  }

  public Optional<Product> find(String dataId) {
    return products.findByDataId(dataId);
  }

  public List<Product> list(ProductFilter filter) {
    return products.list(filter == null ? ProductFilter.all() : filter);
  }

  /**
   * Advances the stage and merges metadata in one locked update. A null metadata value removes the
   * key.
   *
   * @throws PipelineException {@link ErrorKind#INVALID_TRANSITION} when the stage would go back
   */
  public Product updateStage(String dataId, PipelineStage stage, Map<String, Object> metadata) {
    Product updated =
        mutate(
            dataId,
            p -> {
              if (!p.getStage().canAdvanceTo(stage)) {
                throw new PipelineException(
                    ErrorKind.INVALID_TRANSITION,
                    "Product " + dataId + " cannot go from " + p.getStage() + " to " + stage);
              }
              p.setStage(stage);
              applyMetadata(p, metadata);
            });
    log.info("registry.stage dataId={} stage={}", dataId, stage.value());
    return updated;
  }

  public Product updateMetadata(String dataId, Map<String, Object> metadata) {
    return mutate(dataId, p -> applyMetadata(p, metadata));
  }

  /** Marks processing finished and records the QA and validation verdicts. */
  public Product finalizeProduct(String dataId, QaStatus qa, ValidationStatus validation) {
    Product updated =
        mutate(
            dataId,
            p -> {
              requireNotPublished(p, "finalize");
              p.setFinalized(true);
              if (qa != null) {
                p.setQaStatus(qa);
              }
              if (validation != null) {
                p.setValidationStatus(validation);
              }
            });
    log.info(
        "registry.finalize dataId={} qa={} validation={}",
        dataId,
        updated.getQaStatus().value(),
        updated.getValidationStatus().value());
    return updated;
  }

  public Product setAutoPublish(String dataId, boolean enabled) {
    Product updated = mutate(dataId, p -> p.setAutoPublish(enabled));
    log.info("registry.auto-publish dataId={} enabled={}", dataId, enabled);
    return updated;
  }

  /**
   * Takes a product out of the publish flow for good. The row stays for audit.
   *
   * @throws PipelineException {@link ErrorKind#INVALID_TRANSITION} if it is already published or
   *     currently being moved
   */
  public Product markFailed(String dataId, String reason) {
    Product updated =
        mutate(
            dataId,
            p -> {
              requireNotPublished(p, "fail");
              if (p.getStatus() == ProductStatus.PUBLISHING) {
                throw new PipelineException(
                    ErrorKind.INVALID_TRANSITION, "Product " + dataId + " is being published");
              }
              p.setStatus(ProductStatus.FAILED);
              p.setPublishError(truncate("superseded: " + reason));
            });
    log.warn("registry.failed dataId={} reason={}", dataId, reason);
    return updated;
  }

  public AutoPublishCheck checkAutoPublish(String dataId) {
    Product p = get(dataId);
    List<String> reasons = criteriaGaps(p);
    return AutoPublishCheck.builder()
        .dataId(dataId)
        .enabled(p.isAutoPublish())
        .criteriaMet(reasons.isEmpty())
        .reasons(reasons)
        .build();
  }

  /** Reasons the product does not meet auto-publish criteria; empty when it does. */
  static List<String> criteriaGaps(Product p) {
    List<String> reasons = new ArrayList<>();
    if (p.getStatus() != ProductStatus.STAGING) {
      reasons.add("status_" + p.getStatus().value());
    }
    if (!p.isFinalized()) {
      reasons.add("not_finalized");
    }
    if (p.getValidationStatus() != ValidationStatus.VALIDATED) {
      reasons.add("not_validated");
    }
    if (p.getDataType().isScience() && p.getQaStatus() != QaStatus.PASSED) {
      reasons.add("qa_" + p.getQaStatus().value());
    }
    return reasons;
  }

  /** Records a lineage edge. Repeating an edge is a no-op. */
  public void link(String parentDataId, String childDataId, String relationshipType) {
    boolean created = products.link(parentDataId, childDataId, relationshipType, clock.instant());
    if (created) {
      log.info(
          "registry.link parent={} child={} type={}", parentDataId, childDataId, relationshipType);
    }
  }

  public Lineage lineage(String dataId) {
    get(dataId);
    return Lineage.builder()
        .dataId(dataId)
        .parents(products.findParents(dataId))
        .children(products.findChildren(dataId))
        .build();
  }

  public Map<ProductStatus, Long> statusCounts() {
    return products.countByStatus();
  }

  public AttentionReport attention(int limit) {
    Instant now = clock.instant();
    List<Product> stuck =
        products.findPublishingStartedBefore(now.minus(publishSettings.getStaleAfter()));
    return AttentionReport.builder()
        .generatedAt(now)
        .failed(
            products.list(
                ProductFilter.builder().status(ProductStatus.FAILED).limit(limit).build()))
        .stuckPublishing(stuck.size() > limit ? stuck.subList(0, limit) : stuck)
        .stagedTooLong(
            products.findStagingCreatedBefore(now.minus(publishSettings.getStagedTooLong()), limit))
        .build();
  }

  String truncate(String message) {
    int max = publishSettings.getErrorMaxLength();
    return message == null || message.length() <= max ? message : message.substring(0, max);
  }

  private Product mutate(String dataId, Consumer<Product> change) {
    return tx.execute(
        status -> {
          Product p =
              products
                  .findByDataIdForUpdate(dataId)
                  .orElseThrow(() -> PipelineException.notFound("Product", dataId));
          change.accept(p);
          p.setUpdatedAt(clock.instant());
          products.update(p);
          return p;
        });
  }

  private static void requireNotPublished(Product p, String action) {
    if (p.getStatus() == ProductStatus.PUBLISHED) {
      throw new PipelineException(
          ErrorKind.INVALID_TRANSITION,
          "Cannot " + action + " published product " + p.getDataId());
    }
  }

  /**
   * Merges {@code patch} into the product's metadata. Stored metadata that could not be parsed is
   * never replaced: removals are skipped and additions are refused.
   */
  private static void applyMetadata(Product p, Map<String, Object> patch) {
    if (p.isMetadataUnreadable()) {
      if (patch != null && patch.values().stream().anyMatch(Objects::nonNull)) {
        throw new PipelineException(
            ErrorKind.STORAGE_FAILURE,
            "Stored metadata of " + p.getDataId() + " is unreadable; refusing to overwrite it");
      }
      return;
    }
    p.setMetadata(merge(p.getMetadata(), patch));
  }

  private static Map<String, Object> merge(Map<String, Object> current, Map<String, Object> patch) {
    Map<String, Object> merged =
        current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
    if (patch != null) {
      patch.forEach(
          (k, v) -> {
            if (v == null) {
              merged.remove(k);
            } else {
              merged.put(k, v);
            }
          });
    }
    return merged;
  }
}
