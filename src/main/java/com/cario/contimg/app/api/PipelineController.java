package com.cario.contimg.app.api;

import com.cario.contimg.app.model.AttentionReport;
import com.cario.contimg.app.model.AutoPublishCheck;
import com.cario.contimg.app.model.GroupFormationReport;
import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.model.Lineage;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.ProcessingGroup;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductFilter;
import com.cario.contimg.app.model.ProductStatus;
import com.cario.contimg.app.model.ProductType;
import com.cario.contimg.app.model.PublishOutcome;
import com.cario.contimg.app.model.PublishResult;
import com.cario.contimg.app.model.QaStatus;
import com.cario.contimg.app.model.ValidationStatus;
import com.cario.contimg.app.service.GroupFormationService;
import com.cario.contimg.app.service.IngestQueueService;
import com.cario.contimg.app.service.ProductRegistryService;
import com.cario.contimg.app.service.PublishService;
import com.cario.contimg.app.service.StageExecutionService;
import com.cario.contimg.app.worker.WorkerSessionManager;
import com.cario.contimg.app.worker.WorkerStatus;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/pipeline")
@RequiredArgsConstructor
public class PipelineController {

  private final IngestQueueService ingestQueueService;
  private final GroupFormationService groupFormationService;
  private final ProductRegistryService productRegistryService;
  private final PublishService publishService;
  private final StageExecutionService stageExecutionService;
  private final WorkerSessionManager workerSessionManager;

  // ------------------------------------------------------------
  // /pipeline/ingest
  // ------------------------------------------------------------
  @PostMapping(
      path = "/ingest",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestUnit> enqueue(@RequestBody @Validated EnqueueRequest req) {
    log.info("pipeline.ingest path={} acquiredAt={}", req.getPath(), req.getAcquiredAt());
    IngestUnit unit = ingestQueueService.enqueue(req.getPath(), req.getAcquiredAt());
    HttpStatus status =
        unit.getStage() == IngestStage.ARRIVED ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(unit);
  }

  @GetMapping(path = "/queue/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<IngestStage, Long> queueStats() {
    return ingestQueueService.stats();
  }

  // ------------------------------------------------------------
  // /pipeline/groups
  // ------------------------------------------------------------
  @PostMapping(path = "/groups/scan", produces = MediaType.APPLICATION_JSON_VALUE)
  public GroupFormationReport scanGroups() {
    return groupFormationService.formGroups();
  }

  @GetMapping(path = "/groups", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<ProcessingGroup> listGroups(
      @RequestParam(name = "status", defaultValue = "formed") String status,
      @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
    return groupFormationService.findByStatus(GroupStatus.fromValue(status), limit);
  }

  @GetMapping(path = "/groups/{groupId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ProcessingGroup getGroup(@PathVariable("groupId") String groupId) {
    return groupFormationService.getGroup(groupId);
  }

  @PutMapping(
      path = "/groups/{groupId}/status",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ProcessingGroup updateGroupStatus(
      @PathVariable("groupId") String groupId, @RequestBody @Validated GroupStatusRequest req) {
    return groupFormationService.updateStatus(
        groupId, GroupStatus.fromValue(req.getStatus()), req.getReason());
  }

  // ------------------------------------------------------------
  // /pipeline/products
  // ------------------------------------------------------------
  @GetMapping(path = "/products", produces = MediaType.APPLICATION_JSON_VALUE)
  public List<Product> listProducts(
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "type", required = false) String type,
      @RequestParam(name = "stage", required = false) String stage,
      @RequestParam(name = "groupId", required = false) String groupId,
      @RequestParam(name = "parentDataId", required = false) String parentDataId,
      @RequestParam(name = "limit", defaultValue = "500") @Min(1) @Max(5000) int limit) {
    ProductFilter filter =
        ProductFilter.builder()
            .status(status == null ? null : ProductStatus.fromValue(status))
            .dataType(type == null ? null : ProductType.fromValue(type))
            .stage(stage == null ? null : PipelineStage.fromValue(stage))
            .groupId(groupId)
            .parentDataId(parentDataId)
            .limit(limit)
            .build();
    return productRegistryService.list(filter);
  }

  @PostMapping(
      path = "/products",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Product> registerProduct(@RequestBody @Validated RegisterRequest req) {
    log.info("pipeline.register dataId={} type={}", req.getDataId(), req.getDataType());
    Product product =
        productRegistryService.register(
            Product.builder()
                .dataId(req.getDataId())
                .dataType(ProductType.fromValue(req.getDataType()))
                .stage(req.getStage() == null ? null : PipelineStage.fromValue(req.getStage()))
                .stagingPath(req.getStagingPath())
                .groupId(req.getGroupId())
                .parentDataId(req.getParentDataId())
                .metadata(req.getMetadata())
                .build());
    return ResponseEntity.status(HttpStatus.CREATED).body(product);
  }

  @GetMapping(path = "/products/{dataId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public Product getProduct(@PathVariable("dataId") String dataId) {
    return productRegistryService.get(dataId);
  }

  @GetMapping(path = "/products/{dataId}/lineage", produces = MediaType.APPLICATION_JSON_VALUE)
  public Lineage lineage(@PathVariable("dataId") String dataId) {
    return productRegistryService.lineage(dataId);
  }

  @PostMapping(
      path = "/products/{dataId}/stage",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Product updateStage(
      @PathVariable("dataId") String dataId, @RequestBody @Validated StageRequest req) {
    return productRegistryService.updateStage(
        dataId, PipelineStage.fromValue(req.getStage()), req.getMetadata());
  }

  @PostMapping(
      path = "/products/{dataId}/advance/{stage}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Product advance(
      @PathVariable("dataId") String dataId, @PathVariable("stage") String stage) {
    return stageExecutionService.advance(dataId, PipelineStage.fromValue(stage));
  }

  @PostMapping(
      path = "/products/{dataId}/finalize",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Product finalizeProduct(
      @PathVariable("dataId") String dataId, @RequestBody FinalizeRequest req) {
    return productRegistryService.finalizeProduct(
        dataId,
        req.getQaStatus() == null ? null : QaStatus.fromValue(req.getQaStatus()),
        req.getValidationStatus() == null
            ? null
            : ValidationStatus.fromValue(req.getValidationStatus()));
  }

  @GetMapping(
      path = "/products/{dataId}/auto-publish",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AutoPublishCheck checkAutoPublish(@PathVariable("dataId") String dataId) {
    return productRegistryService.checkAutoPublish(dataId);
  }

  @PutMapping(
      path = "/products/{dataId}/auto-publish",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public AutoPublishCheck setAutoPublish(
      @PathVariable("dataId") String dataId, @RequestParam("enabled") boolean enabled) {
    productRegistryService.setAutoPublish(dataId, enabled);
    return productRegistryService.checkAutoPublish(dataId);
  }

  @PostMapping(path = "/products/{dataId}/publish", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<PublishResult> publish(@PathVariable("dataId") String dataId) {
    log.info("pipeline.publish dataId={}", dataId);
    return publishResponse(publishService.publishManual(dataId));
  }

  @PostMapping(path = "/products/{dataId}/retry", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<PublishResult> retry(@PathVariable("dataId") String dataId) {
    log.info("pipeline.retry dataId={}", dataId);
    return publishResponse(publishService.retryFailed(dataId));
  }

  @PostMapping(
      path = "/products/{dataId}/fail",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Product markFailed(
      @PathVariable("dataId") String dataId, @RequestBody @Validated FailRequest req) {
    return productRegistryService.markFailed(dataId, req.getReason());
  }

  @GetMapping(path = "/attention", produces = MediaType.APPLICATION_JSON_VALUE)
  public AttentionReport attention(
      @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
    return productRegistryService.attention(limit);
  }

  @GetMapping(path = "/products/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<ProductStatus, Long> productStats() {
    return productRegistryService.statusCounts();
  }

  // ------------------------------------------------------------
  // /pipeline/worker
  // ------------------------------------------------------------
  @GetMapping(path = "/worker", produces = MediaType.APPLICATION_JSON_VALUE)
  public WorkerStatus worker() {
    return workerSessionManager.status();
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class EnqueueRequest {
    @NotBlank private String path;
    @NotNull private Instant acquiredAt;
  }

  @Data
  public static class GroupStatusRequest {
    @NotBlank private String status;
    private String reason;
  }

  @Data
  public static class RegisterRequest {
    @NotBlank private String dataId;
    @NotBlank private String dataType;
    @NotBlank private String stagingPath;
    private String stage;
    private String groupId;
    private String parentDataId;
    private Map<String, Object> metadata;
  }

  @Data
  public static class StageRequest {
    @NotBlank private String stage;
    private Map<String, Object> metadata;
  }

  @Data
  public static class FinalizeRequest {
    private String qaStatus;
    private String validationStatus;
  }

  @Data
  public static class FailRequest {
    @NotBlank private String reason;
  }

  // ============================================================
  // Helpers
  // ============================================================
  private static ResponseEntity<PublishResult> publishResponse(PublishResult result) {
    if (result.getOutcome() == PublishOutcome.NOT_FOUND) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }
    return ResponseEntity.ok(result);
  }
}
