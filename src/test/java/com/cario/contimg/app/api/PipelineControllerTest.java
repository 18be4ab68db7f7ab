package com.cario.contimg.app.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.model.PipelineStage;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductStatus;
import com.cario.contimg.app.model.ProductType;
import com.cario.contimg.app.model.PublishOutcome;
import com.cario.contimg.app.model.PublishResult;
import com.cario.contimg.app.service.GroupFormationService;
import com.cario.contimg.app.service.IngestQueueService;
import com.cario.contimg.app.service.ProductRegistryService;
import com.cario.contimg.app.service.PublishService;
import com.cario.contimg.app.service.StageExecutionService;
import com.cario.contimg.app.worker.WorkerSessionManager;
import com.cario.contimg.app.worker.WorkerSessionState;
import com.cario.contimg.app.worker.WorkerStatus;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PipelineController.class)
class PipelineControllerTest {

  @Autowired private MockMvc mvc;

  @MockBean private IngestQueueService ingestQueueService;
  @MockBean private GroupFormationService groupFormationService;
  @MockBean private ProductRegistryService productRegistryService;
  @MockBean private PublishService publishService;
  @MockBean private StageExecutionService stageExecutionService;
  @MockBean private WorkerSessionManager workerSessionManager;

  @Test
  void enqueueReturnsCreatedForNewUnit() throws Exception {
    Instant at = Instant.parse("2025-10-02T00:12:00Z");
    when(ingestQueueService.enqueue("/in/a.hdf5", at))
        .thenReturn(
            IngestUnit.builder().id(1L).path("/in/a.hdf5").stage(IngestStage.ARRIVED).build());

    mvc.perform(
            post("/pipeline/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/in/a.hdf5\",\"acquiredAt\":\"2025-10-02T00:12:00Z\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.path").value("/in/a.hdf5"));
  }

  @Test
  void enqueueWithBlankPathIsBadRequest() throws Exception {
    mvc.perform(
            post("/pipeline/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\" \",\"acquiredAt\":\"2025-10-02T00:12:00Z\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("BAD_REQUEST"));
    verifyNoInteractions(ingestQueueService);
  }

  @Test
  void duplicateUnitIsConflict() throws Exception {
    when(ingestQueueService.enqueue(any(), any()))
        .thenThrow(new PipelineException(ErrorKind.DUPLICATE_UNIT, "already queued"));

    mvc.perform(
            post("/pipeline/ingest")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"path\":\"/in/a.hdf5\",\"acquiredAt\":\"2025-10-02T00:12:00Z\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.kind").value("DUPLICATE_UNIT"));
  }

  @Test
  void getProductReturnsRow() throws Exception {
    when(productRegistryService.get("img-1"))
        .thenReturn(
            Product.builder()
                .dataId("img-1")
                .dataType(ProductType.IMAGE)
                .status(ProductStatus.STAGING)
                .stage(PipelineStage.IMAGED)
                .build());

    mvc.perform(get("/pipeline/products/img-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dataId").value("img-1"))
        .andExpect(jsonPath("$.status").value("staging"))
        .andExpect(jsonPath("$.stage").value("imaged"));
  }

  @Test
  void unknownProductIsNotFound() throws Exception {
    when(productRegistryService.get("nope"))
        .thenThrow(new PipelineException(ErrorKind.NOT_FOUND, "No product nope"));

    mvc.perform(get("/pipeline/products/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.status").value(404))
        .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
  }

  @Test
  void manualPublishReportsOutcome() throws Exception {
    when(publishService.publishManual("img-1"))
        .thenReturn(
            PublishResult.builder()
                .dataId("img-1")
                .outcome(PublishOutcome.PUBLISHED)
                .publishedPath("/prod/images/img-1.fits")
                .build());

    mvc.perform(post("/pipeline/products/img-1/publish"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("PUBLISHED"))
        .andExpect(jsonPath("$.publishedPath").value("/prod/images/img-1.fits"));
  }

  @Test
  void publishOfUnknownProductIsNotFound() throws Exception {
    when(publishService.publishManual("nope"))
        .thenReturn(PublishResult.of("nope", PublishOutcome.NOT_FOUND, "No product nope"));

    mvc.perform(post("/pipeline/products/nope/publish")).andExpect(status().isNotFound());
  }

  @Test
  void unknownStageNameIsBadRequest() throws Exception {
    mvc.perform(post("/pipeline/products/img-1/advance/deconvolved"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(stageExecutionService);
  }

  @Test
  void invalidGroupTransitionIsConflict() throws Exception {
    when(groupFormationService.updateStatus("grp-1", GroupStatus.FORMED, null))
        .thenThrow(new PipelineException(ErrorKind.INVALID_TRANSITION, "complete -> formed"));

    mvc.perform(
            put("/pipeline/groups/grp-1/status")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\":\"formed\"}"))
        .andExpect(status().isConflict());
  }

  @Test
  void autoPublishToggleUsesQueryParam() throws Exception {
    mvc.perform(put("/pipeline/products/img-1/auto-publish").param("enabled", "false"))
        .andExpect(status().isOk());

    verify(productRegistryService).setAutoPublish(eq("img-1"), eq(false));
  }

  @Test
  void workerStatusIsReported() throws Exception {
    when(workerSessionManager.status())
        .thenReturn(
            WorkerStatus.builder()
                .state(WorkerSessionState.NOT_STARTED)
                .restartsInWindow(0)
                .build());

    mvc.perform(get("/pipeline/worker"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("NOT_STARTED"))
        .andExpect(jsonPath("$.alertRaised").value(false));
  }
}
