package com.cario.contimg.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One arrived raw input file and its acquisition timestamp.
 *
 * <p>Rows are append-only; the only mutation is the single transition to {@link
 * IngestStage#GROUPED}, which also stamps {@code claimedBy} and {@code groupId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestUnit {

  private Long id;

  private String path;

  /** Acquisition time of the observation, not the arrival time of the file. */
  private Instant acquiredAt;

  private IngestStage stage;

  /** Id of the scan that claimed the unit, null while unclaimed. */
  private String claimedBy;

  private String groupId;

  private Instant receivedAt;

  private Instant updatedAt;
}
