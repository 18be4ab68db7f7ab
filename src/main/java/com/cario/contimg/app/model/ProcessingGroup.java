package com.cario.contimg.app.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Immutable batch of ingest units processed together. Only {@code status} and {@code
 * statusReason} change after formation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingGroup {

  private String groupId;

  /** SHA-256 over the sorted member paths; equal member sets share it. */
  private String memberHash;

  /** Member paths ordered by acquisition time. */
  private List<String> memberPaths;

  private Instant firstAcquiredAt;

  private Instant lastAcquiredAt;

  private long spanMillis;

  private Instant formedAt;

  private GroupStatus status;

  private String statusReason;

  /** Summary of the checks the group passed when it was formed. */
  private String validationNotes;

  private Instant updatedAt;

  public Duration getSpan() {
    return Duration.ofMillis(spanMillis);
  }

  public int getMemberCount() {
    return memberPaths == null ? 0 : memberPaths.size();
  }
}
