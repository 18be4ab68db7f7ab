package com.cario.contimg.app.model;

import com.cario.contimg.app.error.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result returned by the publish orchestrator; per-row failures are reported here, not thrown. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {

  private String dataId;

  private PublishOutcome outcome;

  /** Set when the attempt failed. */
  private ErrorKind errorKind;

  private String message;

  private int attempts;

  private String publishedPath;

  public static PublishResult of(String dataId, PublishOutcome outcome, String message) {
    return PublishResult.builder().dataId(dataId).outcome(outcome).message(message).build();
  }

  public boolean isPublished() {
    return outcome == PublishOutcome.PUBLISHED;
  }
}
