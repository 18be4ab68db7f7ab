package com.cario.contimg.app.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Products an operator should look at. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttentionReport {

  private Instant generatedAt;

  /** Publish attempts exhausted or marked failed by an operator. */
  private List<Product> failed;

  /** In publishing for longer than the stale threshold. */
  private List<Product> stuckPublishing;

  /** Still staging long after registration. */
  private List<Product> stagedTooLong;
}
