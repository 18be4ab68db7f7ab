package com.cario.contimg.app.worker;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Snapshot of the worker session for operators. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatus {

  private WorkerSessionState state;

  private String sessionId;

  private Instant startedAt;

  private int activeCommands;

  private int restartsInWindow;

  /** Set once restarts exceeded the allowed rate; cleared by a successful manual start. */
  private boolean alertRaised;

  private String lastError;
}
