package com.cario.contimg.app.worker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Starts, checks, uses and stops one kind of worker runtime. */
public interface WorkerLauncher {

  /** Blocks until the worker can accept commands. */
  WorkerSession start(String sessionId);

  boolean isAlive(WorkerSession session);

  ExecResult exec(WorkerSession session, List<String> command, Duration timeout);

  /** Best effort; must tolerate a worker that is already gone. */
  void stop(WorkerSession session);

  /** Host path prefix to worker-visible prefix; empty when the worker sees host paths. */
  default Map<String, String> mounts() {
    return Map.of();
  }
}
