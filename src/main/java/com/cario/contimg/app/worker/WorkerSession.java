package com.cario.contimg.app.worker;

import java.time.Instant;
import java.util.Map;

/**
 * Handle to one running worker. Owned by {@link WorkerSessionManager}; launchers create it, nothing
 * else holds on to it.
 */
public final class WorkerSession {

  private final String sessionId;
  private final String name;
  private final String workDir;
  private final Map<String, String> mounts;
  private final Instant startedAt;
  private volatile boolean stopped;

  WorkerSession(
      String sessionId,
      String name,
      String workDir,
      Map<String, String> mounts,
      Instant startedAt) {
    this.sessionId = sessionId;
    this.name = name;
    this.workDir = workDir;
    this.mounts = Map.copyOf(mounts);
    this.startedAt = startedAt;
  }

  public String getSessionId() {
    return sessionId;
  }

  /** Runtime-level name, e.g. the container name. */
  public String getName() {
    return name;
  }

  public String getWorkDir() {
    return workDir;
  }

  /** Host path prefix to worker-visible path prefix. */
  public Map<String, String> getMounts() {
    return mounts;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  boolean isStopped() {
    return stopped;
  }

  void markStopped() {
    this.stopped = true;
  }
}
