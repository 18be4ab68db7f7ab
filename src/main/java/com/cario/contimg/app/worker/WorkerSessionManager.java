package com.cario.contimg.app.worker;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.log4j.Log4j2;

/**
 * Owns the single external worker session.
 *
 * <p>The session starts lazily on first use, is restarted once when found dead, and is always
 * stopped on shutdown, through {@link #stop()} from the container or the JVM shutdown hook
 * registered at start. Commands run concurrently; start, restart and stop are serialized.
 */
@Log4j2
public class WorkerSessionManager implements AutoCloseable {

  private final WorkerLauncher launcher;
  private final Duration defaultTimeout;
  private final Duration restartWindow;
  private final int maxRestartsInWindow;
  private final Clock clock;

  private final Object lock = new Object();
  private final AtomicInteger activeCommands = new AtomicInteger();
  private final Deque<Instant> restarts = new ArrayDeque<>();

  private volatile WorkerSessionState state = WorkerSessionState.NOT_STARTED;
  private volatile WorkerSession session;
  private volatile boolean alertRaised;
  private volatile String lastError;
  private Thread shutdownHook;

  public WorkerSessionManager(
      WorkerLauncher launcher,
      Duration defaultTimeout,
      Duration restartWindow,
      int maxRestartsInWindow,
      Clock clock) {
    this.launcher = launcher;
    this.defaultTimeout = defaultTimeout;
    this.restartWindow = restartWindow;
    this.maxRestartsInWindow = maxRestartsInWindow;
    this.clock = clock;
  }

  /** Starts the session if it is not running. Idempotent. */
  public void start() {
    synchronized (lock) {
      ensureStartedLocked();
    }
  }

  public ExecResult exec(List<String> command) {
    return exec(command, defaultTimeout);
  }

  /**
   * Runs a command in the worker. A session that died before or during the command is restarted
   * once and the command re-attempted once.
   *
   * @throws PipelineException {@link ErrorKind#WORKER_UNAVAILABLE} when no live session can be had,
   *     {@link ErrorKind#TIMEOUT_EXCEEDED} when the command outlives {@code timeout}
   */
  public ExecResult exec(List<String> command, Duration timeout) {
    WorkerSession current = acquireLiveSession();
    ExecResult result = runTracked(current, command, timeout);
    if (!result.isSuccess() && !launcher.isAlive(current)) {
      log.warn(
          "worker.session.died-during-exec sessionId={} exit={}",
          current.getSessionId(),
          result.getExitCode());
      WorkerSession replacement;
      synchronized (lock) {
        replacement = session == current ? restartLocked(current) : ensureStartedLocked();
      }
      result = runTracked(replacement, command, timeout);
    }
    return result;
  }

  /** Translates a host path to the path the worker sees, using the longest matching mount. */
  public String toWorkerPath(Path hostPath) {
    return mapPath(launcher.mounts(), hostPath);
  }

  static String mapPath(Map<String, String> mounts, Path hostPath) {
    Path normalized = hostPath.toAbsolutePath().normalize();
    Path bestHost = null;
    String bestTarget = null;
    for (Map.Entry<String, String> m : mounts.entrySet()) {
      Path host = Path.of(m.getKey()).toAbsolutePath().normalize();
      if (normalized.startsWith(host)
          && (bestHost == null || host.getNameCount() > bestHost.getNameCount())) {
        bestHost = host;
        bestTarget = m.getValue();
      }
    }
    if (bestHost == null) {
      return normalized.toString();
    }
    Path rest = bestHost.relativize(normalized);
    String target =
        bestTarget.endsWith("/")
            ? bestTarget.substring(0, bestTarget.length() - 1)
            : bestTarget;
    return rest.toString().isEmpty() ? target : target + "/" + rest.toString().replace('\\', '/');
  }

  /** Stops the session. Safe to call more than once and from any thread. */
  public void stop() {
    synchronized (lock) {
      if (state == WorkerSessionState.STOPPED) {
        return;
      }
      WorkerSession current = session;
      state = WorkerSessionState.STOPPING;
      if (current != null) {
        try {
          launcher.stop(current);
        } catch (RuntimeException e) {
          lastError = e.getMessage();
          log.warn(
              "worker.session.stop-failed sessionId={} msg={}",
              current.getSessionId(),
              e.getMessage());
        }
      }
      session = null;
      state = WorkerSessionState.STOPPED;
      removeShutdownHook();
      log.info(
          "worker.session.stopped sessionId={}", current == null ? null : current.getSessionId());
    }
  }

  @Override
  public void close() {
    stop();
  }

  public WorkerStatus status() {
    WorkerSession current = session;
    int recent;
    synchronized (lock) {
      pruneRestarts(clock.instant());
      recent = restarts.size();
    }
    return WorkerStatus.builder()
        .state(state)
        .sessionId(current == null ? null : current.getSessionId())
        .startedAt(current == null ? null : current.getStartedAt())
        .activeCommands(activeCommands.get())
        .restartsInWindow(recent)
        .alertRaised(alertRaised)
        .lastError(lastError)
        .build();
  }

  public WorkerSessionState getState() {
    return state;
  }

  private ExecResult runTracked(WorkerSession target, List<String> command, Duration timeout) {
    synchronized (lock) {
      activeCommands.incrementAndGet();
      if (state == WorkerSessionState.READY) {
        state = WorkerSessionState.EXECUTING;
      }
    }
    try {
      return launcher.exec(target, command, timeout);
    } finally {
      if (activeCommands.decrementAndGet() == 0) {
        synchronized (lock) {
          if (state == WorkerSessionState.EXECUTING && activeCommands.get() == 0) {
            state = WorkerSessionState.READY;
          }
        }
      }
    }
  }

  private WorkerSession acquireLiveSession() {
    synchronized (lock) {
      WorkerSession current = ensureStartedLocked();
      if (!launcher.isAlive(current)) {
        log.warn("worker.session.dead sessionId={}", current.getSessionId());
        current = restartLocked(current);
      }
      return current;
    }
  }

  private WorkerSession ensureStartedLocked() {
    if (state == WorkerSessionState.STOPPING || state == WorkerSessionState.STOPPED) {
      throw new PipelineException(ErrorKind.WORKER_UNAVAILABLE, "Worker session is stopped");
    }
    if (session != null) {
      return session;
    }
    state = WorkerSessionState.STARTING;
    String sessionId = UUID.randomUUID().toString().substring(0, 8);
    try {
      session = launcher.start(sessionId);
    } catch (PipelineException e) {
      state = WorkerSessionState.NOT_STARTED;
      lastError = e.getMessage();
      throw e;
    } catch (RuntimeException e) {
      state = WorkerSessionState.NOT_STARTED;
      lastError = e.getMessage();
      throw new PipelineException(
          ErrorKind.WORKER_UNAVAILABLE, "Worker start failed: " + e.getMessage(), e);
    }
    state = WorkerSessionState.READY;
    registerShutdownHook();
    log.info("worker.session.started sessionId={}", sessionId);
    return session;
  }

  private WorkerSession restartLocked(WorkerSession dead) {
    Instant now = clock.instant();
    pruneRestarts(now);
    if (restarts.size() >= maxRestartsInWindow) {
      alertRaised = true;
      lastError = "restart storm: " + restarts.size() + " restarts within " + restartWindow;
      log.error(
          "alert.worker.restart-storm restarts={} window={} sessionId={}",
          restarts.size(),
          restartWindow,
          dead.getSessionId());
      throw new PipelineException(ErrorKind.WORKER_UNAVAILABLE, lastError);
    }
    restarts.addLast(now);
    try {
      launcher.stop(dead);
    } catch (RuntimeException e) {
      log.warn(
          "worker.session.cleanup-failed sessionId={} msg={}",
          dead.getSessionId(),
          e.getMessage());
    }
    session = null;
    log.warn(
        "worker.session.restart previous={} restartsInWindow={}",
        dead.getSessionId(),
        restarts.size());
    WorkerSession fresh = ensureStartedLocked();
    if (!launcher.isAlive(fresh)) {
      lastError = "restarted session " + fresh.getSessionId() + " is not alive";
      throw new PipelineException(ErrorKind.WORKER_UNAVAILABLE, lastError);
    }
    return fresh;
  }

  private void pruneRestarts(Instant now) {
    Instant floor = now.minus(restartWindow);
    while (!restarts.isEmpty() && restarts.peekFirst().isBefore(floor)) {
      restarts.pollFirst();
    }
  }

  private void registerShutdownHook() {
    if (shutdownHook != null) {
      return;
    }
    shutdownHook = new Thread(this::stop, "worker-session-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdownHook);
  }

  private void removeShutdownHook() {
    if (shutdownHook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      // already shutting down; the hook is what called us
      log.debug("worker.session.hook-running");
    }
    shutdownHook = null;
  }
}
