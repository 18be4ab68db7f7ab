package com.cario.contimg.app.worker;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/** Runs worker commands directly on the host. Paths need no translation. */
@Log4j2
public class LocalWorkerLauncher implements WorkerLauncher {

  private final CommandRunner runner;
  private final String workDir;
  private final Clock clock;

  public LocalWorkerLauncher(CommandRunner runner, String workDir, Clock clock) {
    this.runner = runner;
    this.workDir = workDir;
    this.clock = clock;
  }

  @Override
  public WorkerSession start(String sessionId) {
    if (workDir != null && !workDir.isBlank()) {
      try {
        Files.createDirectories(Paths.get(workDir));
      } catch (IOException e) {
        throw new PipelineException(
            ErrorKind.WORKER_UNAVAILABLE, "Cannot create work dir " + workDir, e);
      }
    }
    log.info("worker.local.start sessionId={} workDir={}", sessionId, workDir);
    return new WorkerSession(sessionId, "local-" + sessionId, workDir, Map.of(), clock.instant());
  }

  @Override
  public boolean isAlive(WorkerSession session) {
    return !session.isStopped()
        && (session.getWorkDir() == null
            || session.getWorkDir().isBlank()
            || Files.isDirectory(Paths.get(session.getWorkDir())));
  }

  @Override
  public ExecResult exec(WorkerSession session, List<String> command, Duration timeout) {
    Path dir =
        session.getWorkDir() == null || session.getWorkDir().isBlank()
            ? null
            : Paths.get(session.getWorkDir());
    return runner.run(command, dir, timeout);
  }

  @Override
  public void stop(WorkerSession session) {
    session.markStopped();
    log.info("worker.local.stop sessionId={}", session.getSessionId());
  }
}
