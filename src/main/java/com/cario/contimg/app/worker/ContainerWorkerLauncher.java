package com.cario.contimg.app.worker;

import com.cario.contimg.app.config.PipelineProperties;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/**
 * Keeps one long-lived container (docker or podman CLI) and runs commands in it with {@code exec},
 * so the image start-up cost is paid once per session rather than once per command.
 */
@Log4j2
public class ContainerWorkerLauncher implements WorkerLauncher {

  /** Exit status of {@code timeout} when the command ran out of time. */
  static final int EXIT_TIMED_OUT = 124;

  /** 128 + SIGKILL, seen when the command ignored TERM and was killed after the grace period. */
  static final int EXIT_KILLED = 137;

  private final CommandRunner runner;
  private final PipelineProperties.Worker settings;
  private final Clock clock;

  public ContainerWorkerLauncher(
      CommandRunner runner, PipelineProperties.Worker settings, Clock clock) {
    if (settings.getImage() == null || settings.getImage().isBlank()) {
      throw new IllegalArgumentException("pipeline.worker.image is required for containers");
    }
    this.runner = runner;
    this.settings = settings;
    this.clock = clock;
  }

  @Override
  public WorkerSession start(String sessionId) {
    String name = settings.getSessionName() + "-" + sessionId;
    List<String> cmd = new ArrayList<>(List.of(settings.getRuntime(), "run", "-d", "--rm"));
    cmd.add("--name");
    cmd.add(name);
    for (Map.Entry<String, String> m : settings.getMounts().entrySet()) {
      cmd.add("-v");
      cmd.add(m.getKey() + ":" + m.getValue());
    }
    if (settings.getWorkDir() != null && !settings.getWorkDir().isBlank()) {
      cmd.add("-w");
      cmd.add(settings.getWorkDir());
    }
    cmd.add("--entrypoint");
    cmd.add("sleep");
    cmd.add(settings.getImage());
    cmd.add("infinity");

    ExecResult result = runner.run(cmd, null, settings.getControlTimeout());
    if (!result.isSuccess()) {
      throw new PipelineException(
          ErrorKind.WORKER_UNAVAILABLE,
          "Container start failed (exit "
              + result.getExitCode()
              + "): "
              + result.getStderr().trim());
    }
    log.info(
        "worker.container.start name={} image={} containerId={}",
        name,
        settings.getImage(),
        result.getStdout().trim());
    return new WorkerSession(
        sessionId, name, settings.getWorkDir(), settings.getMounts(), clock.instant());
  }

  @Override
  public boolean isAlive(WorkerSession session) {
    if (session.isStopped()) {
      return false;
    }
    try {
      ExecResult result =
          runner.run(
              List.of(
                  settings.getRuntime(), "inspect", "-f", "{{.State.Running}}", session.getName()),
              null,
              settings.getControlTimeout());
      return result.isSuccess() && "true".equals(result.getStdout().trim());
    } catch (PipelineException e) {
      log.warn("worker.container.inspect-failed name={} msg={}", session.getName(), e.getMessage());
      return false;
    }
  }

  /**
   * Runs {@code command} inside the session's container. Killing the container CLI does not stop
   * the process inside the container, so the command is wrapped in the container's own {@code
   * timeout} utility; the CLI deadline is only a backstop.
   *
   * @throws PipelineException {@link ErrorKind#TIMEOUT_EXCEEDED} when the command outlives {@code
   *     timeout}
   */
  @Override
  public ExecResult exec(WorkerSession session, List<String> command, Duration timeout) {
    List<String> cmd = new ArrayList<>(List.of(settings.getRuntime(), "exec"));
    if (session.getWorkDir() != null && !session.getWorkDir().isBlank()) {
      cmd.add("-w");
      cmd.add(session.getWorkDir());
    }
    cmd.add(session.getName());
    String timeoutCommand = settings.getTimeoutCommand();
    if (timeoutCommand == null || timeoutCommand.isBlank()) {
      cmd.addAll(command);
      return runner.run(cmd, null, timeout);
    }
    cmd.add(timeoutCommand);
    cmd.add("-s");
    cmd.add("TERM");
    cmd.add("-k");
    cmd.add(Long.toString(wholeSeconds(settings.getKillGrace())));
    cmd.add(Long.toString(wholeSeconds(timeout)));
    cmd.addAll(command);

    ExecResult result =
        runner.run(cmd, null, timeout.plus(settings.getKillGrace().multipliedBy(2)));
    boolean killed =
        result.getExitCode() == EXIT_TIMED_OUT
            || (result.getExitCode() == EXIT_KILLED
                && result.getDurationMs() >= timeout.toMillis());
    if (killed) {
      log.warn(
          "worker.container.exec-timeout name={} timeout={} exit={}",
          session.getName(),
          timeout,
          result.getExitCode());
      throw new PipelineException(
          ErrorKind.TIMEOUT_EXCEEDED,
          "Command exceeded " + timeout + " in " + session.getName() + ": " + command.get(0));
    }
    return result;
  }

  static long wholeSeconds(Duration d) {
    long secs = d.getSeconds() + (d.getNano() > 0 ? 1 : 0);
    return Math.max(1, secs);
  }

  @Override
  public Map<String, String> mounts() {
    return settings.getMounts();
  }

  @Override
  public void stop(WorkerSession session) {
    session.markStopped();
    ExecResult result =
        runner.run(
            List.of(settings.getRuntime(), "rm", "-f", session.getName()),
            null,
            settings.getControlTimeout());
    if (result.isSuccess()) {
      log.info("worker.container.stop name={}", session.getName());
    } else {
      log.warn(
          "worker.container.stop-failed name={} exit={} stderr={}",
          session.getName(),
          result.getExitCode(),
          result.getStderr().trim());
    }
  }
}
