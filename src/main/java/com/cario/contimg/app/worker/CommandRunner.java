package com.cario.contimg.app.worker;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;

/**
 * Runs a host process with a deadline.
 *
 * <p>Both output streams are drained on their own threads so a chatty process cannot block on a
 * full pipe. On timeout the process is asked to terminate, given {@code killGrace}, then killed
 * along with its descendants.
 */
@Log4j2
public class CommandRunner {

  static final int MAX_CAPTURE_BYTES = 1 << 20;

  private final Duration killGrace;

  public CommandRunner(Duration killGrace) {
    this.killGrace = killGrace;
  }

  /**
   * @throws PipelineException {@link ErrorKind#WORKER_UNAVAILABLE} if the process cannot be
   *     started, {@link ErrorKind#TIMEOUT_EXCEEDED} if it outlives {@code timeout}
   */
  public ExecResult run(List<String> command, Path workDir, Duration timeout) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    ProcessBuilder pb = new ProcessBuilder(command);
    if (workDir != null) {
      pb.directory(workDir.toFile());
    }
    long started = System.nanoTime();
    Process process;
    try {
      process = pb.start();
    } catch (IOException e) {
      throw new PipelineException(
          ErrorKind.WORKER_UNAVAILABLE,
          "Cannot start " + command.get(0) + ": " + e.getMessage(),
          e);
    }
    log.debug("cmd.start pid={} cmd={}", process.pid(), command);

    StreamCollector out =
        StreamCollector.start(process.getInputStream(), "cmd-out-" + process.pid());
    StreamCollector err =
        StreamCollector.start(process.getErrorStream(), "cmd-err-" + process.pid());
    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        terminate(process);
        log.warn("cmd.timeout pid={} timeout={} cmd={}", process.pid(), timeout, command);
        throw new PipelineException(
            ErrorKind.TIMEOUT_EXCEEDED, "Command exceeded " + timeout + ": " + command.get(0));
      }
    } catch (InterruptedException e) {
      terminate(process);
      Thread.currentThread().interrupt();
      throw new PipelineException(
          ErrorKind.TIMEOUT_EXCEEDED, "Interrupted while running " + command.get(0), e);
    }

    ExecResult result =
        ExecResult.builder()
            .command(List.copyOf(command))
            .exitCode(process.exitValue())
            .stdout(out.await(killGrace))
            .stderr(err.await(killGrace))
            .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
            .build();
    log.debug(
        "cmd.exit pid={} code={} durationMs={}",
        process.pid(),
        result.getExitCode(),
        result.getDurationMs());
    return result;
  }

  private void terminate(Process process) {
    process.destroy();
    try {
      if (!process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor(killGrace.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
  }

  /** Drains one stream, keeping at most {@link #MAX_CAPTURE_BYTES}. */
  private static final class StreamCollector implements Runnable {

    private final InputStream in;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final Thread thread;

    private StreamCollector(InputStream in, String name) {
      this.in = in;
      this.thread = new Thread(this, name);
      this.thread.setDaemon(true);
    }

    static StreamCollector start(InputStream in, String name) {
      StreamCollector c = new StreamCollector(in, name);
      c.thread.start();
      return c;
    }

    @Override
    public void run() {
      byte[] chunk = new byte[8192];
      try (InputStream stream = in) {
        int n;
        while ((n = stream.read(chunk)) != -1) {
          synchronized (buffer) {
            int room = MAX_CAPTURE_BYTES - buffer.size();
            if (room > 0) {
              buffer.write(chunk, 0, Math.min(n, room));
            }
          }
        }
      } catch (IOException e) {
        // stream closed when the process was killed
        log.debug("cmd.stream closed thread={} msg={}", thread.getName(), e.getMessage());
      }
    }

    String await(Duration grace) {
      try {
        thread.join(Math.max(1, grace.toMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      synchronized (buffer) {
        return buffer.toString(StandardCharsets.UTF_8);
      }
    }
  }
}
