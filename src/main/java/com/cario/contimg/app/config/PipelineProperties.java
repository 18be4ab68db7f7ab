package com.cario.contimg.app.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Operator-tunable settings, bound from the {@code pipeline.*} keys.
 *
 * <p>Grouping and publish thresholds are inputs, not constants: the defaults below are the
 * documented operating point (ten files at a five minute cadence, sixty minute span, three publish
 * attempts) and are expected to be overridden per deployment.
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

  private Ingest ingest = new Ingest();
  private Grouping grouping = new Grouping();
  private Storage storage = new Storage();
  private Publish publish = new Publish();
  private Worker worker = new Worker();

  @Data
  public static class Ingest {
    private boolean enabled;
    /** Directory the acquisition system drops raw files into. */
    private String inputDir;
    /** Regex with a named group {@code timestamp} in ISO local date-time form (UTC). */
    private String filePattern = "(?<timestamp>\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})";
    private long scanIntervalMs = 30_000;
    /** Lookback for ready units; zero means unbounded. */
    private Duration maxAge = Duration.ZERO;
  }

  @Data
  public static class Grouping {
    private boolean enabled;
    private long scanIntervalMs = 60_000;
    /** Target member count of a group. */
    private int groupSize = 10;
    /** Minimum member count; fewer available units defer formation. Zero means groupSize. */
    private int minMembers;
    private Duration expectedInterval = Duration.ofMinutes(5);
    /** Allowed slack over groupSize * expectedInterval when deriving the max span. */
    private double spanSlack = 0.2;
    /** Explicit max span; when null it is derived from size, interval and slack. */
    private Duration maxSpan;
    private Duration maxGap = Duration.ofMinutes(10);
    /** Exclude candidates whose file has disappeared from disk. */
    private boolean verifyFilesExist;

    public int effectiveMinMembers() {
      return minMembers > 0 ? Math.min(minMembers, groupSize) : groupSize;
    }

    public Duration effectiveMaxSpan() {
      if (maxSpan != null) {
        return maxSpan;
      }
      double minutes = groupSize * (expectedInterval.toMillis() / 60_000.0) * (1.0 + spanSlack);
      return Duration.ofMinutes((long) Math.ceil(minutes - 1e-9));
    }
  }

  @Data
  public static class Storage {
    private String stagingRoot;
    private String productionRoot;
    private Duration moveTimeout = Duration.ofMinutes(10);
    private int ioThreads = 2;
  }

  @Data
  public static class Publish {
    private boolean enabled;
    private long drainIntervalMs = 60_000;
    private long reconcileIntervalMs = 300_000;
    private int maxAttempts = 3;
    private int batchSize = 20;
    /** A row in publishing longer than this with no in-flight move is reset. */
    private Duration staleAfter = Duration.ofMinutes(30);
    /** Staging rows older than this are reported as needing attention. */
    private Duration stagedTooLong = Duration.ofHours(24);
    private int errorMaxLength = 500;
  }

  @Data
  public static class Worker {
    /** {@code container} or {@code local}. */
    private String launcher = "local";
    /** Container CLI, e.g. docker or podman. */
    private String runtime = "docker";
    private String image;
    private String sessionName = "contimg-worker";
    /** Host path to worker-visible path. */
    private Map<String, String> mounts = new LinkedHashMap<>();
    /** Working directory of the worker; for the local launcher a host directory. */
    private String workDir;
    private Duration commandTimeout = Duration.ofHours(2);
    private Duration controlTimeout = Duration.ofMinutes(2);
    private Duration killGrace = Duration.ofSeconds(10);
    /** Utility inside the container that enforces exec deadlines; blank disables wrapping. */
    private String timeoutCommand = "timeout";
    private Duration restartWindow = Duration.ofMinutes(10);
    private int maxRestartsInWindow = 3;
    /** Command run by the built-in stage handler; placeholders {stagingPath} and {dataId}. */
    private List<String> stageCommand = new ArrayList<>();
    /** Stage the built-in handler is registered for; empty disables it. */
    private String stageCommandStage;
  }
}
