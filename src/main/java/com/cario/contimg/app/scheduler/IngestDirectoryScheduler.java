package com.cario.contimg.app.scheduler;

import com.cario.contimg.app.config.PipelineProperties;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.service.IngestQueueService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Sweeps the input directory and enqueues every file whose name carries an acquisition timestamp.
 * Files already queued are skipped quietly, so the sweep can run as often as needed.
 */
@Log4j2
public class IngestDirectoryScheduler {

  private final IngestQueueService queue;
  private final PipelineProperties.Ingest settings;
  private final Pattern filePattern;

  public IngestDirectoryScheduler(IngestQueueService queue, PipelineProperties.Ingest settings) {
    this.queue = queue;
    this.settings = settings;
    this.filePattern = Pattern.compile(settings.getFilePattern());
  }

  @Scheduled(fixedDelayString = "${pipeline.ingest.scan-interval-ms:30000}")
  public void scheduledSweep() {
    sweep();
  }

  /** @return number of newly enqueued units */
  public int sweep() {
    if (settings.getInputDir() == null || settings.getInputDir().isBlank()) {
      log.warn("ingest.sweep skipped reason=no-input-dir");
      return 0;
    }
    Path dir = Paths.get(settings.getInputDir());
    List<Path> files;
    try (Stream<Path> listing = Files.list(dir)) {
      files = listing.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    } catch (IOException e) {
      log.error("ingest.sweep list-failed dir={} msg={}", dir, e.getMessage());
      return 0;
    }

    int added = 0;
    int duplicates = 0;
    int unmatched = 0;
    for (Path file : files) {
      Optional<Instant> acquiredAt = parseTimestamp(file.getFileName().toString());
      if (acquiredAt.isEmpty()) {
        unmatched++;
        log.debug("ingest.sweep skip file={} reason=no-timestamp", file);
        continue;
      }
      try {
        IngestUnit unit = queue.enqueue(file.toAbsolutePath().toString(), acquiredAt.get());
        if (unit.getStage() == IngestStage.ARRIVED) {
          added++;
        } else {
          duplicates++;
        }
      } catch (PipelineException e) {
        if (e.getKind() != ErrorKind.DUPLICATE_UNIT) {
          throw e;
        }
        duplicates++;
      }
    }
    log.info(
        "ingest.sweep ok dir={} files={} added={} duplicates={} unmatched={}",
        dir,
        files.size(),
        added,
        duplicates,
        unmatched);
    return added;
  }

  /** Acquisition time from the {@code timestamp} group of the file pattern, read as UTC. */
  Optional<Instant> parseTimestamp(String fileName) {
    Matcher m = filePattern.matcher(fileName);
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDateTime.parse(m.group("timestamp")).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException | IllegalArgumentException e) {
      log.warn("ingest.sweep bad-timestamp file={} msg={}", fileName, e.getMessage());
      return Optional.empty();
    }
  }
}
