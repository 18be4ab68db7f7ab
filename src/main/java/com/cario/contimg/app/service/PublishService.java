package com.cario.contimg.app.service;

import com.cario.contimg.app.config.PipelineProperties;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.Product;
import com.cario.contimg.app.model.ProductStatus;
import com.cario.contimg.app.model.PublishOutcome;
import com.cario.contimg.app.model.PublishResult;
import com.cario.contimg.app.repository.jdbc.ProductRepository;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Moves finalized products from staging to production storage, exactly once per product.
 *
 * <p>The row lock is held only while deciding and flipping the row to publishing; the move itself
 * runs outside any transaction on the storage executor under a deadline. Failures are recorded on
 * the row and returned in the {@link PublishResult}, they are never thrown at the caller.
 */
@Log4j2
public class PublishService {

  public static final String MODE_AUTO = "auto";
  public static final String MODE_MANUAL = "manual";

  static final int MAX_NAME_ATTEMPTS = 100;

  private final ProductRepository products;
  private final TransactionTemplate tx;
  private final StorageMover mover;
  private final AsyncTaskExecutor ioExecutor;
  private final PathGuard stagingGuard;
  private final PathGuard productionGuard;
  private final PipelineProperties.Publish settings;
  private final Duration moveTimeout;
  private final Clock clock;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public PublishService(
      ProductRepository products,
      TransactionTemplate tx,
      StorageMover mover,
      AsyncTaskExecutor ioExecutor,
      PipelineProperties props,
      Clock clock) {
    this.products = products;
    this.tx = tx;
    this.mover = mover;
    this.ioExecutor = ioExecutor;
    this.stagingGuard = new PathGuard(Paths.get(props.getStorage().getStagingRoot()));
    this.productionGuard = new PathGuard(Paths.get(props.getStorage().getProductionRoot()));
    this.settings = props.getPublish();
    this.moveTimeout = props.getStorage().getMoveTimeout();
    this.clock = clock;
  }

  public PublishResult triggerPublish(String dataId, int maxAttempts) {
    return publish(dataId, maxAttempts, MODE_AUTO);
  }

  /** Operator-requested publish; skips the auto-publish criteria but not the attempt budget. */
  public PublishResult publishManual(String dataId) {
    return publish(dataId, settings.getMaxAttempts(), MODE_MANUAL);
  }

  /**
   * Resets a failed product to staging with a fresh attempt budget and publishes it.
   *
   * @throws PipelineException {@link ErrorKind#INVALID_TRANSITION} if it is not failed
   */
  public PublishResult retryFailed(String dataId) {
    tx.executeWithoutResult(
        status -> {
          Product p = lockRow(dataId);
          if (p.getStatus() != ProductStatus.FAILED) {
            throw new PipelineException(
                ErrorKind.INVALID_TRANSITION,
                "Product " + dataId + " is " + p.getStatus().value() + ", not failed");
          }
          p.setStatus(ProductStatus.STAGING);
          p.setPublishAttempts(0);
          p.setPublishError(null);
          p.setPublishingStartedAt(null);
          p.setUpdatedAt(clock.instant());
          products.update(p);
        });
    log.info("publish.retry reset dataId={}", dataId);
    return publish(dataId, settings.getMaxAttempts(), MODE_MANUAL);
  }

  /** Publishes every staging product that currently meets the auto-publish criteria. */
  public List<PublishResult> drainReady() {
    List<Product> ready =
        products.findPublishCandidates(settings.getMaxAttempts(), settings.getBatchSize());
    List<PublishResult> results = new ArrayList<>(ready.size());
    for (Product p : ready) {
      results.add(triggerPublish(p.getDataId(), settings.getMaxAttempts()));
    }
    if (!results.isEmpty()) {
      long published = results.stream().filter(PublishResult::isPublished).count();
      log.info("publish.drain ok candidates={} published={}", results.size(), published);
    }
    return results;
  }

  /**
   * Repairs rows left in publishing by a crashed process. A row whose move evidently completed is
   * marked published, anything else goes back to staging.
   *
   * @return number of rows repaired
   */
  public int reconcileStale() {
    Instant cutoff = clock.instant().minus(settings.getStaleAfter());
    int repaired = 0;
    for (Product stale : products.findPublishingStartedBefore(cutoff)) {
      if (inFlight.contains(stale.getDataId())) {
        continue;
      }
      Boolean done = tx.execute(status -> reconcileOne(stale.getDataId(), cutoff));
      if (Boolean.TRUE.equals(done)) {
        repaired++;
      }
    }
    if (repaired > 0) {
      log.warn("publish.reconcile repaired={}", repaired);
    }
    return repaired;
  }

  public boolean isInFlight(String dataId) {
    return inFlight.contains(dataId);
  }

  private PublishResult publish(String dataId, int maxAttempts, String mode) {
    Claim claim = tx.execute(status -> claim(dataId, maxAttempts));
    if (claim.result() != null) {
      return claim.result();
    }

    inFlight.add(dataId);
    try {
      Path destination = move(claim.product(), claim.source());
      PublishResult result = tx.execute(status -> recordSuccess(dataId, destination, mode));
      log.info(
          "publish.ok dataId={} dest={} mode={} attempts={}",
          dataId,
          destination,
          mode,
          claim.product().getPublishAttempts() + 1);
      return result;
    } catch (PipelineException e) {
      return tx.execute(status -> recordFailure(dataId, e.getKind(), e.getMessage(), maxAttempts));
    } catch (RuntimeException e) {
      return tx.execute(
          status -> recordFailure(dataId, ErrorKind.STORAGE_FAILURE, e.toString(), maxAttempts));
    } finally {
      inFlight.remove(dataId);
    }
  }

  /** Decision plus the row flip, under the row lock. */
  private Claim claim(String dataId, int maxAttempts) {
    Product p = products.findByDataIdForUpdate(dataId).orElse(null);
    if (p == null) {
      return Claim.done(PublishResult.of(dataId, PublishOutcome.NOT_FOUND, "unknown data id"));
    }
    switch (p.getStatus()) {
      case PUBLISHING:
        log.debug("publish.skip dataId={} reason=in-progress", dataId);
        return Claim.done(
            result(p, PublishOutcome.ALREADY_IN_PROGRESS, null, "already publishing"));
      case PUBLISHED:
        return Claim.done(result(p, PublishOutcome.ALREADY_PUBLISHED, null, p.getPublishedPath()));
      case FAILED:
        return Claim.done(
            result(p, PublishOutcome.NOT_ELIGIBLE, null, "failed; operator retry required"));
      default:
        break;
    }
    if (p.getPublishAttempts() >= maxAttempts) {
      p.setStatus(ProductStatus.FAILED);
      p.setUpdatedAt(clock.instant());
      products.update(p);
      log.error(
          "alert.publish.exhausted dataId={} attempts={} lastError={}",
          dataId,
          p.getPublishAttempts(),
          p.getPublishError());
      return Claim.done(result(p, PublishOutcome.FAILED, null, "attempts exhausted"));
    }
    Path source;
    try {
      source = stagingGuard.requireExistingInside(p.getStagingPath());
    } catch (PipelineException e) {
      return Claim.done(recordFailure(p, e.getKind(), e.getMessage(), maxAttempts));
    }
    if (!products.markPublishing(dataId, clock.instant())) {
      return Claim.done(result(p, PublishOutcome.ALREADY_IN_PROGRESS, null, "lost the claim"));
    }
    return new Claim(p, source, null);
  }

  private Path move(Product p, Path source) {
    Path destination = reserveDestination(p, source);
    try {
      runMove(source, destination);
    } catch (RuntimeException e) {
      releaseReservation(destination);
      throw e;
    }
    if (!Files.exists(destination, LinkOption.NOFOLLOW_LINKS)) {
      throw new PipelineException(
          ErrorKind.STORAGE_FAILURE, "Destination missing after move: " + destination);
    }
    if (Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
      throw new PipelineException(
          ErrorKind.STORAGE_FAILURE, "Source still present after move: " + source);
    }
    return destination;
  }

  private void runMove(Path source, Path destination) {
    Future<?> task =
        ioExecutor.submit(
            () -> {
              try {
                mover.move(source, destination);
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
            });
    try {
      task.get(moveTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      task.cancel(true);
      throw new PipelineException(
          ErrorKind.TIMEOUT_EXCEEDED, "Move did not finish within " + moveTimeout, e);
    } catch (InterruptedException e) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      throw new PipelineException(ErrorKind.STORAGE_FAILURE, "Interrupted while moving", e);
    } catch (ExecutionException e) {
      Throwable cause =
          e.getCause() instanceof UncheckedIOException u ? u.getCause() : e.getCause();
      if (cause instanceof PipelineException pe) {
        throw pe;
      }
      throw new PipelineException(ErrorKind.STORAGE_FAILURE, "Move failed: " + cause, cause);
    }
  }

  /**
   * Claims a production name by creating an empty placeholder there. Creation is atomic, so two
   * publishers (in this process or another) can never be handed the same name. A taken name moves
   * on to {@code base_<epochSeconds>.ext}, then {@code base_<epochSeconds>_<n>.ext}.
   */
  Path reserveDestination(Product p, Path source) {
    Path dir = productionGuard.getRoot().resolve(p.getDataType().publishDirectory());
    String name = source.getFileName().toString();
    boolean directory = Files.isDirectory(source, LinkOption.NOFOLLOW_LINKS);
    for (int n = 0; n < MAX_NAME_ATTEMPTS; n++) {
      Path candidate = productionGuard.requireParentInside(dir.resolve(candidateName(name, n)));
      try {
        if (directory) {
          Files.createDirectory(candidate);
        } else {
          Files.createFile(candidate);
        }
      } catch (FileAlreadyExistsException e) {
        continue;
      } catch (IOException e) {
        throw new PipelineException(
            ErrorKind.STORAGE_FAILURE, "Cannot reserve " + candidate + ": " + e.getMessage(), e);
      }
      if (n > 0) {
        log.warn(
            "publish.dest-exists dataId={} existing={} using={}",
            p.getDataId(),
            name,
            candidate.getFileName());
      }
      return candidate;
    }
    throw new PipelineException(
        ErrorKind.STORAGE_FAILURE,
        "No free production name for " + name + " after " + MAX_NAME_ATTEMPTS + " tries");
  }

  private String candidateName(String name, int n) {
    if (n == 0) {
      return name;
    }
    String base = FilenameUtils.getBaseName(name);
    String ext = FilenameUtils.getExtension(name);
    String suffix = "_" + clock.instant().getEpochSecond() + (n == 1 ? "" : "_" + n);
    return base + suffix + (ext.isEmpty() ? "" : "." + ext);
  }

  /** Drops the placeholder of a failed move, unless data already landed in it. */
  private void releaseReservation(Path destination) {
    try {
      if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS)
          && FileSystemStorageMover.isEmptyPlaceholder(destination)) {
        Files.delete(destination);
      }
    } catch (IOException e) {
      log.warn("publish.release-failed dest={} msg={}", destination, e.getMessage());
    }
  }

  /** Where an unsuffixed publish of {@code source} lands: productionRoot/typeDir/name. */
  Path expectedDestination(Product p, Path source) {
    return productionGuard
        .getRoot()
        .resolve(p.getDataType().publishDirectory())
        .resolve(source.getFileName().toString());
  }

  private PublishResult recordSuccess(String dataId, Path destination, String mode) {
    Product p = lockRow(dataId);
    Instant now = clock.instant();
    p.setStatus(ProductStatus.PUBLISHED);
    p.setPublishedPath(destination.toString());
    p.setPublishedAt(now);
    p.setPublishMode(mode);
    p.setPublishAttempts(0);
    p.setPublishError(null);
    p.setPublishingStartedAt(null);
    p.setUpdatedAt(now);
    products.update(p);
    return PublishResult.builder()
        .dataId(dataId)
        .outcome(PublishOutcome.PUBLISHED)
        .publishedPath(destination.toString())
        .build();
  }

  private PublishResult recordFailure(
      String dataId, ErrorKind kind, String message, int maxAttempts) {
    return recordFailure(lockRow(dataId), kind, message, maxAttempts);
  }

  private PublishResult recordFailure(
      Product p, ErrorKind kind, String message, int maxAttempts) {
    int attempts = p.getPublishAttempts() + 1;
    boolean exhausted = attempts >= maxAttempts;
    p.setPublishAttempts(attempts);
    p.setPublishError(truncate("[" + kind + "] " + message));
    p.setStatus(exhausted ? ProductStatus.FAILED : ProductStatus.STAGING);
    p.setPublishingStartedAt(null);
    p.setUpdatedAt(clock.instant());
    products.update(p);
    if (exhausted) {
      log.error(
          "alert.publish.exhausted dataId={} attempts={} kind={} msg={}",
          p.getDataId(),
          attempts,
          kind,
          message);
    } else {
      log.warn(
          "publish.failed dataId={} attempts={}/{} kind={} msg={}",
          p.getDataId(),
          attempts,
          maxAttempts,
          kind,
          message);
    }
    return result(
        p, exhausted ? PublishOutcome.FAILED : PublishOutcome.RETRY_PENDING, kind, message);
  }

  private boolean reconcileOne(String dataId, Instant cutoff) {
    Product p = products.findByDataIdForUpdate(dataId).orElse(null);
    if (p == null
        || p.getStatus() != ProductStatus.PUBLISHING
        || p.getPublishingStartedAt() == null
        || !p.getPublishingStartedAt().isBefore(cutoff)) {
      return false;
    }
    Path source = Paths.get(p.getStagingPath());
    Path expected = expectedDestination(p, source);
    Instant now = clock.instant();
    if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)
        && Files.exists(expected, LinkOption.NOFOLLOW_LINKS)) {
      p.setStatus(ProductStatus.PUBLISHED);
      p.setPublishedPath(expected.toString());
      p.setPublishedAt(now);
      p.setPublishAttempts(0);
      p.setPublishError(null);
      if (p.getPublishMode() == null) {
        p.setPublishMode(MODE_AUTO);
      }
      log.warn("publish.reconcile completed dataId={} dest={}", dataId, expected);
    } else {
      p.setStatus(ProductStatus.STAGING);
      p.setPublishError(
          truncate("reset after stale publishing since " + p.getPublishingStartedAt()));
      log.warn("publish.reconcile reset dataId={} since={}", dataId, p.getPublishingStartedAt());
    }
    p.setPublishingStartedAt(null);
    p.setUpdatedAt(now);
    products.update(p);
    return true;
  }

  private Product lockRow(String dataId) {
    return products
        .findByDataIdForUpdate(dataId)
        .orElseThrow(() -> PipelineException.notFound("Product", dataId));
  }

  private String truncate(String message) {
    int max = settings.getErrorMaxLength();
    return message == null || message.length() <= max ? message : message.substring(0, max);
  }

  private static PublishResult result(
      Product p, PublishOutcome outcome, ErrorKind kind, String message) {
    return PublishResult.builder()
        .dataId(p.getDataId())
        .outcome(outcome)
        .errorKind(kind)
        .message(message)
        .attempts(p.getPublishAttempts())
        .publishedPath(p.getPublishedPath())
        .build();
  }

  private record Claim(Product product, Path source, PublishResult result) {
    static Claim done(PublishResult result) {
      return new Claim(null, null, result);
    }
  }
}
