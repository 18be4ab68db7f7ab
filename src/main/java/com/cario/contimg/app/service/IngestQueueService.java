package com.cario.contimg.app.service;

import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.repository.jdbc.IngestUnitRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable queue of arrived input files.
 *
 * <p>Writers are serialized in-process by a lock and across processes by the unique (path,
 * acquiredAt) constraint plus the conditional claim update. Reads never take the lock.
 */
@Log4j2
public class IngestQueueService {

  private final IngestUnitRepository units;
  private final TransactionTemplate tx;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock(true);

  public IngestQueueService(IngestUnitRepository units, TransactionTemplate tx, Clock clock) {
    this.units = units;
    this.tx = tx;
    this.clock = clock;
  }

  /**
   * Records an arrived file. Acquisition times are stored to the millisecond, so two timestamps
   * that differ only below that name the same unit.
   *
   * @return the new unit, or the existing one if it was already grouped (re-delivery after
   *     grouping is a no-op)
   * @throws PipelineException {@link ErrorKind#DUPLICATE_UNIT} if the same unit is still waiting
   */
  public IngestUnit enqueue(String path, Instant acquiredAt) {
    if (path == null || path.isBlank()) {
      throw new IllegalArgumentException("path must not be blank");
    }
    if (acquiredAt == null) {
      throw new IllegalArgumentException("acquiredAt must not be null");
    }
    Instant at = acquiredAt.truncatedTo(ChronoUnit.MILLIS);
    writeLock.lock();
    try {
      return tx.execute(
          status -> {
            Optional<IngestUnit> existing = units.findByPathAndAcquiredAt(path, at);
            if (existing.isPresent()) {
              IngestUnit unit = existing.get();
              if (unit.getStage() == IngestStage.GROUPED) {
                log.debug(
                    "ingest.enqueue already-grouped path={} groupId={}", path, unit.getGroupId());
                return unit;
              }
              throw duplicate(path, at);
            }
            IngestUnit unit = units.insert(path, at, clock.instant());
            log.info(
                "ingest.enqueue ok id={} path={} acquiredAt={}", unit.getId(), path, at);
            return unit;
          });
    } catch (DuplicateKeyException e) {
      // another process inserted between our read and write
      throw duplicate(path, at);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Units waiting in {@code stage}, oldest acquisition first. Non-destructive: the same units are
   * returned again until something claims them.
   *
   * @param maxAge lookback window relative to now; null or zero means no bound
   */
  public List<IngestUnit> claimReadyUnits(IngestStage stage, Duration maxAge) {
    Instant notBefore =
        maxAge == null || maxAge.isZero() || maxAge.isNegative()
            ? null
            : clock.instant().minus(maxAge);
    return units.findByStage(stage, notBefore);
  }

  /**
   * Atomically moves every listed unit to {@link IngestStage#GROUPED}. Joins the caller's
   * transaction when there is one, so a partial claim rolls back the whole formation.
   *
   * @throws PipelineException {@link ErrorKind#PARTIAL_CLAIM} if any unit was already claimed
   */
  public void markGrouped(List<Long> unitIds, String groupId, String claimedBy) {
    markGrouped(unitIds, groupId, claimedBy, false);
  }

  /**
   * As {@link #markGrouped(List, String, String)}; with {@code fromFailedGroups} a unit whose
   * current group has failed may be claimed again. Units of live groups never are.
   */
  public void markGrouped(
      List<Long> unitIds, String groupId, String claimedBy, boolean fromFailedGroups) {
    Set<Long> ids = new LinkedHashSet<>(unitIds);
    if (ids.isEmpty()) {
      throw new IllegalArgumentException("unitIds must not be empty");
    }
    writeLock.lock();
    try {
      tx.executeWithoutResult(
          status -> {
            int claimed =
                units.claimForGroup(ids, groupId, claimedBy, clock.instant(), fromFailedGroups);
            if (claimed != ids.size()) {
              throw new PipelineException(
                  ErrorKind.PARTIAL_CLAIM,
                  "Claimed "
                      + claimed
                      + " of "
                      + ids.size()
                      + " units for group "
                      + groupId
                      + "; others were taken");
            }
          });
    } finally {
      writeLock.unlock();
    }
    log.debug("ingest.grouped groupId={} units={} claimedBy={}", groupId, ids.size(), claimedBy);
  }

  public List<IngestUnit> unitsForGroup(String groupId) {
    return units.findByGroupId(groupId);
  }

  public List<IngestUnit> findByIds(List<Long> ids) {
    return units.findByIds(ids);
  }

  public Map<IngestStage, Long> stats() {
    return units.countByStage();
  }

  private static PipelineException duplicate(String path, Instant acquiredAt) {
    return new PipelineException(
        ErrorKind.DUPLICATE_UNIT, "Unit already queued: " + path + " @ " + acquiredAt);
  }
}
