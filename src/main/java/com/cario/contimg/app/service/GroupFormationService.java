package com.cario.contimg.app.service;

import com.cario.contimg.app.config.PipelineProperties;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.GroupFormationReport;
import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.model.ProcessingGroup;
import com.cario.contimg.app.repository.jdbc.GroupRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Turns arrived ingest units into processing groups.
 *
 * <p>Each group is written in one transaction together with the claim of its members, so a unit is
 * grouped at most once and a crash never leaves a group without its members. Overlapping scans in
 * the same process are skipped, overlapping scans in other processes lose the claim and roll back.
 */
@Log4j2
public class GroupFormationService {

  private final IngestQueueService ingestQueue;
  private final GroupRepository groups;
  private final TransactionTemplate tx;
  private final GroupIdGenerator idGenerator;
  private final GroupWindowPlanner planner;
  private final GroupValidator validator;
  private final PipelineProperties.Grouping settings;
  private final Duration maxAge;
  private final Clock clock;
  private final ReentrantLock scanLock = new ReentrantLock();

  public GroupFormationService(
      IngestQueueService ingestQueue,
      GroupRepository groups,
      TransactionTemplate tx,
      GroupIdGenerator idGenerator,
      PipelineProperties props,
      Clock clock) {
    this.ingestQueue = ingestQueue;
    this.groups = groups;
    this.tx = tx;
    this.idGenerator = idGenerator;
    this.planner = new GroupWindowPlanner();
    this.settings = props.getGrouping();
    this.validator = new GroupValidator(settings.isVerifyFilesExist());
    this.maxAge = props.getIngest().getMaxAge();
    this.clock = clock;
  }

  /** One formation pass over every arrived unit. */
  public GroupFormationReport formGroups() {
    String scanId = "scan-" + UUID.randomUUID();
    GroupFormationReport report = new GroupFormationReport(scanId);
    if (!scanLock.tryLock()) {
      report.setSkipped(true);
      log.info("grouping.scan skipped scanId={} reason=scan-in-progress", scanId);
      return report;
    }
    try {
      GroupLimits limits = GroupLimits.from(settings);
      List<IngestUnit> candidates = ingestQueue.claimReadyUnits(IngestStage.ARRIVED, maxAge);
      report.setCandidates(candidates.size());

      GroupWindowPlanner.Plan plan = planner.plan(candidates, limits);
      plan.exclusions()
          .forEach(reason -> log.warn("grouping.exclude scanId={} reason={}", scanId, reason));
      report.getExclusions().addAll(plan.exclusions());
      report.setDeferred(plan.deferred());

      for (List<IngestUnit> window : plan.windows()) {
        List<String> violations = validator.validate(window, limits);
        if (!violations.isEmpty()) {
          String reason = window.get(0).getPath() + ": " + String.join("; ", violations);
          log.warn("grouping.invalid scanId={} reason={}", scanId, reason);
          report.getExclusions().add(reason);
          continue;
        }
        try {
          Optional<ProcessingGroup> formed = formInTransaction(window, limits, scanId, false);
          if (formed.isPresent()) {
            report.getFormed().add(formed.get());
          } else {
            report.getDuplicates().add(GroupIdGenerator.memberHash(paths(window)));
          }
        } catch (PipelineException e) {
          if (e.getKind() != ErrorKind.PARTIAL_CLAIM) {
            throw e;
          }
          report.setClaimConflicts(report.getClaimConflicts() + 1);
          log.warn("grouping.claim-conflict scanId={} msg={}", scanId, e.getMessage());
        }
      }

      log.info(
          "grouping.scan ok scanId={} candidates={} formed={} duplicates={} excluded={}"
              + " deferred={} conflicts={}",
          scanId,
          report.getCandidates(),
          report.getFormed().size(),
          report.getDuplicates().size(),
          report.getExclusions().size(),
          report.getDeferred(),
          report.getClaimConflicts());
      return report;
    } finally {
      scanLock.unlock();
    }
  }

  /**
   * Forms a group from explicitly chosen units, e.g. when an operator re-submits a batch. Units of
   * a failed group can be re-formed this way; units of any other group cannot.
   *
   * @return the new group, or empty if an equivalent non-failed group already exists
   */
  public Optional<ProcessingGroup> formGroup(List<Long> unitIds) {
    if (unitIds.isEmpty()) {
      throw new IllegalArgumentException("unitIds must not be empty");
    }
    List<IngestUnit> members = new ArrayList<>(ingestQueue.findByIds(unitIds));
    if (members.size() != unitIds.stream().distinct().count()) {
      throw new PipelineException(ErrorKind.NOT_FOUND, "Unknown ingest unit among " + unitIds);
    }
    members.sort(
        Comparator.comparing(IngestUnit::getAcquiredAt).thenComparing(IngestUnit::getId));
    GroupLimits limits = GroupLimits.from(settings);
    List<String> violations = validator.validate(members, limits);
    if (!violations.isEmpty()) {
      throw new IllegalArgumentException("Invalid group: " + String.join("; ", violations));
    }
    return formInTransaction(members, limits, "manual-" + UUID.randomUUID(), true);
  }

  public ProcessingGroup getGroup(String groupId) {
    ProcessingGroup group =
        groups.findById(groupId).orElseThrow(() -> PipelineException.notFound("Group", groupId));
    group.setMemberPaths(groups.findMemberPaths(groupId));
    return group;
  }

  public List<ProcessingGroup> findByStatus(GroupStatus status, int limit) {
    List<ProcessingGroup> found = groups.findByStatus(status, limit);
    found.forEach(g -> g.setMemberPaths(groups.findMemberPaths(g.getGroupId())));
    return found;
  }

  /**
   * Moves a group along formed, processing, complete; any non-terminal group may fail. Repeating
   * the current status is a no-op.
   */
  public ProcessingGroup updateStatus(String groupId, GroupStatus next, String reason) {
    tx.executeWithoutResult(
        status -> {
          ProcessingGroup current =
              groups
                  .findByIdForUpdate(groupId)
                  .orElseThrow(() -> PipelineException.notFound("Group", groupId));
          if (current.getStatus() == next) {
            return;
          }
          if (!isAllowed(current.getStatus(), next)) {
            throw new PipelineException(
                ErrorKind.INVALID_TRANSITION,
                "Group " + groupId + " cannot go from " + current.getStatus() + " to " + next);
          }
          groups.updateStatus(groupId, next, reason, clock.instant());
        });
    log.info("grouping.status groupId={} status={} reason={}", groupId, next, reason);
    return getGroup(groupId);
  }

  static boolean isAllowed(GroupStatus from, GroupStatus to) {
    switch (from) {
      case FORMED:
        return to == GroupStatus.PROCESSING || to == GroupStatus.FAILED;
      case PROCESSING:
        return to == GroupStatus.COMPLETE || to == GroupStatus.FAILED;
      default:
        return false;
    }
  }

  private Optional<ProcessingGroup> formInTransaction(
      List<IngestUnit> window, GroupLimits limits, String claimedBy, boolean fromFailedGroups) {
    List<String> memberPaths = paths(window);
    String memberHash = GroupIdGenerator.memberHash(memberPaths);
    return tx.execute(
        status -> {
          Optional<String> existing = groups.findActiveIdByMemberHash(memberHash);
          if (existing.isPresent()) {
            log.info(
                "grouping.duplicate memberHash={} existingGroupId={}", memberHash, existing.get());
            return Optional.<ProcessingGroup>empty();
          }
          Instant now = clock.instant();
          Instant first = window.get(0).getAcquiredAt();
          Instant last = window.get(window.size() - 1).getAcquiredAt();
          ProcessingGroup group =
              ProcessingGroup.builder()
                  .groupId(idGenerator.newGroupId(memberHash))
                  .memberHash(memberHash)
                  .memberPaths(memberPaths)
                  .firstAcquiredAt(first)
                  .lastAcquiredAt(last)
                  .spanMillis(Duration.between(first, last).toMillis())
                  .formedAt(now)
                  .status(GroupStatus.FORMED)
                  .validationNotes(validator.notes(window, limits))
                  .updatedAt(now)
                  .build();
          groups.insert(group, window);
          ingestQueue.markGrouped(
              window.stream().map(IngestUnit::getId).collect(Collectors.toList()),
              group.getGroupId(),
              claimedBy,
              fromFailedGroups);
          log.info(
              "grouping.formed groupId={} members={} span={} first={}",
              group.getGroupId(),
              window.size(),
              group.getSpan(),
              first);
          return Optional.of(group);
        });
  }

  private static List<String> paths(List<IngestUnit> window) {
    return window.stream().map(IngestUnit::getPath).collect(Collectors.toList());
  }
}
