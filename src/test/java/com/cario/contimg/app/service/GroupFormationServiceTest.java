package com.cario.contimg.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.contimg.app.TestTables;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.GroupFormationReport;
import com.cario.contimg.app.model.GroupStatus;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import com.cario.contimg.app.model.ProcessingGroup;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class GroupFormationServiceTest {

  private static final Instant T0 = Instant.parse("2025-10-02T00:00:00Z");
  private static final Duration CADENCE = Duration.ofMinutes(5);

  @Autowired private GroupFormationService formation;

  @Autowired private IngestQueueService queue;

  @Autowired private JdbcTemplate jdbc;

  @BeforeEach
  void clean() {
    TestTables.clear(jdbc);
  }

  @Test
  void tenUnitsAtFiveMinuteCadenceFormOneGroup() {
    List<IngestUnit> units = enqueueSeries("sb", T0, 10);

    GroupFormationReport report = formation.formGroups();

    assertEquals(1, report.getFormed().size());
    ProcessingGroup group = report.getFormed().get(0);
    assertEquals(10, group.getMemberCount());
    assertEquals(Duration.ofMinutes(45), group.getSpan());
    assertTrue(group.getGroupId().startsWith("grp-"));
    assertEquals(GroupStatus.FORMED, group.getStatus());
    assertEquals(
        units.stream().map(IngestUnit::getPath).collect(Collectors.toList()),
        formation.getGroup(group.getGroupId()).getMemberPaths());
    assertEquals(10L, queue.stats().get(IngestStage.GROUPED));
    assertEquals(0L, queue.stats().get(IngestStage.ARRIVED));
  }

  @Test
  void incompleteTailIsDeferredUntilMoreArrive() {
    enqueueSeries("sb", T0, 15);

    GroupFormationReport first = formation.formGroups();
    assertEquals(1, first.getFormed().size());
    assertEquals(5, first.getDeferred());

    enqueueSeries("late", T0.plus(CADENCE.multipliedBy(15)), 5);
    GroupFormationReport second = formation.formGroups();

    assertEquals(1, second.getFormed().size());
    assertEquals(0, second.getDeferred());
    assertEquals(20L, queue.stats().get(IngestStage.GROUPED));
  }

  @Test
  void rescanDoesNotRegroup() {
    enqueueSeries("sb", T0, 10);

    formation.formGroups();
    GroupFormationReport again = formation.formGroups();

    assertTrue(again.getFormed().isEmpty());
    assertEquals(1, countGroups());
  }

  @Test
  void unitsBeforeLargeGapAreExcluded() {
    enqueueSeries("early", T0, 5);
    enqueueSeries("late", T0.plus(Duration.ofMinutes(45)), 10);

    GroupFormationReport report = formation.formGroups();

    assertEquals(1, report.getFormed().size());
    assertTrue(report.getFormed().get(0).getMemberPaths().get(0).contains("late"));
    assertEquals(5, report.getExclusions().size());
    assertTrue(report.getExclusions().get(0).contains("gap"));
    assertEquals(5L, queue.stats().get(IngestStage.ARRIVED));
  }

  @Test
  void resubmittingSameMembersIsDuplicate() {
    List<IngestUnit> units = enqueueSeries("sb", T0, 10);
    List<Long> ids = units.stream().map(IngestUnit::getId).collect(Collectors.toList());

    Optional<ProcessingGroup> first = formation.formGroup(ids);
    Optional<ProcessingGroup> second = formation.formGroup(ids);

    assertTrue(first.isPresent());
    assertFalse(second.isPresent());
    assertEquals(1, countGroups());
  }

  @Test
  void failedGroupCanBeReformedManually() {
    List<IngestUnit> units = enqueueSeries("sb", T0, 10);
    List<Long> ids = units.stream().map(IngestUnit::getId).collect(Collectors.toList());
    ProcessingGroup failed = formation.formGroup(ids).orElseThrow();
    formation.updateStatus(failed.getGroupId(), GroupStatus.FAILED, "calibration diverged");

    ProcessingGroup again = formation.formGroup(ids).orElseThrow();

    assertNotEquals(failed.getGroupId(), again.getGroupId());
    assertEquals(GroupStatus.FORMED, again.getStatus());
    assertEquals(2, countGroups());
    for (IngestUnit unit : queue.findByIds(ids)) {
      assertEquals(IngestStage.GROUPED, unit.getStage());
      assertEquals(again.getGroupId(), unit.getGroupId());
    }
    assertTrue(formation.formGroups().getFormed().isEmpty());
    assertFalse(formation.formGroup(ids).isPresent());
  }

  @Test
  void unitsOfLiveGroupAreNotReclaimed() {
    List<IngestUnit> units = enqueueSeries("sb", T0, 10);
    List<Long> ids = units.stream().map(IngestUnit::getId).collect(Collectors.toList());
    ProcessingGroup live = formation.formGroup(ids).orElseThrow();
    formation.updateStatus(live.getGroupId(), GroupStatus.PROCESSING, "calibrating");

    PipelineException e =
        assertThrows(
            PipelineException.class,
            () -> queue.markGrouped(ids, "grp-other", "manual-test", true));

    assertEquals(ErrorKind.PARTIAL_CLAIM, e.getKind());
    assertEquals(live.getGroupId(), queue.findByIds(ids).get(0).getGroupId());
  }

  @Test
  void concurrentScansGroupEachUnitOnce() throws Exception {
    enqueueSeries("sb", T0, 20);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<GroupFormationReport>> reports = new ArrayList<>();
    try {
      for (int i = 0; i < 4; i++) {
        reports.add(
            pool.submit(
                () -> {
                  start.await();
                  return formation.formGroups();
                }));
      }
      start.countDown();
      int formed = 0;
      for (Future<GroupFormationReport> f : reports) {
        formed += f.get(30, TimeUnit.SECONDS).getFormed().size();
      }
      assertEquals(2, formed);
      assertEquals(2, countGroups());
      Integer distinct =
          jdbc.queryForObject(
              "SELECT COUNT(DISTINCT unit_id) FROM group_members", Integer.class);
      Integer rows = jdbc.queryForObject("SELECT COUNT(*) FROM group_members", Integer.class);
      assertEquals(20, distinct);
      assertEquals(20, rows);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void statusMovesForwardOnly() {
    enqueueSeries("sb", T0, 10);
    String groupId = formation.formGroups().getFormed().get(0).getGroupId();

    assertEquals(
        GroupStatus.PROCESSING,
        formation.updateStatus(groupId, GroupStatus.PROCESSING, null).getStatus());
    PipelineException e =
        assertThrows(
            PipelineException.class,
            () -> formation.updateStatus(groupId, GroupStatus.FORMED, "undo"));
    assertEquals(ErrorKind.INVALID_TRANSITION, e.getKind());
    assertEquals(
        GroupStatus.COMPLETE,
        formation.updateStatus(groupId, GroupStatus.COMPLETE, "imaged").getStatus());
  }

  @Test
  void unknownGroupIsNotFound() {
    PipelineException e =
        assertThrows(PipelineException.class, () -> formation.getGroup("grp-missing"));
    assertEquals(ErrorKind.NOT_FOUND, e.getKind());
  }

  private List<IngestUnit> enqueueSeries(String prefix, Instant start, int count) {
    List<IngestUnit> units = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      Instant t = start.plus(CADENCE.multipliedBy(i));
      units.add(queue.enqueue("/in/" + prefix + "_" + t + "_sb00.hdf5", t));
    }
    return units;
  }

  private int countGroups() {
    Integer n = jdbc.queryForObject("SELECT COUNT(*) FROM processing_groups", Integer.class);
    return n == null ? 0 : n;
  }
}
