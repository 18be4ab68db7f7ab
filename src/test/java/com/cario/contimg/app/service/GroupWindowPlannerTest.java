package com.cario.contimg.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupWindowPlannerTest {

  private static final Instant T0 = Instant.parse("2025-10-02T00:00:00Z");
  private static final GroupLimits TEN_AT_FIVE =
      new GroupLimits(10, 10, Duration.ofMinutes(60), Duration.ofMinutes(10));

  private final GroupWindowPlanner planner = new GroupWindowPlanner();
  private long nextId = 1;

  @Test
  void exactSeriesFormsOneWindow() {
    GroupWindowPlanner.Plan plan = planner.plan(series(T0, 10, 5), TEN_AT_FIVE);

    assertEquals(1, plan.windows().size());
    assertEquals(10, plan.windows().get(0).size());
    assertTrue(plan.exclusions().isEmpty());
    assertEquals(0, plan.deferred());
  }

  @Test
  void longSeriesSplitsIntoConsecutiveWindows() {
    GroupWindowPlanner.Plan plan = planner.plan(series(T0, 25, 5), TEN_AT_FIVE);

    assertEquals(2, plan.windows().size());
    assertEquals(T0, plan.windows().get(0).get(0).getAcquiredAt());
    assertEquals(T0.plus(Duration.ofMinutes(50)), plan.windows().get(1).get(0).getAcquiredAt());
    assertEquals(5, plan.deferred());
  }

  @Test
  void gapExcludesEverythingBeforeIt() {
    List<IngestUnit> units = series(T0, 3, 5);
    units.addAll(series(T0.plus(Duration.ofMinutes(60)), 10, 5));

    GroupWindowPlanner.Plan plan = planner.plan(units, TEN_AT_FIVE);

    assertEquals(1, plan.windows().size());
    assertEquals(T0.plus(Duration.ofMinutes(60)), plan.windows().get(0).get(0).getAcquiredAt());
    assertEquals(3, plan.exclusions().size());
  }

  @Test
  void spanViolationDropsOnlyTheOldestUnit() {
    // 8-minute cadence: ten units would span 72 minutes, over the 60 minute bound
    List<IngestUnit> units = series(T0, 10, 8);
    GroupLimits limits = new GroupLimits(10, 10, Duration.ofMinutes(60), Duration.ofMinutes(10));

    GroupWindowPlanner.Plan plan = planner.plan(units, limits);

    assertTrue(plan.windows().isEmpty());
    assertTrue(plan.exclusions().get(0).contains("span"));
    assertEquals(10, plan.exclusions().size() + plan.deferred());
  }

  @Test
  void shortGroupAllowedWhenMinimumIsLower() {
    GroupLimits limits = new GroupLimits(10, 6, Duration.ofMinutes(60), Duration.ofMinutes(10));
    List<IngestUnit> units = series(T0, 7, 5);
    units.addAll(series(T0.plus(Duration.ofMinutes(90)), 2, 5));

    GroupWindowPlanner.Plan plan = planner.plan(units, limits);

    assertEquals(1, plan.windows().size());
    assertEquals(7, plan.windows().get(0).size());
    assertEquals(2, plan.deferred());
  }

  @Test
  void sameTimestampUnitsShareAWindow() {
    List<IngestUnit> units = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      units.add(unit("/in/sb" + i + ".hdf5", T0));
    }

    GroupWindowPlanner.Plan plan = planner.plan(units, TEN_AT_FIVE);

    assertEquals(1, plan.windows().size());
  }

  @Test
  void noCandidatesMeansEmptyPlan() {
    GroupWindowPlanner.Plan plan = planner.plan(List.of(), TEN_AT_FIVE);

    assertTrue(plan.windows().isEmpty());
    assertEquals(0, plan.deferred());
  }

  private List<IngestUnit> series(Instant start, int count, int cadenceMinutes) {
    List<IngestUnit> units = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      Instant t = start.plus(Duration.ofMinutes((long) i * cadenceMinutes));
      units.add(unit("/in/" + t + ".hdf5", t));
    }
    return units;
  }

  private IngestUnit unit(String path, Instant acquiredAt) {
    return IngestUnit.builder()
        .id(nextId++)
        .path(path)
        .acquiredAt(acquiredAt)
        .stage(IngestStage.ARRIVED)
        .build();
  }
}
