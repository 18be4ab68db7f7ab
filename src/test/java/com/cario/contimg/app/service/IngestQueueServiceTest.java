package com.cario.contimg.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.contimg.app.TestTables;
import com.cario.contimg.app.error.ErrorKind;
import com.cario.contimg.app.error.PipelineException;
import com.cario.contimg.app.model.IngestStage;
import com.cario.contimg.app.model.IngestUnit;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class IngestQueueServiceTest {

  private static final Instant T0 = Instant.parse("2025-10-02T00:00:00Z");

  @Autowired private IngestQueueService queue;

  @Autowired private JdbcTemplate jdbc;

  @BeforeEach
  void clean() {
    TestTables.clear(jdbc);
  }

  @Test
  void enqueueStoresArrivedUnit() {
    IngestUnit unit = queue.enqueue("/in/obs_sb01.hdf5", T0);

    assertNotNull(unit.getId());
    assertEquals(IngestStage.ARRIVED, unit.getStage());
    assertEquals(1L, queue.stats().get(IngestStage.ARRIVED));
  }

  @Test
  void enqueueSameUnitTwiceIsDuplicate() {
    queue.enqueue("/in/obs_sb01.hdf5", T0);

    PipelineException e =
        assertThrows(PipelineException.class, () -> queue.enqueue("/in/obs_sb01.hdf5", T0));
    assertEquals(ErrorKind.DUPLICATE_UNIT, e.getKind());
    assertTrue(e.getKind().isBenign());
  }

  @Test
  void subMillisecondTimestampsNameTheSameUnit() {
    Instant fine = T0.plusNanos(1_234_567);

    IngestUnit unit = queue.enqueue("/in/obs_sb01.hdf5", fine);

    assertEquals(T0.plusMillis(1), unit.getAcquiredAt());
    assertEquals(
        unit.getAcquiredAt(),
        queue.claimReadyUnits(IngestStage.ARRIVED, null).get(0).getAcquiredAt());
    PipelineException e =
        assertThrows(
            PipelineException.class,
            () -> queue.enqueue("/in/obs_sb01.hdf5", T0.plusNanos(1_999_999)));
    assertEquals(ErrorKind.DUPLICATE_UNIT, e.getKind());
  }

  @Test
  void samePathWithOtherTimestampIsNewUnit() {
    queue.enqueue("/in/obs_sb01.hdf5", T0);
    queue.enqueue("/in/obs_sb01.hdf5", T0.plusSeconds(300));

    assertEquals(2, queue.claimReadyUnits(IngestStage.ARRIVED, null).size());
  }

  @Test
  void reEnqueueAfterGroupingReturnsGroupedUnit() {
    IngestUnit unit = queue.enqueue("/in/obs_sb01.hdf5", T0);
    queue.markGrouped(List.of(unit.getId()), "grp-test", "scan-1");

    IngestUnit again = queue.enqueue("/in/obs_sb01.hdf5", T0);

    assertEquals(IngestStage.GROUPED, again.getStage());
    assertEquals("grp-test", again.getGroupId());
    assertEquals(1L, queue.stats().get(IngestStage.GROUPED));
  }

  @Test
  void readyUnitsAreOldestFirstAndNotConsumed() {
    queue.enqueue("/in/c.hdf5", T0.plusSeconds(600));
    queue.enqueue("/in/a.hdf5", T0);
    queue.enqueue("/in/b.hdf5", T0.plusSeconds(300));

    List<IngestUnit> first = queue.claimReadyUnits(IngestStage.ARRIVED, Duration.ZERO);
    List<IngestUnit> second = queue.claimReadyUnits(IngestStage.ARRIVED, Duration.ZERO);

    assertEquals(List.of("/in/a.hdf5", "/in/b.hdf5", "/in/c.hdf5"), paths(first));
    assertEquals(paths(first), paths(second));
  }

  @Test
  void maxAgeLimitsLookback() {
    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    queue.enqueue("/in/old.hdf5", now.minus(Duration.ofHours(2)));
    queue.enqueue("/in/new.hdf5", now.minus(Duration.ofMinutes(10)));

    List<IngestUnit> ready = queue.claimReadyUnits(IngestStage.ARRIVED, Duration.ofHours(1));

    assertEquals(List.of("/in/new.hdf5"), paths(ready));
  }

  @Test
  void partialClaimChangesNothing() {
    IngestUnit a = queue.enqueue("/in/a.hdf5", T0);
    IngestUnit b = queue.enqueue("/in/b.hdf5", T0.plusSeconds(300));
    queue.markGrouped(List.of(b.getId()), "grp-first", "scan-1");

    PipelineException e =
        assertThrows(
            PipelineException.class,
            () -> queue.markGrouped(List.of(a.getId(), b.getId()), "grp-second", "scan-2"));

    assertEquals(ErrorKind.PARTIAL_CLAIM, e.getKind());
    List<IngestUnit> stillReady = queue.claimReadyUnits(IngestStage.ARRIVED, null);
    assertEquals(List.of("/in/a.hdf5"), paths(stillReady));
    assertEquals("grp-first", queue.unitsForGroup("grp-first").get(0).getGroupId());
    assertTrue(queue.unitsForGroup("grp-second").isEmpty());
  }

  @Test
  void concurrentEnqueueOfSameUnitStoresOneRow() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        Callable<Boolean> task =
            () -> {
              start.await();
              try {
                queue.enqueue("/in/race.hdf5", T0);
                return true;
              } catch (PipelineException e) {
                assertEquals(ErrorKind.DUPLICATE_UNIT, e.getKind());
                return false;
              }
            };
        results.add(pool.submit(task));
      }
      start.countDown();
      int inserted = 0;
      for (Future<Boolean> f : results) {
        if (f.get(30, TimeUnit.SECONDS)) {
          inserted++;
        }
      }
      assertEquals(1, inserted);
      assertEquals(1L, queue.stats().get(IngestStage.ARRIVED));
    } finally {
      pool.shutdownNow();
    }
  }

  private static List<String> paths(List<IngestUnit> units) {
    List<String> out = new ArrayList<>();
    units.forEach(u -> out.add(u.getPath()));
    return out;
  }
}
