package ca.gc.cra.sift.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.tally.DetectionPath;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.MDC;

@Timeout(30)
class ScatterGatherTest {

  @Test
  void gathersOneReportPerRankInRankOrder() throws Exception {
    ScatterGather scatterGather = new ScatterGather(4);

    List<WorkerReport> reports =
        scatterGather.run(partitions(4), p -> report(p.rank(), "10.0.0." + p.rank()));

    assertEquals(List.of(0, 1, 2, 3), reports.stream().map(WorkerReport::rank).toList());
    assertEquals(1L, reports.get(2).hits().count("10.0.0.2"));
  }

  @Test
  void ranksRunConcurrentlyOnNamedThreadsWithRankContext() throws Exception {
    int workers = 3;
    CyclicBarrier allRunning = new CyclicBarrier(workers);
    Map<Integer, String> threadNames = new ConcurrentHashMap<>();
    Map<Integer, String> mdcRanks = new ConcurrentHashMap<>();

    new ScatterGather(workers, "test-rank").run(partitions(workers), p -> {
      try {
        allRunning.await(10, TimeUnit.SECONDS);
      } catch (Exception ex) {
        throw new IllegalStateException("ranks did not run side by side", ex);
      }
      threadNames.put(p.rank(), Thread.currentThread().getName());
      mdcRanks.put(p.rank(), MDC.get(ScatterGather.RANK_MDC_KEY));
      return WorkerReport.empty(p.rank());
    });

    assertEquals(Set.of("test-rank-0", "test-rank-1", "test-rank-2"), Set.copyOf(threadNames.values()));
    assertEquals(Map.of(0, "0", 1, "1", 2, "2"), mdcRanks);
  }

  @Test
  void failingRankAbortsRunAndCancelsPeers() {
    CountDownLatch never = new CountDownLatch(1);
    ScatterGather scatterGather = new ScatterGather(4);

    WorkerFailureException ex = assertThrows(WorkerFailureException.class,
        () -> scatterGather.run(partitions(4), p -> {
          if (p.rank() == 2) {
            throw new IllegalStateException("boom");
          }
          try {
            never.await();
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
          }
          return WorkerReport.empty(p.rank());
        }));

    assertEquals(2, ex.rank());
    assertInstanceOf(IllegalStateException.class, ex.getCause());
    assertEquals("boom", ex.getCause().getMessage());
  }

  @Test
  void missingReportIsAFailure() {
    WorkerFailureException ex = assertThrows(WorkerFailureException.class,
        () -> new ScatterGather(1).run(partitions(1), p -> null));

    assertEquals(0, ex.rank());
  }

  @Test
  void partitionCountMustMatchRanks() {
    assertThrows(IllegalArgumentException.class,
        () -> new ScatterGather(2).run(partitions(3), p -> WorkerReport.empty(p.rank())));
    assertThrows(IllegalArgumentException.class, () -> new ScatterGather(0));
  }

  private static List<Partition> partitions(int workers) {
    return IntStream.range(0, workers)
        .mapToObj(rank -> new Partition(
            rank, workers, List.of(RawRecord.of("record-" + rank)), Optional.empty()))
        .toList();
  }

  private static WorkerReport report(int rank, String ip) {
    return WorkerReport.freeForm(
        rank, SuspiciousIpTally.builder().increment(ip).build(), DetectionPath.FREE_FORM);
  }
}
