package ca.gc.cra.sift.application.pipeline;

import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import ca.gc.cra.sift.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Fan-out/fan-in primitive that runs one worker per rank with full-barrier semantics.
 * <p>Distribute point: every rank blocks until the root has handed out all partitions. Collect point: the
 * root blocks until every rank has reported. The first failing rank aborts the run; the remaining ranks
 * are cancelled and a {@link WorkerFailureException} is raised.</p>
 * <p>Worker threads are named {@code sift-worker-<rank>} and carry the {@code sift.rank} MDC key.
 * Instances are reusable; each {@link #run} call owns a fresh pool.</p>
 *
 * @since 0.1.0
 */
public final class ScatterGather {
  private static final Logger log = LoggerFactory.getLogger(ScatterGather.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  static final String RANK_MDC_KEY = "sift.rank";

  private final int workerCount;
  private final String threadPrefix;

  /**
   * Creates the primitive for a fixed number of ranks.
   *
   * @param workerCount number of ranks; must be positive
   */
  public ScatterGather(int workerCount) {
    this(workerCount, "sift-worker");
  }

  ScatterGather(int workerCount, String threadPrefix) {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive (was " + workerCount + ")");
    }
    this.workerCount = workerCount;
    this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
  }

  /**
   * Scatters {@code partitions} to the ranks, runs {@code worker} on each, and gathers the reports.
   *
   * @param partitions exactly one partition per rank, indexed by rank
   * @param worker detection applied by each rank to its own partition
   * @return reports ordered by rank
   * @throws InterruptedException if the root is interrupted while waiting at a barrier
   * @throws WorkerFailureException if any rank fails
   */
  public List<WorkerReport> run(List<Partition> partitions, Function<Partition, WorkerReport> worker)
      throws InterruptedException {
    Objects.requireNonNull(partitions, "partitions");
    Objects.requireNonNull(worker, "worker");
    if (partitions.size() != workerCount) {
      throw new IllegalArgumentException(
          "expected " + workerCount + " partitions but received " + partitions.size());
    }

    ExecutorService pool = ExecutorFactories.newRankPool(workerCount, threadPrefix);
    CompletionService<WorkerReport> completion = new ExecutorCompletionService<>(pool);
    CountDownLatch distributed = new CountDownLatch(1);
    List<Future<WorkerReport>> futures = new ArrayList<>(workerCount);
    try {
      for (Partition partition : partitions) {
        futures.add(completion.submit(() -> runRank(partition, worker, distributed)));
      }
      distributed.countDown();
      log.debug("Distributed {} partitions", partitions.size());

      List<WorkerReport> reports = new ArrayList<>(workerCount);
      for (int received = 0; received < workerCount; received++) {
        Future<WorkerReport> done = completion.take();
        try {
          reports.add(done.get());
        } catch (ExecutionException ex) {
          cancelAll(futures);
          throw asWorkerFailure(ex.getCause());
        }
      }
      reports.sort(Comparator.comparingInt(WorkerReport::rank));
      return List.copyOf(reports);
    } catch (InterruptedException ex) {
      cancelAll(futures);
      throw ex;
    } finally {
      distributed.countDown();
      shutdown(pool);
    }
  }

  private static WorkerReport runRank(
      Partition partition, Function<Partition, WorkerReport> worker, CountDownLatch distributed)
      throws InterruptedException {
    distributed.await();
    MDC.put(RANK_MDC_KEY, Integer.toString(partition.rank()));
    try {
      WorkerReport report = worker.apply(partition);
      if (report == null) {
        throw new IllegalStateException("worker returned no report");
      }
      log.debug("Rank {} scanned {} records via {} and found {} addresses",
          partition.rank(), partition.size(), report.path(), report.hits().size());
      return report;
    } catch (RuntimeException | Error ex) {
      throw new WorkerFailureException(partition.rank(), ex);
    } finally {
      MDC.remove(RANK_MDC_KEY);
    }
  }

  private static WorkerFailureException asWorkerFailure(Throwable cause) {
    if (cause instanceof WorkerFailureException failure) {
      return failure;
    }
    return new WorkerFailureException(-1, cause);
  }

  private static void cancelAll(List<Future<WorkerReport>> futures) {
    for (Future<WorkerReport> future : futures) {
      future.cancel(true);
    }
  }

  private static void shutdown(ExecutorService pool) {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Worker pool did not terminate within {}", SHUTDOWN_TIMEOUT);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
