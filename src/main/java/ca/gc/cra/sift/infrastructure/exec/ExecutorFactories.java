package ca.gc.cra.sift.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the executors that host SIFT worker ranks.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  static final String DEFAULT_PREFIX = "sift-worker";

  private ExecutorFactories() {}

  /**
   * Builds a pool holding exactly one thread per rank.
   * <p>Threads are created lazily in submission order and named {@code prefix-<n>}, so a caller that submits
   * rank 0 first, then rank 1, and so on, gets thread {@code n} for rank {@code n}. Tasks are handed off
   * without queueing; a submission made while every rank thread is busy is rejected. Uncaught failures are
   * logged with the rank of the thread that died.</p>
   *
   * @param ranks number of rank threads; must be positive
   * @param prefix thread-name prefix; blank selects {@value #DEFAULT_PREFIX}
   * @return configured executor service
   */
  public static ExecutorService newRankPool(int ranks, String prefix) {
    if (ranks <= 0) {
      throw new IllegalArgumentException("ranks must be positive (was " + ranks + ")");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_PREFIX : prefix;
    AtomicInteger nextRank = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      int rank = nextRank.getAndIncrement();
      Thread thread = new Thread(runnable, threadPrefix + "-" + rank);
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler((t, ex) ->
          log.error("Rank {} thread {} terminated unexpectedly", rank, t.getName(), ex));
      return thread;
    };

    return new ThreadPoolExecutor(
        ranks,
        ranks,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        (task, executor) -> {
          throw new RejectedExecutionException("all " + ranks + " rank threads are busy");
        });
  }
}
