package ca.gc.cra.sift.application.pipeline;

/**
 * Raised when a worker rank fails; the whole scan is aborted and no result is produced.
 *
 * @since 0.1.0
 */
public final class WorkerFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int rank;

  /**
   * Creates the exception.
   *
   * @param rank failing rank
   * @param cause failure raised by the rank
   */
  public WorkerFailureException(int rank, Throwable cause) {
    super("Worker rank " + rank + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }
}
