/**
 * Executor factories used by the scatter/gather layer.
 * <p>Worker threads are non-daemon and follow the {@code sift-worker-*} naming convention.</p>
 */
package ca.gc.cra.sift.infrastructure.exec;
