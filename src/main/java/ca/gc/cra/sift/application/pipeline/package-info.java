/**
 * Analyze pipeline: round-robin partitioning, scatter/gather over worker ranks, and aggregation.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.sift.application.pipeline.ScatterGather} owns the only
 * threads; every other type here runs on the root rank.</p>
 */
package ca.gc.cra.sift.application.pipeline;
