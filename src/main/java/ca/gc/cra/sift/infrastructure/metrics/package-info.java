/**
 * Metrics adapters that bridge the SIFT {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; worker ranks update metrics concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code analyze.*} namespace.</p>
 */
package ca.gc.cra.sift.infrastructure.metrics;
