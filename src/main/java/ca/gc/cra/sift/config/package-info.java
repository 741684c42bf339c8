/**
 * Configuration aggregates and composition root wiring for the SIFT CLI.
 * <p><strong>Role:</strong> Application bootstrap layer merging defaults, YAML, and CLI arguments and
 * selecting the loader, parser, writer, and metrics adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths through {@code ca.gc.cra.sift.validation} utilities.</p>
 */
package ca.gc.cra.sift.config;
