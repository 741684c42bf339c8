/**
 * Command-line entry points for SIFT.
 * <p>{@link ca.gc.cra.sift.api.Main} dispatches subcommands; each CLI merges defaults, YAML, and
 * {@code key=value} arguments, then maps failures onto {@link ca.gc.cra.sift.api.ExitCode} values.</p>
 */
package ca.gc.cra.sift.api;
