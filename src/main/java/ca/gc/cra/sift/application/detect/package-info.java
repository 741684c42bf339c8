/**
 * Heuristic detection engine run by every worker rank.
 * <p>{@link ca.gc.cra.sift.application.detect.PartitionScanner} sniffs the partition format, infers
 * columns for tabular content, and applies the tabular or free-form detector, falling back to free-form
 * detection locally when a partition cannot be read as a table.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sift.application.detect;
