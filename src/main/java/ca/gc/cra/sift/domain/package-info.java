/**
 * Pure domain model for SIFT scans.
 * <p>Types here carry no I/O, logging, or threading concerns; they describe records, partitions,
 * tabular views, and tallies exchanged between the root rank and worker ranks.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sift.domain;
