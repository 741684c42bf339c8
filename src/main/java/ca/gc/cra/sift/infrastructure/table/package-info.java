/**
 * Delimited-text parsing adapters.
 */
package ca.gc.cra.sift.infrastructure.table;
