/**
 * Result artifact persistence.
 */
package ca.gc.cra.sift.infrastructure.persistence;
