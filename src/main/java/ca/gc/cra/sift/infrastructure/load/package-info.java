/**
 * File-backed record loading for the supported input formats.
 */
package ca.gc.cra.sift.infrastructure.load;
