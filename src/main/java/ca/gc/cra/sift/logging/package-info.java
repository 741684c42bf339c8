/**
 * Logging configuration and hygiene helpers; SLF4J API with a Logback backend.
 */
package ca.gc.cra.sift.logging;
