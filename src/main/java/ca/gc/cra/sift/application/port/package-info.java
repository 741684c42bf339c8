/**
 * Ports between the SIFT scan pipeline and its adapters.
 * <p>Loaders, table parsers, result writers, and metrics sinks are expressed as interfaces so the
 * detection engine stays free of file formats and vendor SDKs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sift.application.port;
