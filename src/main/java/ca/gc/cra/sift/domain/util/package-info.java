/**
 * Stateless text helpers shared by the domain and detection layers.
 */
package ca.gc.cra.sift.domain.util;
