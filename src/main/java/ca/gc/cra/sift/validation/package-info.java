/**
 * Input validation helpers shared by the configuration and CLI layers.
 */
package ca.gc.cra.sift.validation;
