/**
 * Application layer: record registries, the record aggregate, and the ports it drives.
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.application;
