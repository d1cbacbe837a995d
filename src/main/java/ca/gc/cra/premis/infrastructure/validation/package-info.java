/**
 * Schema validation adapters.
 */
package ca.gc.cra.premis.infrastructure.validation;
