/**
 * Infrastructure adapters implementing the application ports: XML documents, metrics and schema validation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.infrastructure;
