/**
 * <strong>Purpose:</strong> Input validation helpers shared by records, configuration, and document adapters.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link java.lang.IllegalArgumentException}s; no logging.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.validation;
