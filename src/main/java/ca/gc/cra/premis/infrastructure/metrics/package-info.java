/**
 * Metrics adapters that bridge the metrics port to OpenTelemetry or a no-op implementation.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code import.*} and {@code export.*} namespaces.</p>
 * <p><strong>Security:</strong> Record contents are never exported; only counts and latencies.</p>
 */
package ca.gc.cra.premis.infrastructure.metrics;
