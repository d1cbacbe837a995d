/**
 * Layered configuration and composition root wiring for record-set import and export.
 * <p><strong>Role:</strong> Bootstrap layer selecting XML, metrics, and validation adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Precedence:</strong> explicit overrides &gt; YAML ({@code common} then mode section) &gt; defaults.</p>
 */
package ca.gc.cra.premis.config;
