/**
 * <strong>Purpose:</strong> Ports defining the document import, export, validation, and metrics contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations document their guarantees.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.application.port;
