/**
 * <strong>Purpose:</strong> Identifier-indexed record registries and the aggregate that owns them.
 * <p><strong>Pipeline role:</strong> Application layer between the PREMIS domain model and the document ports.</p>
 * <p><strong>Concurrency:</strong> Single-threaded mutation; publish a populated aggregate before sharing it.</p>
 * <p><strong>Performance:</strong> O(1) amortized insertion and lookup; O(n) enumeration and export.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.application.record;
