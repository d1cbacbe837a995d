/**
 * Core domain model for preservation-metadata records.
 * <p><strong>Role:</strong> Domain layer describing objects, events, agents, and rights without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Security:</strong> Record values are carried verbatim; callers own any redaction before logging.</p>
 */
package ca.gc.cra.premis.domain;
