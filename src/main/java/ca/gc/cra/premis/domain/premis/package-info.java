/**
 * PREMIS record model: identifiers, the four record kinds, and their neutral tree projection.
 * <p><strong>Role:</strong> Domain layer with no XML, logging, or configuration dependencies.</p>
 * <p><strong>Concurrency:</strong> Every type is immutable; safe to share across threads.</p>
 */
package ca.gc.cra.premis.domain.premis;
