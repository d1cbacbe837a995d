/**
 * XML adapters for the document ports: a secure DOM importer and a JAXP transformer exporter.
 * <p><strong>Role:</strong> Infrastructure adapters translating between PREMIS XML and document trees.</p>
 * <p><strong>Security:</strong> DTDs, external entities and XInclude are disabled when parsing.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.premis.infrastructure.xml;
