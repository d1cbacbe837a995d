package ca.gc.cra.premis.application.port;

import ca.gc.cra.premis.validation.Strings;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * <strong>What:</strong> Serialization settings passed explicitly with every export call.
 * <p><strong>Why:</strong> Namespace prefixes and encodings travel with the call instead of living in
 * process-wide parser state.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param prefix namespace prefix for PREMIS elements (e.g., {@code premis})
 * @param namespace primary schema namespace URI
 * @param xsiNamespace schema-instance namespace URI used for {@code xsi:type}
 * @param version value of the root {@code version} attribute
 * @param encoding output character encoding name
 * @param xmlDeclaration whether to emit the XML declaration header
 * @param indent indentation width; {@code 0} disables pretty printing
 * @since 0.1.0
 */
public record ExportSettings(
    String prefix,
    String namespace,
    String xsiNamespace,
    String version,
    String encoding,
    boolean xmlDeclaration,
    int indent) {

  /** PREMIS 3 namespace. */
  public static final String PREMIS_NAMESPACE = "http://www.loc.gov/premis/v3";
  /** XML Schema instance namespace. */
  public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";
  /** Schema version written on the root element. */
  public static final String PREMIS_VERSION = "3.0";

  public ExportSettings {
    Strings.requireText("prefix", prefix);
    Strings.requireText("namespace", namespace);
    Strings.requireText("xsiNamespace", xsiNamespace);
    Strings.requireText("version", version);
    Objects.requireNonNull(encoding, "encoding");
    if (!Charset.isSupported(encoding)) {
      throw new IllegalArgumentException("unsupported encoding: " + encoding);
    }
    if (indent < 0) {
      throw new IllegalArgumentException("indent must be >= 0");
    }
  }

  /**
   * Returns the PREMIS 3.0 defaults: {@code premis} prefix, UTF-8, declaration on, two-space indent.
   *
   * @return default settings
   */
  public static ExportSettings defaults() {
    return new ExportSettings("premis", PREMIS_NAMESPACE, XSI_NAMESPACE, PREMIS_VERSION, "UTF-8", true, 2);
  }

  /**
   * Returns a copy with a different encoding.
   *
   * @param newEncoding charset name
   * @return updated settings
   */
  public ExportSettings withEncoding(String newEncoding) {
    return new ExportSettings(prefix, namespace, xsiNamespace, version, newEncoding, xmlDeclaration, indent);
  }

  /**
   * Returns a copy with a different indentation width.
   *
   * @param newIndent indentation width; {@code 0} for compact output
   * @return updated settings
   */
  public ExportSettings withIndent(int newIndent) {
    return new ExportSettings(prefix, namespace, xsiNamespace, version, encoding, xmlDeclaration, newIndent);
  }
}
