package ca.gc.cra.premis.domain.premis;

import java.util.Optional;

/**
 * The four top-level PREMIS entity kinds, each bound to its document element name.
 *
 * @since 0.1.0
 */
public enum RecordKind {
  /** Digital object (file, representation, bitstream, or intellectual entity). */
  OBJECT("object"),
  /** Preservation action performed on objects. */
  EVENT("event"),
  /** Person, organization, or software involved in events. */
  AGENT("agent"),
  /** Rights statements governing objects. */
  RIGHTS("rights");

  private final String elementName;

  RecordKind(String elementName) {
    this.elementName = elementName;
  }

  /**
   * Returns the local element name used in documents.
   *
   * @return element name such as {@code event}
   */
  public String elementName() {
    return elementName;
  }

  /**
   * Resolves a kind from a document element name.
   *
   * @param localName local element name
   * @return matching kind, empty for unrelated elements
   */
  public static Optional<RecordKind> fromElementName(String localName) {
    for (RecordKind kind : values()) {
      if (kind.elementName.equals(localName)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
