package ca.gc.cra.premis.domain.premis;

import java.util.Objects;

/**
 * <strong>What:</strong> Raised when a record is inserted under an identifier already registered for its kind.
 * <p><strong>Role:</strong> Domain failure propagated unchanged from registries through the aggregate and imports.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * <p>The failed insertion leaves the registry exactly as it was before the call.</p>
 *
 * @since 0.1.0
 */
public final class DuplicateIdentifierException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final RecordKind kind;
  private final Identifier identifier;

  /**
   * Creates the exception for a colliding identifier.
   *
   * @param kind registry kind in which the collision happened
   * @param identifier colliding identifier
   */
  public DuplicateIdentifierException(RecordKind kind, Identifier identifier) {
    super("duplicate " + Objects.requireNonNull(kind, "kind").elementName()
        + " identifier " + Objects.requireNonNull(identifier, "identifier"));
    this.kind = kind;
    this.identifier = identifier;
  }

  /**
   * Returns the registry kind in which the collision happened.
   *
   * @return record kind
   */
  public RecordKind kind() {
    return kind;
  }

  /**
   * Returns the identifier that collided.
   *
   * @return colliding identifier
   */
  public Identifier identifier() {
    return identifier;
  }
}
