package ca.gc.cra.premis.application.record;

/**
 * Raised when a {@link RecordAggregate.Builder} is given an unusable combination of inputs.
 *
 * <p>Distinct from {@link ca.gc.cra.premis.domain.premis.DuplicateIdentifierException}, which reports a collision
 * while records are being inserted.</p>
 *
 * @since 0.1.0
 */
public final class RecordSetConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description of the misuse
   */
  public RecordSetConfigurationException(String message) {
    super(message);
  }
}
