package ca.gc.cra.premis.application.port;

import java.io.IOException;

/**
 * Signals a document that could be read but not understood: malformed markup, an unexpected root element, or a
 * record missing required fields.
 *
 * @since 0.1.0
 */
public class DocumentFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception with a message.
   *
   * @param message description including the document location
   */
  public DocumentFormatException(String message) {
    super(message);
  }

  /**
   * Creates the exception with a message and cause.
   *
   * @param message description including the document location
   * @param cause underlying parser or record failure
   */
  public DocumentFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
