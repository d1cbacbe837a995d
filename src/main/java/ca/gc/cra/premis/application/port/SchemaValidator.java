package ca.gc.cra.premis.application.port;

import ca.gc.cra.premis.domain.premis.TreeNode;

/**
 * Validates an assembled document against the PREMIS schema.
 *
 * @since 0.1.0
 */
public interface SchemaValidator {
  /**
   * Checks the document.
   *
   * @param document document root produced by the record aggregate
   * @return {@code true} when the document is considered valid
   */
  boolean isValid(TreeNode document);
}
