package ca.gc.cra.premis.infrastructure.validation;

import ca.gc.cra.premis.application.port.SchemaValidator;
import ca.gc.cra.premis.domain.premis.TreeNode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema validator that accepts every document.
 * <p>Placeholder until PREMIS XSD validation is wired in; thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpSchemaValidator implements SchemaValidator {
  private static final Logger log = LoggerFactory.getLogger(NoOpSchemaValidator.class);

  @Override
  public boolean isValid(TreeNode document) {
    Objects.requireNonNull(document, "document");
    log.debug("Schema validation skipped for <{}> with {} records", document.name(), document.children().size());
    return true;
  }
}
