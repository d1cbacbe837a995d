package ca.gc.cra.premis.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a {@link DocumentImporter} for a document location.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DocumentImporterFactory {
  /**
   * Reads and parses the document at {@code location}.
   *
   * @param location document path
   * @return importer holding the parsed records
   * @throws IOException if the document cannot be read
   * @throws DocumentFormatException if the document is malformed or holds invalid records
   */
  DocumentImporter open(Path location) throws IOException;
}
