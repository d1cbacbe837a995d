package ca.gc.cra.premis.application.port;

import ca.gc.cra.premis.domain.premis.TreeNode;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Output port serializing an assembled document tree.
 * <p><strong>Why:</strong> Keeps the record aggregate unaware of the markup writer.</p>
 * <p><strong>Role:</strong> Export-side port implemented by {@code XmlDocumentExporter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the whole tree in one pass; no partial or streaming writes.</li>
 *   <li>Apply the namespace, encoding, and declaration settings supplied with each call.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations keep no per-call state and may be shared.</p>
 * <p><strong>Observability:</strong> Implementations should emit {@code export.*} metrics.</p>
 *
 * @since 0.1.0
 * @see DocumentImporter
 */
public interface DocumentExporter {
  /**
   * Renders the document tree to a string.
   *
   * @param document root produced by the record aggregate
   * @param settings serialization settings for this call
   * @return serialized document including the declaration when enabled
   * @throws IOException if serialization fails
   */
  String render(TreeNode document, ExportSettings settings) throws IOException;

  /**
   * Writes the document tree to a file, replacing any existing content.
   *
   * @param document root produced by the record aggregate
   * @param target output file
   * @param settings serialization settings for this call
   * @throws IOException if the file cannot be written
   */
  void write(TreeNode document, Path target, ExportSettings settings) throws IOException;
}
