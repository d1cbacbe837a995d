package ca.gc.cra.premis.domain.premis;

import java.util.List;

/**
 * <strong>What:</strong> Closed family of top-level PREMIS records.
 * <p><strong>Why:</strong> Gives registries a single identifier-extraction operation per kind instead of
 * runtime type checks.</p>
 * <p><strong>Role:</strong> Domain contract implemented by {@link PremisObject}, {@link PremisEvent},
 * {@link PremisAgent}, and {@link PremisRights}.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface PremisEntry permits PremisObject, PremisEvent, PremisAgent, PremisRights {

  /**
   * Returns the record kind.
   *
   * @return kind of this record
   */
  RecordKind kind();

  /**
   * Returns the identifiers under which this record is addressable, in document order.
   *
   * <p>Objects and agents return their identifier list, events a single identifier, and rights one
   * identifier per contained rights statement. The list is never empty for a well-formed record.</p>
   *
   * @return unmodifiable identifier list
   */
  List<Identifier> identifiers();

  /**
   * Projects the record to its document element.
   *
   * @return element tree named after {@link RecordKind#elementName()}
   */
  TreeNode toTree();
}
