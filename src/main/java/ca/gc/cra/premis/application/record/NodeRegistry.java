package ca.gc.cra.premis.application.record;

import ca.gc.cra.premis.domain.premis.DuplicateIdentifierException;
import ca.gc.cra.premis.domain.premis.Identifier;
import ca.gc.cra.premis.domain.premis.PremisEntry;
import ca.gc.cra.premis.domain.premis.RecordKind;
import ca.gc.cra.premis.logging.Logs;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single-kind container indexing records by every identifier they carry.
 * <p><strong>Why:</strong> Objects, agents, and rights are addressable under several identifiers; the registry
 * resolves any of them to the one stored record and rejects collisions.</p>
 * <p><strong>Role:</strong> Owned by {@link RecordAggregate}, one instance per {@link RecordKind}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve insertion order of stored records.</li>
 *   <li>Map each identifier to exactly one stored record.</li>
 *   <li>Apply insertions all-or-nothing: a colliding record leaves no trace.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine mutation to one thread and publish after population.</p>
 * <p><strong>Performance:</strong> O(k) insertion for a record with k identifiers; O(1) lookup.</p>
 *
 * @param <T> record type stored in this registry
 * @since 0.1.0
 */
public final class NodeRegistry<T extends PremisEntry> {
  private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

  private final RecordKind kind;
  private final List<T> records = new ArrayList<>();
  private final List<T> view = Collections.unmodifiableList(records);
  private final Map<Identifier, Integer> index = new HashMap<>();

  /**
   * Creates an empty registry for one kind.
   *
   * @param kind record kind accepted by this registry
   */
  public NodeRegistry(RecordKind kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the kind of record this registry holds.
   *
   * @return record kind
   */
  public RecordKind kind() {
    return kind;
  }

  /**
   * Stores a record and registers all of its identifiers.
   *
   * @param record record to store; must match {@link #kind()}
   * @throws NullPointerException if {@code record} is {@code null}
   * @throws IllegalArgumentException if the record is of another kind or carries no identifier
   * @throws DuplicateIdentifierException if any identifier is already registered, or repeated within the record;
   *     the registry is left unchanged
   */
  public void insert(T record) {
    Objects.requireNonNull(record, "record");
    if (record.kind() != kind) {
      throw new IllegalArgumentException(
          "cannot store " + record.kind().elementName() + " in " + kind.elementName() + " registry");
    }
    List<Identifier> ids = record.identifiers();
    if (ids.isEmpty()) {
      throw new IllegalArgumentException(kind.elementName() + " record carries no identifier");
    }
    Set<Identifier> seen = new HashSet<>();
    for (Identifier id : ids) {
      if (index.containsKey(id) || !seen.add(id)) {
        log.debug("Rejected {} with duplicate identifier {}", kind.elementName(), Logs.truncate(id));
        throw new DuplicateIdentifierException(kind, id);
      }
    }
    int position = records.size();
    records.add(record);
    for (Identifier id : ids) {
      index.put(id, position);
    }
  }

  /**
   * Looks up the record registered under an identifier.
   *
   * @param identifier identifier to resolve
   * @return the stored record, or empty when the identifier is unknown
   */
  public Optional<T> find(Identifier identifier) {
    Integer position = index.get(Objects.requireNonNull(identifier, "identifier"));
    return position == null ? Optional.empty() : Optional.of(records.get(position));
  }

  /**
   * Resolves several identifiers at once.
   *
   * <p>A single unknown identifier makes the whole lookup empty; partial results are never returned.</p>
   *
   * @param identifiers identifiers to resolve, in the order results are wanted
   * @return records in the same order (repeats allowed), or empty if any identifier is unknown
   */
  public Optional<List<T>> findAll(List<Identifier> identifiers) {
    Objects.requireNonNull(identifiers, "identifiers");
    List<T> found = new ArrayList<>(identifiers.size());
    for (Identifier id : identifiers) {
      Optional<T> match = find(id);
      if (match.isEmpty()) {
        return Optional.empty();
      }
      found.add(match.get());
    }
    return Optional.of(Collections.unmodifiableList(found));
  }

  /**
   * Returns whether an identifier is registered.
   *
   * @param identifier identifier to test
   * @return {@code true} when registered
   */
  public boolean contains(Identifier identifier) {
    return index.containsKey(identifier);
  }

  /**
   * Returns all stored records in insertion order.
   *
   * @return read-only live view
   */
  public List<T> all() {
    return view;
  }

  /**
   * Returns the number of stored records.
   *
   * @return record count (not identifier count)
   */
  public int size() {
    return records.size();
  }

  /**
   * Returns the number of registered identifiers.
   *
   * @return identifier count
   */
  public int identifierCount() {
    return index.size();
  }
}
