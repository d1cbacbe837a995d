package ca.gc.cra.premis.application.record;

import ca.gc.cra.premis.application.port.DocumentExporter;
import ca.gc.cra.premis.application.port.DocumentImporter;
import ca.gc.cra.premis.application.port.DocumentImporterFactory;
import ca.gc.cra.premis.application.port.ExportSettings;
import ca.gc.cra.premis.application.port.SchemaValidator;
import ca.gc.cra.premis.domain.premis.Identifier;
import ca.gc.cra.premis.domain.premis.PremisAgent;
import ca.gc.cra.premis.domain.premis.PremisEntry;
import ca.gc.cra.premis.domain.premis.PremisEvent;
import ca.gc.cra.premis.domain.premis.PremisObject;
import ca.gc.cra.premis.domain.premis.PremisRights;
import ca.gc.cra.premis.domain.premis.RecordKind;
import ca.gc.cra.premis.domain.premis.TreeNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-memory PREMIS record set holding one {@link NodeRegistry} per record kind.
 * <p><strong>Why:</strong> Gives callers a single unit to populate from records or a document, look records up by
 * identifier, and project back to a document.</p>
 * <p><strong>Role:</strong> Application-layer aggregate driving the {@link DocumentImporter} and
 * {@link DocumentExporter} ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Route every insertion to the registry of the matching kind; records are only ever added.</li>
 *   <li>Import kinds in the fixed order events, agents, rights, objects.</li>
 *   <li>Export and iterate in the fixed order objects, events, rights, agents.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Populate on one thread; concurrent reads are safe only after
 * the fully populated instance has been safely published.</p>
 * <p><strong>Equality:</strong> Two aggregates are equal when each record of one is value-equal to some record of
 * the other and vice versa. Hash-based, O(n); duplicates and the provenance path are ignored.</p>
 *
 * @since 0.1.0
 */
public final class RecordAggregate implements Iterable<PremisEntry> {
  private static final Logger log = LoggerFactory.getLogger(RecordAggregate.class);

  /** Local name of the document root element. */
  public static final String ROOT_ELEMENT = "premis";

  private final NodeRegistry<PremisObject> objects = new NodeRegistry<>(RecordKind.OBJECT);
  private final NodeRegistry<PremisEvent> events = new NodeRegistry<>(RecordKind.EVENT);
  private final NodeRegistry<PremisAgent> agents = new NodeRegistry<>(RecordKind.AGENT);
  private final NodeRegistry<PremisRights> rights = new NodeRegistry<>(RecordKind.RIGHTS);
  private Path filepath;

  private RecordAggregate() {}

  /**
   * Starts building an aggregate from record sequences or a document path.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an aggregate from record sequences, inserting objects, events, agents, then rights.
   *
   * @param objects object records; may be empty
   * @param events event records; may be empty
   * @param agents agent records; may be empty
   * @param rights rights records; may be empty
   * @return populated aggregate
   * @throws RecordSetConfigurationException if every sequence is empty
   * @throws ca.gc.cra.premis.domain.premis.DuplicateIdentifierException if two records of a kind collide
   */
  public static RecordAggregate of(
      List<PremisObject> objects,
      List<PremisEvent> events,
      List<PremisAgent> agents,
      List<PremisRights> rights) {
    try {
      return builder().objects(objects).events(events).agents(agents).rights(rights).build();
    } catch (IOException ex) {
      throw new IllegalStateException("record-only construction performed IO", ex);
    }
  }

  /** Adds an object record. */
  public void addObject(PremisObject object) {
    objects.insert(object);
  }

  /** Adds an event record. */
  public void addEvent(PremisEvent event) {
    events.insert(event);
  }

  /** Adds an agent record. */
  public void addAgent(PremisAgent agent) {
    agents.insert(agent);
  }

  /** Adds a rights record. */
  public void addRights(PremisRights entry) {
    rights.insert(entry);
  }

  /**
   * Looks up the object registered under any of its identifiers.
   *
   * @param identifier object identifier
   * @return matching object, or empty when unknown
   */
  public Optional<PremisObject> getObject(Identifier identifier) {
    return objects.find(identifier);
  }

  /**
   * Looks up the event registered under its identifier.
   *
   * @param identifier event identifier
   * @return matching event, or empty when unknown
   */
  public Optional<PremisEvent> getEvent(Identifier identifier) {
    return events.find(identifier);
  }

  /**
   * Looks up the agent registered under any of its identifiers.
   *
   * @param identifier agent identifier
   * @return matching agent, or empty when unknown
   */
  public Optional<PremisAgent> getAgent(Identifier identifier) {
    return agents.find(identifier);
  }

  /**
   * Looks up the rights record containing the statement with the given identifier.
   *
   * @param identifier rights statement identifier
   * @return containing rights record, or empty when unknown
   */
  public Optional<PremisRights> getRights(Identifier identifier) {
    return rights.find(identifier);
  }

  /**
   * Returns the object records in insertion order.
   *
   * @return read-only view of the object records
   */
  public List<PremisObject> listObjects() {
    return objects.all();
  }

  /**
   * Returns the event records in insertion order.
   *
   * @return read-only view of the event records
   */
  public List<PremisEvent> listEvents() {
    return events.all();
  }

  /**
   * Returns the agent records in insertion order.
   *
   * @return read-only view of the agent records
   */
  public List<PremisAgent> listAgents() {
    return agents.all();
  }

  /**
   * Returns the rights records in insertion order.
   *
   * @return read-only view of the rights records
   */
  public List<PremisRights> listRights() {
    return rights.all();
  }

  /**
   * Returns the registry for a kind, for identifier-list lookups.
   *
   * @param kind record kind
   * @return read access to the matching registry
   */
  public NodeRegistry<? extends PremisEntry> registry(RecordKind kind) {
    return switch (Objects.requireNonNull(kind, "kind")) {
      case OBJECT -> objects;
      case EVENT -> events;
      case AGENT -> agents;
      case RIGHTS -> rights;
    };
  }

  /**
   * Returns the total number of stored records across kinds.
   *
   * @return record count
   */
  public int size() {
    return objects.size() + events.size() + agents.size() + rights.size();
  }

  /**
   * Returns the location of the document this aggregate was loaded from.
   *
   * @return provenance path, empty when built from records
   */
  public Optional<Path> getFilepath() {
    return Optional.ofNullable(filepath);
  }

  /**
   * Replaces the provenance path used by {@link #populateFromFile(DocumentImporterFactory)}.
   *
   * @param filepath document location, or {@code null} to clear it
   */
  public void setFilepath(Path filepath) {
    this.filepath = filepath;
  }

  /**
   * Re-populates from the stored provenance path.
   *
   * @param factory importer factory for the document format
   * @throws IllegalStateException if no provenance path is set
   * @throws IOException if the document cannot be read or parsed
   */
  public void populateFromFile(DocumentImporterFactory factory) throws IOException {
    if (filepath == null) {
      throw new IllegalStateException("No supplied filepath");
    }
    populateFromFile(factory, filepath);
  }

  /**
   * Populates from the document at {@code location}; the stored provenance path is left untouched.
   *
   * @param factory importer factory for the document format
   * @param location document to import
   * @throws IOException if the document cannot be read or parsed
   * @throws ca.gc.cra.premis.domain.premis.DuplicateIdentifierException on the first collision; records added
   *     before it stay in place
   */
  public void populateFromFile(DocumentImporterFactory factory, Path location) throws IOException {
    Objects.requireNonNull(factory, "factory");
    Objects.requireNonNull(location, "location");
    populateFrom(factory.open(location));
    log.debug("Populated record set from {} ({} records)", location, size());
  }

  /**
   * Adds every record supplied by the importer in the fixed order events, agents, rights, objects.
   *
   * @param importer parsed document
   * @throws ca.gc.cra.premis.domain.premis.DuplicateIdentifierException on the first collision; not rolled back
   */
  public void populateFrom(DocumentImporter importer) {
    Objects.requireNonNull(importer, "importer");
    for (PremisEvent event : importer.findEvents()) {
      addEvent(event);
    }
    for (PremisAgent agent : importer.findAgents()) {
      addAgent(agent);
    }
    for (PremisRights entry : importer.findRights()) {
      addRights(entry);
    }
    for (PremisObject object : importer.findObjects()) {
      addObject(object);
    }
  }

  /**
   * Assembles the document root: fixed namespace declarations, the schema version, then every record.
   *
   * @param settings namespace and version settings
   * @return document tree
   */
  public TreeNode toTree(ExportSettings settings) {
    Objects.requireNonNull(settings, "settings");
    List<TreeNode> children = new ArrayList<>(size());
    for (PremisEntry entry : this) {
      children.add(entry.toTree());
    }
    return TreeNode.element(ROOT_ELEMENT, children)
        .withAttribute("xmlns:" + settings.prefix(), settings.namespace())
        .withAttribute("xmlns:xsi", settings.xsiNamespace())
        .withAttribute("version", settings.version());
  }

  /**
   * Serializes the whole aggregate to a string.
   *
   * @param exporter document writer
   * @param settings serialization settings
   * @return serialized document
   * @throws IOException if serialization fails
   */
  public String toXml(DocumentExporter exporter, ExportSettings settings) throws IOException {
    return exporter.render(toTree(settings), settings);
  }

  /**
   * Writes the whole aggregate to a file in one pass.
   *
   * @param target output file
   * @param exporter document writer
   * @param settings serialization settings
   * @throws IOException if the file cannot be written
   */
  public void write(Path target, DocumentExporter exporter, ExportSettings settings) throws IOException {
    exporter.write(toTree(settings), target, settings);
  }

  /**
   * Validates the assembled document with the given validator.
   *
   * @param validator schema validator
   * @return validator verdict
   */
  public boolean validate(SchemaValidator validator) {
    return validator.isValid(toTree(ExportSettings.defaults()));
  }

  /**
   * Streams all records: objects, events, rights, then agents, each in insertion order.
   *
   * @return record stream
   */
  public Stream<PremisEntry> stream() {
    return Stream.of(objects.all(), events.all(), rights.all(), agents.all())
        .flatMap(List::stream);
  }

  @Override
  public Iterator<PremisEntry> iterator() {
    return stream().iterator();
  }

  private Set<PremisEntry> valueSet() {
    Set<PremisEntry> values = new HashSet<>();
    for (PremisEntry entry : this) {
      values.add(entry);
    }
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecordAggregate that)) {
      return false;
    }
    return valueSet().equals(that.valueSet());
  }

  @Override
  public int hashCode() {
    return valueSet().hashCode();
  }

  @Override
  public String toString() {
    return "RecordAggregate{"
        + "objects=" + objects.size()
        + ", events=" + events.size()
        + ", agents=" + agents.size()
        + ", rights=" + rights.size()
        + ", filepath=" + filepath
        + '}';
  }

  /**
   * Collects either record sequences or a document path, never both.
   *
   * <p>A sequence counts as supplied when it is non-empty.</p>
   */
  public static final class Builder {
    private final List<PremisObject> objects = new ArrayList<>();
    private final List<PremisEvent> events = new ArrayList<>();
    private final List<PremisAgent> agents = new ArrayList<>();
    private final List<PremisRights> rights = new ArrayList<>();
    private Path fromPath;
    private DocumentImporterFactory importer;

    private Builder() {}

    /**
     * Appends object records; {@code null} counts as empty.
     *
     * @param values object records
     * @return this builder
     */
    public Builder objects(List<PremisObject> values) {
      objects.addAll(values == null ? List.of() : values);
      return this;
    }

    /**
     * Appends event records; {@code null} counts as empty.
     *
     * @param values event records
     * @return this builder
     */
    public Builder events(List<PremisEvent> values) {
      events.addAll(values == null ? List.of() : values);
      return this;
    }

    /**
     * Appends agent records; {@code null} counts as empty.
     *
     * @param values agent records
     * @return this builder
     */
    public Builder agents(List<PremisAgent> values) {
      agents.addAll(values == null ? List.of() : values);
      return this;
    }

    /**
     * Appends rights records; {@code null} counts as empty.
     *
     * @param values rights records
     * @return this builder
     */
    public Builder rights(List<PremisRights> values) {
      rights.addAll(values == null ? List.of() : values);
      return this;
    }

    /**
     * Loads records from a document instead of explicit sequences.
     *
     * @param path document location
     * @return this builder
     */
    public Builder fromPath(Path path) {
      this.fromPath = path;
      return this;
    }

    /**
     * Sets the importer used with {@link #fromPath(Path)}.
     *
     * @param factory importer factory
     * @return this builder
     */
    public Builder importer(DocumentImporterFactory factory) {
      this.importer = factory;
      return this;
    }

    /**
     * Validates the configuration and populates a new aggregate.
     *
     * <p>Both failure classes are {@link IllegalArgumentException}s. Catch
     * {@link ca.gc.cra.premis.domain.premis.DuplicateIdentifierException} and {@link RecordSetConfigurationException}
     * separately to tell a collision from a builder misuse.</p>
     *
     * @return populated aggregate
     * @throws RecordSetConfigurationException if neither or both of record sequences and a path were supplied, or a
     *     path was supplied without an importer
     * @throws ca.gc.cra.premis.domain.premis.DuplicateIdentifierException if two records of a kind collide
     * @throws IOException if the document cannot be read or parsed
     */
    public RecordAggregate build() throws IOException {
      boolean hasRecords = !objects.isEmpty() || !events.isEmpty() || !agents.isEmpty() || !rights.isEmpty();
      boolean hasPath = fromPath != null;
      if (hasRecords == hasPath) {
        throw new RecordSetConfigurationException(
            "Must supply either a document path or at least one non-empty list of records, not both");
      }
      if (hasPath && importer == null) {
        throw new RecordSetConfigurationException("A document importer is required when loading from a path");
      }
      RecordAggregate aggregate = new RecordAggregate();
      if (hasPath) {
        aggregate.setFilepath(fromPath);
        aggregate.populateFromFile(importer);
        return aggregate;
      }
      objects.forEach(aggregate::addObject);
      events.forEach(aggregate::addEvent);
      agents.forEach(aggregate::addAgent);
      rights.forEach(aggregate::addRights);
      return aggregate;
    }
  }
}
