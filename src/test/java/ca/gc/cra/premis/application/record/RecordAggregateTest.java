package ca.gc.cra.premis.application.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.premis.application.port.DocumentImporter;
import ca.gc.cra.premis.application.port.ExportSettings;
import ca.gc.cra.premis.domain.premis.DuplicateIdentifierException;
import ca.gc.cra.premis.domain.premis.Identifier;
import ca.gc.cra.premis.domain.premis.PremisAgent;
import ca.gc.cra.premis.domain.premis.PremisEntry;
import ca.gc.cra.premis.domain.premis.PremisEvent;
import ca.gc.cra.premis.domain.premis.PremisObject;
import ca.gc.cra.premis.domain.premis.PremisRights;
import ca.gc.cra.premis.domain.premis.RecordKind;
import ca.gc.cra.premis.domain.premis.RightsStatement;
import ca.gc.cra.premis.domain.premis.TreeNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class RecordAggregateTest {

  private static Identifier local(String value) {
    return Identifier.of("local", value);
  }

  private static PremisEvent event(String id) {
    return PremisEvent.of(local(id), "ingestion", "2024-01-01T00:00:00Z");
  }

  @Test
  void duplicateEventIsRejectedAndDistinctEventIsAdded() {
    RecordAggregate aggregate = RecordAggregate.of(List.of(), List.of(event("E1")), List.of(), List.of());

    assertThrows(DuplicateIdentifierException.class, () -> aggregate.addEvent(event("E1")));
    assertEquals(1, aggregate.listEvents().size());

    aggregate.addEvent(event("E2"));
    assertEquals(2, aggregate.listEvents().size());
  }

  @Test
  void rightsResolveByEitherStatementIdentifier() {
    PremisRights rights = PremisRights.of(
        RightsStatement.of(local("R1"), "license"),
        RightsStatement.of(local("R2"), "license"));
    RecordAggregate aggregate = RecordAggregate.of(List.of(), List.of(), List.of(), List.of(rights));

    PremisRights viaFirst = aggregate.getRights(local("R1")).orElseThrow();
    PremisRights viaSecond = aggregate.getRights(local("R2")).orElseThrow();

    assertSame(viaFirst, viaSecond);
    assertEquals(rights, viaFirst);
  }

  @Test
  void objectResolvesByEveryIdentifier() {
    PremisObject object = new PremisObject(
        List.of(local("O1"), Identifier.of("uuid", "9f2c")), PremisObject.FILE, null, List.of());
    RecordAggregate aggregate = RecordAggregate.of(List.of(object), List.of(), List.of(), List.of());

    assertEquals(object, aggregate.getObject(Identifier.of("uuid", "9f2c")).orElseThrow());
    assertEquals(object, aggregate.getObject(local("O1")).orElseThrow());
    assertTrue(aggregate.getObject(local("missing")).isEmpty());
    List<Identifier> both = List.of(local("O1"), Identifier.of("uuid", "9f2c"));
    assertEquals(List.of(object, object), aggregate.registry(RecordKind.OBJECT).findAll(both).orElseThrow());
    assertTrue(aggregate.registry(RecordKind.OBJECT).findAll(List.of(local("O1"), local("missing"))).isEmpty());
  }

  @Test
  void sameIdentifierMayBeUsedAcrossKinds() {
    RecordAggregate aggregate = RecordAggregate.of(
        List.of(PremisObject.file(local("X"))),
        List.of(event("X")),
        List.of(PremisAgent.of(local("X"), "Archivist", "person")),
        List.of());

    assertEquals(3, aggregate.size());
    assertTrue(aggregate.getAgent(local("X")).isPresent());
  }

  @Test
  void listEventsFollowsCallOrder() {
    RecordAggregate aggregate = RecordAggregate.of(List.of(PremisObject.file(local("O"))), List.of(), List.of(),
        List.of());
    PremisEvent first = event("E3");
    PremisEvent second = event("E1");
    PremisEvent third = event("E2");

    aggregate.addEvent(first);
    aggregate.addEvent(second);
    aggregate.addEvent(third);

    assertEquals(List.of(first, second, third), aggregate.listEvents());
  }

  @Test
  void iterationVisitsObjectsEventsRightsThenAgents() {
    PremisObject object = PremisObject.file(local("O1"));
    PremisEvent event = event("E1");
    PremisAgent agent = PremisAgent.of(local("A1"), "Archivist", "person");
    PremisRights rights = PremisRights.of(RightsStatement.of(local("R1"), "license"));
    RecordAggregate aggregate = RecordAggregate.of(List.of(object), List.of(event), List.of(agent), List.of(rights));

    List<RecordKind> kinds = new ArrayList<>();
    for (PremisEntry entry : aggregate) {
      kinds.add(entry.kind());
    }

    assertEquals(List.of(RecordKind.OBJECT, RecordKind.EVENT, RecordKind.RIGHTS, RecordKind.AGENT), kinds);
  }

  @Test
  void builderRejectsNeitherRecordsNorPath() {
    assertThrows(RecordSetConfigurationException.class, () -> RecordAggregate.builder().build());
    assertThrows(RecordSetConfigurationException.class,
        () -> RecordAggregate.builder().events(List.of()).objects(List.of()).build());
  }

  @Test
  void builderRejectsRecordsTogetherWithPath() {
    RecordAggregate.Builder builder = RecordAggregate.builder()
        .events(List.of(event("E1")))
        .fromPath(Path.of("premis.xml"))
        .importer(location -> new FixedImporter(List.of(), List.of(), List.of(), List.of(), new ArrayList<>()));

    assertThrows(RecordSetConfigurationException.class, builder::build);
  }

  @Test
  void builderRequiresImporterForPath() {
    assertThrows(RecordSetConfigurationException.class,
        () -> RecordAggregate.builder().fromPath(Path.of("premis.xml")).build());
  }

  @Test
  void builderSeparatesCollisionsFromMisuse() {
    RecordAggregate.Builder builder = RecordAggregate.builder().events(List.of(event("E1"), event("E1")));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, builder::build);

    assertTrue(ex instanceof DuplicateIdentifierException);
    assertFalse(ex instanceof RecordSetConfigurationException);
  }

  @Test
  void builderLoadsFromPathAndKeepsProvenance() throws IOException {
    AtomicReference<Path> opened = new AtomicReference<>();
    Path source = Path.of("records", "premis.xml");
    RecordAggregate aggregate = RecordAggregate.builder()
        .fromPath(source)
        .importer(location -> {
          opened.set(location);
          return new FixedImporter(List.of(event("E1")), List.of(), List.of(), List.of(), new ArrayList<>());
        })
        .build();

    assertEquals(source, opened.get());
    assertEquals(source, aggregate.getFilepath().orElseThrow());
    assertEquals(1, aggregate.listEvents().size());
  }

  @Test
  void importCallsEnumerationsInFixedOrder() {
    List<String> calls = new ArrayList<>();
    FixedImporter importer = new FixedImporter(
        List.of(event("E1")),
        List.of(PremisAgent.of(local("A1"), "Archivist", "person")),
        List.of(PremisRights.of(RightsStatement.of(local("R1"), "license"))),
        List.of(PremisObject.file(local("O1"))),
        calls);
    RecordAggregate aggregate = RecordAggregate.of(List.of(PremisObject.file(local("seed"))), List.of(), List.of(),
        List.of());

    aggregate.populateFrom(importer);

    assertEquals(List.of("events", "agents", "rights", "objects"), calls);
    assertEquals(5, aggregate.size());
  }

  @Test
  void duplicateDuringImportLeavesEarlierKindsPopulated() {
    FixedImporter importer = new FixedImporter(
        List.of(event("E1"), event("E2")),
        List.of(PremisAgent.of(local("A1"), "Archivist", "person"),
            PremisAgent.of(local("A1"), "Other", "person")),
        List.of(PremisRights.of(RightsStatement.of(local("R1"), "license"))),
        List.of(PremisObject.file(local("O1"))),
        new ArrayList<>());
    RecordAggregate aggregate = RecordAggregate.of(List.of(PremisObject.file(local("seed"))), List.of(), List.of(),
        List.of());

    DuplicateIdentifierException ex =
        assertThrows(DuplicateIdentifierException.class, () -> aggregate.populateFrom(importer));

    assertEquals(RecordKind.AGENT, ex.kind());
    assertEquals(2, aggregate.listEvents().size());
    assertEquals(1, aggregate.listAgents().size());
    assertTrue(aggregate.listRights().isEmpty());
    assertEquals(1, aggregate.listObjects().size());
  }

  @Test
  void populateFromFileWithoutPathFails() {
    RecordAggregate aggregate = RecordAggregate.of(List.of(), List.of(event("E1")), List.of(), List.of());

    assertThrows(IllegalStateException.class, () -> aggregate.populateFromFile(
        location -> new FixedImporter(List.of(), List.of(), List.of(), List.of(), new ArrayList<>())));
  }

  @Test
  void equalityIgnoresInsertionOrderAndProvenance() {
    PremisEvent e1 = event("E1");
    PremisEvent e2 = event("E2");
    PremisObject o1 = PremisObject.file(local("O1"));
    RecordAggregate left = RecordAggregate.of(List.of(o1), List.of(e1, e2), List.of(), List.of());
    RecordAggregate right = RecordAggregate.of(List.of(o1), List.of(e2, e1), List.of(), List.of());
    right.setFilepath(Path.of("elsewhere.xml"));

    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());

    right.addEvent(event("E3"));
    assertNotEquals(left, right);
  }

  @Test
  void toTreeDeclaresNamespacesAndVersion() {
    RecordAggregate aggregate = RecordAggregate.of(
        List.of(PremisObject.file(local("O1"))),
        List.of(event("E1")),
        List.of(PremisAgent.of(local("A1"), "Archivist", "person")),
        List.of(PremisRights.of(RightsStatement.of(local("R1"), "license"))));

    TreeNode root = aggregate.toTree(ExportSettings.defaults());

    assertEquals("premis", root.name());
    assertEquals(ExportSettings.PREMIS_NAMESPACE, root.attribute("xmlns:premis").orElseThrow());
    assertEquals(ExportSettings.XSI_NAMESPACE, root.attribute("xmlns:xsi").orElseThrow());
    assertEquals("3.0", root.attribute("version").orElseThrow());
    assertEquals(List.of("object", "event", "rights", "agent"),
        root.children().stream().map(TreeNode::name).toList());
  }

  @Test
  void validateDelegatesToValidator() {
    RecordAggregate aggregate = RecordAggregate.of(List.of(), List.of(event("E1")), List.of(), List.of());
    List<TreeNode> seen = new ArrayList<>();

    boolean valid = aggregate.validate(document -> {
      seen.add(document);
      return false;
    });

    assertEquals(false, valid);
    assertEquals(1, seen.get(0).children().size());
  }

  private static final class FixedImporter implements DocumentImporter {
    private final List<PremisEvent> events;
    private final List<PremisAgent> agents;
    private final List<PremisRights> rights;
    private final List<PremisObject> objects;
    private final List<String> calls;

    private FixedImporter(
        List<PremisEvent> events,
        List<PremisAgent> agents,
        List<PremisRights> rights,
        List<PremisObject> objects,
        List<String> calls) {
      this.events = events;
      this.agents = agents;
      this.rights = rights;
      this.objects = objects;
      this.calls = calls;
    }

    @Override
    public List<PremisEvent> findEvents() {
      calls.add("events");
      return events;
    }

    @Override
    public List<PremisAgent> findAgents() {
      calls.add("agents");
      return agents;
    }

    @Override
    public List<PremisRights> findRights() {
      calls.add("rights");
      return rights;
    }

    @Override
    public List<PremisObject> findObjects() {
      calls.add("objects");
      return objects;
    }
  }
}
