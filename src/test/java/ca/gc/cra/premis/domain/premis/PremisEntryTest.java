package ca.gc.cra.premis.domain.premis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PremisEntryTest {
  private static final Identifier OBJ_A = Identifier.of("local", "obj-a");
  private static final Identifier OBJ_B = Identifier.of("uuid", "obj-b");
  private static final Identifier EVT = Identifier.of("local", "evt-1");
  private static final Identifier AGT = Identifier.of("local", "agt-1");

  @Test
  void identifiersFollowRecordShape() {
    PremisObject object = new PremisObject(List.of(OBJ_A, OBJ_B), PremisObject.FILE, null, List.of());
    PremisEvent event = PremisEvent.of(EVT, "ingestion", "2024-01-01T00:00:00Z");
    PremisAgent agent = PremisAgent.of(AGT, "Archivist", "person");
    PremisRights rights = PremisRights.of(
        RightsStatement.of(Identifier.of("local", "r1"), "license"),
        RightsStatement.of(Identifier.of("local", "r2"), "statute"));

    assertEquals(List.of(OBJ_A, OBJ_B), object.identifiers());
    assertEquals(List.of(EVT), event.identifiers());
    assertEquals(List.of(AGT), agent.identifiers());
    assertEquals(List.of(Identifier.of("local", "r1"), Identifier.of("local", "r2")), rights.identifiers());
  }

  @Test
  void kindsMatchElementNames() {
    assertEquals(RecordKind.OBJECT, PremisObject.file(OBJ_A).kind());
    assertEquals("rights", RecordKind.RIGHTS.elementName());
    assertEquals(RecordKind.AGENT, RecordKind.fromElementName("agent").orElseThrow());
    assertTrue(RecordKind.fromElementName("premis").isEmpty());
  }

  @Test
  void objectTreeCarriesCategoryAttribute() {
    PremisObject object = new PremisObject(List.of(OBJ_A), "representation", "scan.tif", List.of(EVT));

    TreeNode tree = object.toTree();

    assertEquals("object", tree.name());
    assertEquals("representation", tree.attribute("xsi:type").orElseThrow());
    assertEquals("scan.tif", tree.childText("originalName").orElseThrow());
    assertEquals(object, PremisObject.fromTree(tree));
  }

  @Test
  void objectWithoutCategoryDefaultsToFile() {
    TreeNode tree = TreeNode.element("object", OBJ_A.toTree("objectIdentifier"));

    PremisObject object = PremisObject.fromTree(tree);

    assertEquals(PremisObject.FILE, object.category());
    assertNull(object.originalName());
  }

  @Test
  void eventTreeWrapsDetailAndOutcome() {
    PremisEvent event = new PremisEvent(
        EVT, "fixity check", "2024-02-02T10:00:00Z", "sha256", "pass", List.of(AGT), List.of(OBJ_A));

    TreeNode tree = event.toTree();

    assertEquals("sha256", tree.requireChild("eventDetailInformation").childText("eventDetail").orElseThrow());
    assertEquals("pass", tree.requireChild("eventOutcomeInformation").childText("eventOutcome").orElseThrow());
    assertEquals(event, PremisEvent.fromTree(tree));
  }

  @Test
  void eventRequiresTypeAndDateTime() {
    TreeNode tree = TreeNode.element("event", EVT.toTree("eventIdentifier"), TreeNode.leaf("eventType", "x"));

    assertThrows(IllegalArgumentException.class, () -> PremisEvent.fromTree(tree));
  }

  @Test
  void rightsTreeNestsStatementsAndActs() {
    RightsStatement statement = new RightsStatement(
        Identifier.of("local", "r1"), "copyright", List.of("disseminate", "replicate"), List.of(OBJ_A));
    PremisRights rights = PremisRights.of(statement);

    TreeNode tree = rights.toTree();

    assertEquals(1, tree.children("rightsStatement").size());
    assertEquals(2, tree.requireChild("rightsStatement").children("rightsGranted").size());
    assertEquals(rights, PremisRights.fromTree(tree));
  }

  @Test
  void recordsRejectMissingIdentifiers() {
    assertThrows(IllegalArgumentException.class,
        () -> new PremisObject(List.of(), PremisObject.FILE, null, List.of()));
    assertThrows(IllegalArgumentException.class,
        () -> new PremisAgent(List.of(), List.of(), null, List.of()));
    assertThrows(IllegalArgumentException.class, () -> new PremisRights(List.of()));
  }

  @Test
  void objectRejectsBlankCategoryBothWays() {
    assertThrows(IllegalArgumentException.class, () -> new PremisObject(List.of(OBJ_A), " ", null, List.of()));
    TreeNode tree = TreeNode.element("object", OBJ_A.toTree("objectIdentifier")).withAttribute("xsi:type", "");

    assertThrows(IllegalArgumentException.class, () -> PremisObject.fromTree(tree));
  }

  @Test
  void eventRejectsBlankTypeAndDateTimeBothWays() {
    assertThrows(IllegalArgumentException.class, () -> PremisEvent.of(EVT, "", "2024-01-01T00:00:00Z"));
    assertThrows(IllegalArgumentException.class, () -> PremisEvent.of(EVT, "ingestion", "  "));
    TreeNode tree = TreeNode.element("event",
        EVT.toTree("eventIdentifier"), TreeNode.leaf("eventType", ""), TreeNode.leaf("eventDateTime", "2024"));

    assertThrows(IllegalArgumentException.class, () -> PremisEvent.fromTree(tree));
  }

  @Test
  void rightsRejectBlankBasisAndActBothWays() {
    Identifier id = Identifier.of("local", "r1");
    assertThrows(IllegalArgumentException.class, () -> RightsStatement.of(id, " "));
    assertThrows(IllegalArgumentException.class,
        () -> new RightsStatement(id, "license", List.of(""), List.of()));
    TreeNode tree = TreeNode.element("rights", TreeNode.element("rightsStatement",
        id.toTree("rightsStatementIdentifier"), TreeNode.leaf("rightsBasis", "")));

    assertThrows(IllegalArgumentException.class, () -> PremisRights.fromTree(tree));
  }

  @Test
  void agentAcceptsBlankOptionalValuesBothWays() {
    PremisAgent agent = new PremisAgent(List.of(AGT), List.of("", " "), "", List.of());

    assertEquals(agent, PremisAgent.fromTree(agent.toTree()));
  }

  @Test
  void blankOptionalEventFieldsSurviveTreeProjection() {
    PremisEvent event = new PremisEvent(EVT, "ingestion", "2024", "", " ", List.of(), List.of());

    assertEquals(event, PremisEvent.fromTree(event.toTree()));
  }

  @Test
  void fromTreeRejectsWrongElement() {
    TreeNode agentTree = PremisAgent.of(AGT, "Archivist", "person").toTree();

    assertThrows(IllegalArgumentException.class, () -> PremisObject.fromTree(agentTree));
  }
}
