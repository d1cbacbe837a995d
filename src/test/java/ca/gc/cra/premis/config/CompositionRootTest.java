package ca.gc.cra.premis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.premis.application.record.RecordAggregate;
import ca.gc.cra.premis.domain.premis.Identifier;
import ca.gc.cra.premis.domain.premis.PremisEvent;
import ca.gc.cra.premis.infrastructure.metrics.NoOpMetricsAdapter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(CompositionRootTest.class.getResource(name).toURI());
  }

  @Test
  void defaultsSelectNoOpMetrics() {
    try (CompositionRoot root = new CompositionRoot(ExportConfig.defaults())) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
      assertTrue(root.schemaValidator().isValid(
          RecordAggregate.of(List.of(), List.of(event("e1")), List.of(), List.of())
              .toTree(root.config().settings())));
    }
  }

  @Test
  void fromYamlAppliesFileAndOverrides() throws Exception {
    try (CompositionRoot root = CompositionRoot.fromYaml(
        resource("/premis-records.yaml"), DefaultsForMode.EXPORT, Map.of("prefix", "pr"))) {
      assertEquals(4, root.config().settings().indent());
      assertEquals("pr", root.config().settings().prefix());
    }
  }

  @Test
  void fromYamlWithoutFileUsesDefaults() throws Exception {
    try (CompositionRoot root = CompositionRoot.fromYaml(
        tempDir.resolve("absent.yaml"), DefaultsForMode.IMPORT, Map.of())) {
      assertEquals(ExportConfig.defaults(), root.config());
    }
  }

  @Test
  void fromYamlRejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class, () -> CompositionRoot.fromYaml(
        tempDir.resolve("absent.yaml"), DefaultsForMode.EXPORT, Map.of("indent", "99")));
  }

  @Test
  void writesAndLoadsRecordSet() throws Exception {
    Path target = tempDir.resolve("records.xml");
    RecordAggregate original = RecordAggregate.of(List.of(), List.of(event("e1"), event("e2")), List.of(), List.of());

    try (CompositionRoot root = new CompositionRoot(ExportConfig.defaults())) {
      root.write(original, target);
      RecordAggregate loaded = root.load(target);

      assertTrue(Files.size(target) > 0);
      assertEquals(original, loaded);
      assertEquals(target, loaded.getFilepath().orElseThrow());
      assertTrue(root.toXml(loaded).contains("<premis:eventIdentifierValue>e2</premis:eventIdentifierValue>"));
    }
  }

  private static PremisEvent event(String id) {
    return PremisEvent.of(Identifier.of("local", id), "ingestion", "2024-01-01T00:00:00Z");
  }
}
