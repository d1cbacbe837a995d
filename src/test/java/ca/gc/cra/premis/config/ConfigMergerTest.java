package ca.gc.cra.premis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void overridesWinOverYamlAndEmitWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("export");
    Map<String, String> yaml = Map.of("prefix", "p", "indent", "4");
    Map<String, String> overrides = Map.of("prefix", "q");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "export", Optional.of(yaml), overrides, defaults, warnings::add);

    assertEquals("q", merged.get("prefix"));
    assertEquals("4", merged.get("indent"));
    assertEquals("UTF-8", merged.get("encoding"));
    assertEquals(List.of("Override replaces YAML value for key: prefix"), warnings);
  }

  @Test
  void unsupportedEncodingIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "export", Optional.empty(), Map.of("encoding", "NOT-A-CHARSET"), Map.of(), msg -> {}));
  }

  @Test
  void indentOutsideRangeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "export", Optional.of(Map.of("indent", "17")), Map.of(), Map.of(), msg -> {}));
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "export", Optional.of(Map.of("indent", "two")), Map.of(), Map.of(), msg -> {}));
  }

  @Test
  void otlpRequiresEndpoint() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "import", Optional.empty(), Map.of("metricsExporter", "otlp"), DefaultsForMode.asFlatMap("import"),
        msg -> {}));
  }

  @Test
  void unknownMetricsExporterIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "import", Optional.empty(), Map.of("metricsExporter", "prometheus"), Map.of(), msg -> {}));
  }

  @Test
  void defaultsAloneAreValid() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "import", Optional.empty(), null, DefaultsForMode.asFlatMap("import"), null);

    assertTrue(merged.containsKey("metricsExporter"));
  }
}
