package ca.gc.cra.premis.config;

import ca.gc.cra.premis.validation.Numbers;
import ca.gc.cra.premis.validation.Strings;
import java.nio.charset.Charset;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and explicit overrides while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  /** Largest accepted indentation width. */
  public static final int MAX_INDENT = 16;

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence overrides &gt; YAML &gt; defaults.
   *
   * @param mode active document mode
   * @param yaml optional YAML-derived settings for the mode
   * @param overrides explicit key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when an override replaces a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overridesCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overridesCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String encoding = trim(effective.get("encoding"));
    if (!encoding.isEmpty() && !Charset.isSupported(encoding)) {
      throw new IllegalArgumentException("Unsupported encoding: " + encoding);
    }
    String indent = trim(effective.get("indent"));
    if (!indent.isEmpty()) {
      Numbers.parseInRange("indent", indent, 0, MAX_INDENT);
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      Strings.requireOneOf("metricsExporter", exporter, "none", "otlp");
      if ("otlp".equals(exporter) && trim(effective.get("otelEndpoint")).isEmpty()) {
        throw new IllegalArgumentException("otelEndpoint is required when metricsExporter=otlp");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
