package ca.gc.cra.premis.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads record-set configuration from a YAML document.
 *
 * <p>The document has at most three top-level sections: {@code common}, {@code import} and {@code export}.
 * Each section maps setting names to scalar values, and every name must be one {@link DefaultsForMode} knows for
 * that section. Section names are matched without regard to case.</p>
 *
 * <pre>
 * common:
 *   metricsExporter: none
 * export:
 *   prefix: premis
 *   indent: 2
 * </pre>
 */
public final class YamlConfigLoader {
  static final String COMMON = "common";
  private static final List<String> SECTIONS = List.of(COMMON, DefaultsForMode.IMPORT, DefaultsForMode.EXPORT);

  private YamlConfigLoader() {}

  /**
   * Loads the {@code common} settings overlaid with the settings of the requested mode.
   *
   * @param path location of the YAML configuration
   * @param mode document mode ({@code import} or {@code export})
   * @return settings keyed by name, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException for an unknown mode, malformed YAML, an unknown section or setting, or a
   *     non-scalar value
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String selected = normalizeMode(mode);
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Map<String, Map<String, String>> sections;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      sections = readSections(new Yaml(new SafeConstructor(new LoaderOptions())).load(reader));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }

    Map<String, String> merged = new LinkedHashMap<>(sections.getOrDefault(COMMON, Map.of()));
    merged.putAll(sections.getOrDefault(selected, Map.of()));
    return Optional.of(Map.copyOf(merged));
  }

  private static String normalizeMode(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!DefaultsForMode.IMPORT.equals(normalized) && !DefaultsForMode.EXPORT.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return normalized;
  }

  private static Map<String, Map<String, String>> readSections(Object document) {
    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    if (document == null) {
      return sections;
    }
    for (Map.Entry<String, Object> entry : asMap(document, "root").entrySet()) {
      String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(section)) {
        throw new IllegalArgumentException("Unknown configuration section '" + entry.getKey()
            + "'; expected one of " + String.join(", ", SECTIONS));
      }
      if (sections.containsKey(section)) {
        throw new IllegalArgumentException("Configuration section '" + section + "' is declared more than once");
      }
      sections.put(section, readSettings(section, entry.getValue()));
    }
    return sections;
  }

  private static Map<String, String> readSettings(String section, Object node) {
    Map<String, String> settings = new LinkedHashMap<>();
    if (node == null) {
      return settings;
    }
    Set<String> allowed = COMMON.equals(section)
        ? DefaultsForMode.commonKeys()
        : DefaultsForMode.asFlatMap(section).keySet();
    for (Map.Entry<String, Object> entry : asMap(node, section).entrySet()) {
      String key = entry.getKey();
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException("Unknown setting '" + key + "' in section " + section);
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Setting " + section + "." + key + " must be a scalar");
      }
      settings.put(key, value == null ? "" : value.toString());
    }
    return settings;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
