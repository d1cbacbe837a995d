package ca.gc.cra.premis.config;

import ca.gc.cra.premis.application.port.ExportSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Supplies flattened default configuration maps for each document mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  /** Mode used when reading documents. */
  public static final String IMPORT = "import";
  /** Mode used when writing documents. */
  public static final String EXPORT = "export";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target mode ({@code import} or {@code export})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case IMPORT -> Map.of();
      case EXPORT -> buildExportDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  /**
   * Names of the settings shared by every mode.
   *
   * @return unmodifiable set of setting names
   */
  static Set<String> commonKeys() {
    return COMMON_DEFAULTS.keySet();
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildExportDefaults() {
    ExportSettings defaults = ExportSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("prefix", defaults.prefix());
    map.put("namespace", defaults.namespace());
    map.put("xsiNamespace", defaults.xsiNamespace());
    map.put("version", defaults.version());
    map.put("encoding", defaults.encoding());
    map.put("xmlDeclaration", Boolean.toString(defaults.xmlDeclaration()));
    map.put("indent", Integer.toString(defaults.indent()));
    return map;
  }
}
