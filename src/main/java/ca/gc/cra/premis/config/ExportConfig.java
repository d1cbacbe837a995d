package ca.gc.cra.premis.config;

import ca.gc.cra.premis.application.port.ExportSettings;
import ca.gc.cra.premis.validation.Numbers;
import ca.gc.cra.premis.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Typed configuration for reading and writing record sets.
 *
 * @param settings serialization settings handed to the exporter
 * @param metricsExporter metrics exporter mode ({@code none} or {@code otlp})
 * @param otelEndpoint OTLP collector endpoint; blank unless {@code metricsExporter=otlp}
 * @param verbose whether to raise logging to DEBUG at startup
 * @since 0.1.0
 */
public record ExportConfig(
    ExportSettings settings,
    String metricsExporter,
    String otelEndpoint,
    boolean verbose) {

  public ExportConfig {
    Objects.requireNonNull(settings, "settings");
    metricsExporter = Strings.requireOneOf("metricsExporter", metricsExporter, "none", "otlp")
        .toLowerCase(Locale.ROOT);
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint.trim();
    if ("otlp".equals(metricsExporter) && otelEndpoint.isEmpty()) {
      throw new IllegalArgumentException("otelEndpoint is required when metricsExporter=otlp");
    }
  }

  /**
   * Returns the built-in configuration: PREMIS 3.0 settings, metrics disabled, normal logging.
   *
   * @return default configuration
   */
  public static ExportConfig defaults() {
    return new ExportConfig(ExportSettings.defaults(), "none", "", false);
  }

  /**
   * Builds a configuration from a flat key/value map; missing keys fall back to {@link #defaults()}.
   *
   * @param input flat configuration, typically from {@link ConfigMerger}
   * @return typed configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static ExportConfig fromMap(Map<String, String> input) {
    Objects.requireNonNull(input, "input");
    ExportSettings base = ExportSettings.defaults();
    ExportSettings settings = new ExportSettings(
        value(input, "prefix", base.prefix()),
        value(input, "namespace", base.namespace()),
        value(input, "xsiNamespace", base.xsiNamespace()),
        value(input, "version", base.version()),
        value(input, "encoding", base.encoding()),
        Boolean.parseBoolean(value(input, "xmlDeclaration", Boolean.toString(base.xmlDeclaration()))),
        Numbers.parseInRange("indent", value(input, "indent", Integer.toString(base.indent())),
            0, ConfigMerger.MAX_INDENT));
    return new ExportConfig(
        settings,
        value(input, "metricsExporter", "none"),
        value(input, "otelEndpoint", ""),
        Boolean.parseBoolean(value(input, "verbose", "false")));
  }

  private static String value(Map<String, String> input, String key, String fallback) {
    String raw = input.get(key);
    return raw == null || raw.isBlank() ? fallback : raw.trim();
  }
}
