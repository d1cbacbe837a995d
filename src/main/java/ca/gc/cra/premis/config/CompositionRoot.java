package ca.gc.cra.premis.config;

import ca.gc.cra.premis.application.port.DocumentExporter;
import ca.gc.cra.premis.application.port.DocumentImporterFactory;
import ca.gc.cra.premis.application.port.MetricsPort;
import ca.gc.cra.premis.application.port.SchemaValidator;
import ca.gc.cra.premis.application.record.RecordAggregate;
import ca.gc.cra.premis.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.premis.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.premis.infrastructure.validation.NoOpSchemaValidator;
import ca.gc.cra.premis.infrastructure.xml.XmlDocumentExporter;
import ca.gc.cra.premis.infrastructure.xml.XmlDocumentImporter;
import ca.gc.cra.premis.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the record aggregate to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate configuration into importers, exporters and
 * metrics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@code metricsExporter}.</li>
 *   <li>Expose the XML importer factory, exporter, and schema validator.</li>
 *   <li>Load and write whole record sets with the configured settings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration and stateless adapters; construct on one thread.</p>
 *
 * @since 0.1.0
 * @see RecordAggregate
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ExportConfig config;
  private final MetricsPort metrics;
  private final DocumentExporter exporter;
  private final SchemaValidator validator = new NoOpSchemaValidator();

  /**
   * Creates a composition root whose metrics adapter follows the configuration.
   *
   * @param config effective configuration
   */
  public CompositionRoot(ExportConfig config) {
    this(config, metricsFor(config));
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config effective configuration
   * @param metrics metrics adapter shared by importer and exporter
   */
  public CompositionRoot(ExportConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.exporter = new XmlDocumentExporter(metrics);
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
  }

  /**
   * Builds a composition root from defaults, an optional YAML file, and explicit overrides.
   *
   * @param yaml YAML configuration; a missing file contributes nothing
   * @param mode document mode ({@code import} or {@code export})
   * @param overrides explicit key/value overrides
   * @return wired composition root
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException if the merged configuration is invalid
   */
  public static CompositionRoot fromYaml(Path yaml, String mode, Map<String, String> overrides) throws IOException {
    Optional<Map<String, String>> loaded = YamlConfigLoader.load(yaml, mode);
    if (loaded.isEmpty()) {
      log.debug("No configuration file at {}; using defaults", yaml);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        mode, loaded, overrides, DefaultsForMode.asFlatMap(mode), log::warn);
    return new CompositionRoot(ExportConfig.fromMap(effective));
  }

  private static MetricsPort metricsFor(ExportConfig config) {
    if ("otlp".equals(config.metricsExporter())) {
      return new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otelEndpoint());
    }
    return new NoOpMetricsAdapter();
  }

  public ExportConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the XML importer factory reporting to this root's metrics adapter.
   *
   * @return importer factory
   */
  public DocumentImporterFactory importerFactory() {
    return XmlDocumentImporter.factory(metrics);
  }

  public DocumentExporter exporter() {
    return exporter;
  }

  public SchemaValidator schemaValidator() {
    return validator;
  }

  /**
   * Loads a record set from a PREMIS XML file.
   *
   * @param document document to import
   * @return populated aggregate with {@code document} as provenance path
   * @throws IOException if the document cannot be read or parsed
   */
  public RecordAggregate load(Path document) throws IOException {
    return RecordAggregate.builder().fromPath(document).importer(importerFactory()).build();
  }

  /**
   * Writes a record set using the configured serialization settings.
   *
   * @param aggregate records to write
   * @param target output file
   * @throws IOException if the file cannot be written
   */
  public void write(RecordAggregate aggregate, Path target) throws IOException {
    aggregate.write(target, exporter, config.settings());
  }

  /**
   * Renders a record set using the configured serialization settings.
   *
   * @param aggregate records to render
   * @return serialized document
   * @throws IOException if serialization fails
   */
  public String toXml(RecordAggregate aggregate) throws IOException {
    return aggregate.toXml(exporter, config.settings());
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
