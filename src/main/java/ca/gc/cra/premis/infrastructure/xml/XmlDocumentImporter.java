package ca.gc.cra.premis.infrastructure.xml;

import ca.gc.cra.premis.application.port.DocumentFormatException;
import ca.gc.cra.premis.application.port.DocumentImporter;
import ca.gc.cra.premis.application.port.DocumentImporterFactory;
import ca.gc.cra.premis.application.port.MetricsPort;
import ca.gc.cra.premis.domain.premis.PremisAgent;
import ca.gc.cra.premis.domain.premis.PremisEvent;
import ca.gc.cra.premis.domain.premis.PremisObject;
import ca.gc.cra.premis.domain.premis.PremisRights;
import ca.gc.cra.premis.domain.premis.RecordKind;
import ca.gc.cra.premis.domain.premis.TreeNode;
import ca.gc.cra.premis.logging.Logs;
import ca.gc.cra.premis.validation.Paths;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * <strong>What:</strong> {@link DocumentImporter} backed by a parsed PREMIS XML document.
 * <p><strong>Why:</strong> Turns the top-level {@code object}, {@code event}, {@code agent} and {@code rights}
 * elements of a document into typed records for the record aggregate.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for the document importer port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse with DTDs and external entities disabled.</li>
 *   <li>Require a {@code premis} root; skip unknown top-level elements with a warning.</li>
 *   <li>Report malformed XML and invalid records as {@link DocumentFormatException}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after parsing.</p>
 * <p><strong>Metrics:</strong> Emits {@code import.documents}, {@code import.records}, {@code import.failures},
 * {@code import.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class XmlDocumentImporter implements DocumentImporter {
  private static final Logger log = LoggerFactory.getLogger(XmlDocumentImporter.class);
  private static final String ROOT = "premis";

  private final List<PremisEvent> events;
  private final List<PremisAgent> agents;
  private final List<PremisRights> rights;
  private final List<PremisObject> objects;

  private XmlDocumentImporter(
      List<PremisEvent> events, List<PremisAgent> agents, List<PremisRights> rights, List<PremisObject> objects) {
    this.events = List.copyOf(events);
    this.agents = List.copyOf(agents);
    this.rights = List.copyOf(rights);
    this.objects = List.copyOf(objects);
  }

  /**
   * Parses the document at {@code location} without metrics.
   *
   * @param location readable XML file
   * @return importer over the parsed records
   * @throws IllegalArgumentException if the path does not name a readable file
   * @throws IOException if the file cannot be read or is not a valid PREMIS document
   */
  public static XmlDocumentImporter open(Path location) throws IOException {
    return open(location, MetricsPort.NO_OP);
  }

  /**
   * Parses the document at {@code location}.
   *
   * @param location readable XML file
   * @param metrics metrics sink
   * @return importer over the parsed records
   * @throws IOException if the file cannot be read or is not a valid PREMIS document
   */
  public static XmlDocumentImporter open(Path location, MetricsPort metrics) throws IOException {
    Path source = Paths.requireReadableFile(location);
    try (InputStream in = Files.newInputStream(source)) {
      XmlDocumentImporter importer = parse(in, source.toString(), metrics);
      log.info("Loaded PREMIS document {}", Logs.truncate(source));
      return importer;
    }
  }

  /**
   * Returns a factory that opens documents and reports to the given metrics sink.
   *
   * @param metrics metrics sink
   * @return importer factory
   */
  public static DocumentImporterFactory factory(MetricsPort metrics) {
    Objects.requireNonNull(metrics, "metrics");
    return location -> open(location, metrics);
  }

  /**
   * Parses an in-memory document.
   *
   * @param xml serialized document
   * @return importer over the parsed records
   * @throws DocumentFormatException if the text is not a valid PREMIS document
   */
  public static XmlDocumentImporter fromString(String xml) throws DocumentFormatException {
    try {
      return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "<string>", MetricsPort.NO_OP);
    } catch (DocumentFormatException ex) {
      throw ex;
    } catch (IOException ex) {
      throw new DocumentFormatException("Failed to read in-memory document", ex);
    }
  }

  /**
   * Parses a document from a stream.
   *
   * @param in document bytes; not closed
   * @param sourceLabel location used in error messages
   * @param metrics metrics sink
   * @return importer over the parsed records
   * @throws IOException if the stream fails or the document is not valid PREMIS
   */
  public static XmlDocumentImporter parse(InputStream in, String sourceLabel, MetricsPort metrics)
      throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(metrics, "metrics");
    long start = System.nanoTime();
    try {
      Document document = newBuilder().parse(in);
      XmlDocumentImporter importer = fromDocument(document, sourceLabel);
      metrics.increment("import.documents");
      for (int i = 0; i < importer.recordCount(); i++) {
        metrics.increment("import.records");
      }
      return importer;
    } catch (SAXException ex) {
      metrics.increment("import.failures");
      throw new DocumentFormatException("Malformed XML in " + sourceLabel + ": " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      metrics.increment("import.failures");
      throw new DocumentFormatException("Invalid PREMIS record in " + sourceLabel + ": " + ex.getMessage(), ex);
    } catch (DocumentFormatException ex) {
      metrics.increment("import.failures");
      throw ex;
    } finally {
      metrics.observe("import.latencyNanos", System.nanoTime() - start);
    }
  }

  private static XmlDocumentImporter fromDocument(Document document, String sourceLabel)
      throws DocumentFormatException {
    Element root = document.getDocumentElement();
    String rootName = XmlTreeMapper.localName(root);
    if (!ROOT.equals(rootName)) {
      throw new DocumentFormatException(
          "Expected <" + ROOT + "> root in " + sourceLabel + " but found <" + rootName + ">");
    }
    List<PremisEvent> events = new ArrayList<>();
    List<PremisAgent> agents = new ArrayList<>();
    List<PremisRights> rights = new ArrayList<>();
    List<PremisObject> objects = new ArrayList<>();
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node node = children.item(i);
      if (node.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      TreeNode tree = XmlTreeMapper.fromElement((Element) node);
      Optional<RecordKind> kind = RecordKind.fromElementName(tree.name());
      if (kind.isEmpty()) {
        log.warn("Skipping unsupported element <{}> in {}", Logs.truncate(tree.name()), Logs.truncate(sourceLabel));
        continue;
      }
      switch (kind.get()) {
        case OBJECT -> objects.add(PremisObject.fromTree(tree));
        case EVENT -> events.add(PremisEvent.fromTree(tree));
        case AGENT -> agents.add(PremisAgent.fromTree(tree));
        case RIGHTS -> rights.add(PremisRights.fromTree(tree));
        default -> throw new IllegalStateException("Unhandled record kind " + kind.get());
      }
    }
    log.debug("Parsed {} objects, {} events, {} agents, {} rights from {}",
        objects.size(), events.size(), agents.size(), rights.size(), Logs.truncate(sourceLabel));
    return new XmlDocumentImporter(events, agents, rights, objects);
  }

  private static DocumentBuilder newBuilder() throws DocumentFormatException {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      DocumentBuilder builder = factory.newDocumentBuilder();
      builder.setErrorHandler(new ErrorHandler() {
        @Override
        public void warning(SAXParseException ex) {
          log.warn("XML parser warning at line {}: {}", ex.getLineNumber(), Logs.truncate(ex.getMessage()));
        }

        @Override
        public void error(SAXParseException ex) throws SAXException {
          throw ex;
        }

        @Override
        public void fatalError(SAXParseException ex) throws SAXException {
          throw ex;
        }
      });
      return builder;
    } catch (ParserConfigurationException ex) {
      throw new DocumentFormatException("XML parser does not support secure processing", ex);
    }
  }

  private int recordCount() {
    return events.size() + agents.size() + rights.size() + objects.size();
  }

  @Override
  public List<PremisEvent> findEvents() {
    return events;
  }

  @Override
  public List<PremisAgent> findAgents() {
    return agents;
  }

  @Override
  public List<PremisRights> findRights() {
    return rights;
  }

  @Override
  public List<PremisObject> findObjects() {
    return objects;
  }
}
