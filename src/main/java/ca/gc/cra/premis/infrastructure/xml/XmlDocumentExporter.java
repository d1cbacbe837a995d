package ca.gc.cra.premis.infrastructure.xml;

import ca.gc.cra.premis.application.port.DocumentExporter;
import ca.gc.cra.premis.application.port.ExportSettings;
import ca.gc.cra.premis.application.port.MetricsPort;
import ca.gc.cra.premis.domain.premis.TreeNode;
import ca.gc.cra.premis.logging.Logs;
import ca.gc.cra.premis.validation.Paths;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Result;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * <strong>What:</strong> {@link DocumentExporter} that serializes a document tree as PREMIS XML.
 * <p><strong>Role:</strong> Infrastructure adapter for the document exporter port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Qualify every element with the configured prefix and namespace.</li>
 *   <li>Qualify {@code xsi:type} values with the same prefix.</li>
 *   <li>Honour declaration, encoding and indentation settings.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics sink; safe for concurrent use.</p>
 * <p><strong>Metrics:</strong> Emits {@code export.documents}, {@code export.records}, {@code export.failures},
 * {@code export.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class XmlDocumentExporter implements DocumentExporter {
  private static final Logger log = LoggerFactory.getLogger(XmlDocumentExporter.class);

  private final MetricsPort metrics;

  /** Creates an exporter without metrics. */
  public XmlDocumentExporter() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an exporter reporting to the given metrics sink.
   *
   * @param metrics metrics sink
   */
  public XmlDocumentExporter(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String render(TreeNode document, ExportSettings settings) throws IOException {
    StringWriter writer = new StringWriter();
    transform(document, settings, new StreamResult(writer));
    return writer.toString();
  }

  @Override
  public void write(TreeNode document, Path target, ExportSettings settings) throws IOException {
    Path destination = Paths.requireWritableFile(target);
    try (OutputStream out = Files.newOutputStream(destination)) {
      transform(document, settings, new StreamResult(out));
    }
    log.info("Wrote PREMIS document {}", Logs.truncate(destination));
  }

  private void transform(TreeNode document, ExportSettings settings, Result result) throws IOException {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(settings, "settings");
    long start = System.nanoTime();
    try {
      Document dom = newDocument();
      dom.appendChild(XmlTreeMapper.toElement(dom, document, settings));
      newTransformer(settings).transform(new DOMSource(dom), result);
      metrics.increment("export.documents");
      for (int i = 0; i < document.children().size(); i++) {
        metrics.increment("export.records");
      }
      log.debug("Serialized {} records with prefix {}", document.children().size(), settings.prefix());
    } catch (ParserConfigurationException | TransformerException ex) {
      metrics.increment("export.failures");
      throw new IOException("Failed to serialize PREMIS document: " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      metrics.increment("export.failures");
      throw ex;
    } finally {
      metrics.observe("export.latencyNanos", System.nanoTime() - start);
    }
  }

  private static Document newDocument() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    Document document = factory.newDocumentBuilder().newDocument();
    document.setXmlStandalone(true);
    return document;
  }

  private static Transformer newTransformer(ExportSettings settings) throws TransformerException {
    TransformerFactory factory = TransformerFactory.newInstance();
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
    Transformer transformer = factory.newTransformer();
    transformer.setOutputProperty(OutputKeys.METHOD, "xml");
    transformer.setOutputProperty(OutputKeys.ENCODING, settings.encoding());
    transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, settings.xmlDeclaration() ? "no" : "yes");
    // XmlTreeMapper writes indentation between container children only.
    transformer.setOutputProperty(OutputKeys.INDENT, "no");
    return transformer;
  }
}
