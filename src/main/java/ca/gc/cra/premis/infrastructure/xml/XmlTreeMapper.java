package ca.gc.cra.premis.infrastructure.xml;

import ca.gc.cra.premis.application.port.ExportSettings;
import ca.gc.cra.premis.domain.premis.TreeNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Converts between DOM elements and {@link TreeNode} values.
 *
 * <p>Element names are reduced to local names on the way in and qualified with the export prefix on the way out.
 * Schema-instance attributes keep an {@code xsi:} key; the value of {@code xsi:type} is stored without its prefix.</p>
 *
 * <p>Leaf text is kept exactly as written. Indentation is emitted only between the children of container
 * elements, so whitespace inside a value is never added or lost.</p>
 */
final class XmlTreeMapper {
  static final String XSI_PREFIX = "xsi";
  private static final String XMLNS_PREFIX = XMLConstants.XMLNS_ATTRIBUTE + ":";
  private static final String TYPE = "type";

  private XmlTreeMapper() {
    // Utility
  }

  static TreeNode fromElement(Element element) {
    Map<String, String> attributes = new LinkedHashMap<>();
    NamedNodeMap attrs = element.getAttributes();
    for (int i = 0; i < attrs.getLength(); i++) {
      Attr attr = (Attr) attrs.item(i);
      if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
        continue;
      }
      String local = localName(attr);
      if (XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI.equals(attr.getNamespaceURI())) {
        String value = TYPE.equals(local) ? stripPrefix(attr.getValue()) : attr.getValue();
        attributes.put(XSI_PREFIX + ":" + local, value);
      } else {
        attributes.put(local, attr.getValue());
      }
    }
    List<TreeNode> children = new ArrayList<>();
    NodeList nodes = element.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        children.add(fromElement((Element) node));
      }
    }
    String text = children.isEmpty() ? element.getTextContent() : null;
    return new TreeNode(localName(element), attributes, text, children);
  }

  static Element toElement(Document document, TreeNode node, ExportSettings settings) {
    return toElement(document, node, settings, 0);
  }

  private static Element toElement(Document document, TreeNode node, ExportSettings settings, int depth) {
    Element element = document.createElementNS(settings.namespace(), settings.prefix() + ":" + node.name());
    for (Map.Entry<String, String> attribute : node.attributes().entrySet()) {
      String key = attribute.getKey();
      String value = attribute.getValue();
      if (key.startsWith(XMLNS_PREFIX)) {
        element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, key, value);
      } else if (key.startsWith(XSI_PREFIX + ":")) {
        String qualified = key.equals(XSI_PREFIX + ":" + TYPE) ? settings.prefix() + ":" + value : value;
        element.setAttributeNS(settings.xsiNamespace(), key, qualified);
      } else {
        element.setAttribute(key, value);
      }
    }
    if (node.text() != null) {
      element.setTextContent(node.text());
    }
    for (TreeNode child : node.children()) {
      indent(document, element, settings, depth + 1);
      element.appendChild(toElement(document, child, settings, depth + 1));
    }
    if (!node.children().isEmpty()) {
      indent(document, element, settings, depth);
    }
    return element;
  }

  private static void indent(Document document, Element parent, ExportSettings settings, int depth) {
    if (settings.indent() > 0) {
      parent.appendChild(document.createTextNode("\n" + " ".repeat(settings.indent() * depth)));
    }
  }

  static String localName(Node node) {
    String local = node.getLocalName();
    return local != null ? local : stripPrefix(node.getNodeName());
  }

  static String stripPrefix(String qualified) {
    int colon = qualified.indexOf(':');
    return colon < 0 ? qualified : qualified.substring(colon + 1);
  }
}
