package ca.gc.cra.premis.domain.premis;

import ca.gc.cra.premis.validation.Strings;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> PREMIS object entity describing a file, representation, bitstream, or intellectual
 * entity.
 * <p><strong>Role:</strong> Domain record stored in the object registry; addressable under every listed
 * identifier.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param objectIdentifiers identifiers in document order; never empty
 * @param category object category emitted as the {@code xsi:type} of the element (e.g., {@code file}); never blank
 * @param originalName name of the object when it was ingested, or {@code null}
 * @param linkingEventIdentifiers events that involved this object; never {@code null}
 * @since 0.1.0
 */
public record PremisObject(
    List<Identifier> objectIdentifiers,
    String category,
    String originalName,
    List<Identifier> linkingEventIdentifiers) implements PremisEntry {

  /** Default category used when none is supplied. */
  public static final String FILE = "file";

  public PremisObject {
    objectIdentifiers = Trees.requireNonEmpty("objectIdentifiers", objectIdentifiers);
    Strings.requireText("category", category);
    linkingEventIdentifiers = linkingEventIdentifiers == null ? List.of() : List.copyOf(linkingEventIdentifiers);
  }

  /**
   * Creates a file object with a single identifier and no optional fields.
   *
   * @param identifier object identifier
   * @return file object
   */
  public static PremisObject file(Identifier identifier) {
    return new PremisObject(List.of(identifier), FILE, null, List.of());
  }

  @Override
  public RecordKind kind() {
    return RecordKind.OBJECT;
  }

  @Override
  public List<Identifier> identifiers() {
    return objectIdentifiers;
  }

  @Override
  public TreeNode toTree() {
    List<TreeNode> children = new ArrayList<>();
    Trees.writeIdentifiers(children, "objectIdentifier", objectIdentifiers);
    if (originalName != null) {
      children.add(TreeNode.leaf("originalName", originalName));
    }
    Trees.writeIdentifiers(children, "linkingEventIdentifier", linkingEventIdentifiers);
    return TreeNode.element(RecordKind.OBJECT.elementName(), children).withAttribute("xsi:type", category);
  }

  /**
   * Rebuilds an object from its element tree.
   *
   * @param node {@code object} element
   * @return object record
   * @throws IllegalArgumentException if the element is not an object or lacks identifiers
   */
  public static PremisObject fromTree(TreeNode node) {
    Trees.requireName(node, RecordKind.OBJECT);
    return new PremisObject(
        Trees.readIdentifiers(node, "objectIdentifier"),
        node.attribute("xsi:type").orElse(FILE),
        node.childText("originalName").orElse(null),
        Trees.readIdentifiers(node, "linkingEventIdentifier"));
  }
}
