package ca.gc.cra.premis.domain.premis;

import ca.gc.cra.premis.validation.Strings;

/**
 * <strong>What:</strong> Typed identifier naming a PREMIS record within its kind.
 * <p><strong>Why:</strong> Acts as the sole collision key for record registries.</p>
 * <p><strong>Role:</strong> Domain value shared by every record kind and by linking references.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * <p>Equality is exact on both components: case-sensitive, no trimming or other normalization.</p>
 *
 * @param type identifier type qualifier (e.g., {@code local}, {@code ark}); never blank
 * @param value identifier value; never blank
 * @since 0.1.0
 */
public record Identifier(String type, String value) {

  /**
   * Validates both components without altering them.
   *
   * @throws NullPointerException if either component is {@code null}
   * @throws IllegalArgumentException if either component is blank
   */
  public Identifier {
    Strings.requireText("identifier type", type);
    Strings.requireText("identifier value", value);
  }

  /**
   * Convenience factory mirroring the record constructor.
   *
   * @param type identifier type qualifier
   * @param value identifier value
   * @return new identifier
   */
  public static Identifier of(String type, String value) {
    return new Identifier(type, value);
  }

  /**
   * Projects this identifier to a PREMIS identifier container element.
   *
   * <p>For {@code elementName = "eventIdentifier"} the result is
   * {@code <eventIdentifier><eventIdentifierType/><eventIdentifierValue/></eventIdentifier>}.</p>
   *
   * @param elementName container element name
   * @return identifier tree
   */
  public TreeNode toTree(String elementName) {
    return TreeNode.element(
        elementName,
        TreeNode.leaf(elementName + "Type", type),
        TreeNode.leaf(elementName + "Value", value));
  }

  /**
   * Reads an identifier from a container element produced by {@link #toTree(String)}.
   *
   * @param node identifier container
   * @return identifier read from the {@code *Type} and {@code *Value} children
   * @throws IllegalArgumentException if either child is missing or blank
   */
  public static Identifier fromTree(TreeNode node) {
    String name = node.name();
    return new Identifier(node.requireText(name + "Type"), node.requireText(name + "Value"));
  }

  @Override
  public String toString() {
    return type + ":" + value;
  }
}
