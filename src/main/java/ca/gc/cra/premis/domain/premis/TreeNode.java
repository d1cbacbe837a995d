package ca.gc.cra.premis.domain.premis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable element tree used as the neutral projection of PREMIS records.
 * <p><strong>Why:</strong> Keeps record projection free of any XML API so importers and exporters can be
 * swapped without touching the domain.</p>
 * <p><strong>Role:</strong> Domain value produced by {@link PremisEntry#toTree()} and consumed by the
 * document adapters.</p>
 * <p><strong>Thread-safety:</strong> Immutable; attribute order and child order are preserved.</p>
 *
 * <p>Names are local names (no prefix). Attribute keys may carry a prefix such as {@code xsi:type} or
 * {@code xmlns:premis}; the exporter resolves those prefixes.</p>
 *
 * @param name local element name; never blank
 * @param attributes attributes in insertion order; never {@code null}
 * @param text element text or {@code null} for container elements
 * @param children child elements in document order; never {@code null}
 * @since 0.1.0
 */
public record TreeNode(
    String name,
    Map<String, String> attributes,
    String text,
    List<TreeNode> children) {

  /**
   * Copies collections and rejects blank names.
   */
  public TreeNode {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("element name must not be blank");
    }
    attributes = attributes == null || attributes.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    children = children == null ? List.of() : List.copyOf(children);
  }

  /**
   * Creates a container element.
   *
   * @param name local element name
   * @param children child elements
   * @return container node
   */
  public static TreeNode element(String name, TreeNode... children) {
    return new TreeNode(name, Map.of(), null, Arrays.asList(children));
  }

  /**
   * Creates a container element from a child list.
   *
   * @param name local element name
   * @param children child elements
   * @return container node
   */
  public static TreeNode element(String name, List<TreeNode> children) {
    return new TreeNode(name, Map.of(), null, children);
  }

  /**
   * Creates a text-only element.
   *
   * @param name local element name
   * @param text element text; must not be {@code null}
   * @return leaf node
   */
  public static TreeNode leaf(String name, String text) {
    return new TreeNode(name, Map.of(), Objects.requireNonNull(text, name), List.of());
  }

  /**
   * Returns a copy of this node with an extra attribute.
   *
   * @param key attribute name, optionally prefixed
   * @param value attribute value
   * @return new node carrying the attribute
   */
  public TreeNode withAttribute(String key, String value) {
    Map<String, String> copy = new LinkedHashMap<>(attributes);
    copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new TreeNode(name, copy, text, children);
  }

  /**
   * Returns a copy of this node with {@code extra} appended to its children.
   *
   * @param extra children to append
   * @return new node
   */
  public TreeNode withChildren(List<TreeNode> extra) {
    List<TreeNode> copy = new ArrayList<>(children);
    copy.addAll(extra);
    return new TreeNode(name, attributes, text, copy);
  }

  /**
   * Looks up an attribute value.
   *
   * @param key attribute name
   * @return attribute value when present
   */
  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  /**
   * Returns the first child with the given name.
   *
   * @param childName local name to match
   * @return first matching child when present
   */
  public Optional<TreeNode> child(String childName) {
    for (TreeNode child : children) {
      if (child.name().equals(childName)) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns every child with the given name, in document order.
   *
   * @param childName local name to match
   * @return matching children; empty when none
   */
  public List<TreeNode> children(String childName) {
    List<TreeNode> matches = new ArrayList<>();
    for (TreeNode child : children) {
      if (child.name().equals(childName)) {
        matches.add(child);
      }
    }
    return matches;
  }

  /**
   * Returns the text of the first child with the given name.
   *
   * @param childName local name to match
   * @return child text, empty when the child is missing or has no text
   */
  public Optional<String> childText(String childName) {
    return child(childName).map(TreeNode::text);
  }

  /**
   * Returns the first child with the given name or fails.
   *
   * @param childName local name to match
   * @return matching child
   * @throws IllegalArgumentException when no such child exists
   */
  public TreeNode requireChild(String childName) {
    return child(childName).orElseThrow(() ->
        new IllegalArgumentException(name + " is missing required element " + childName));
  }

  /**
   * Returns the non-blank text of the first child with the given name or fails.
   *
   * @param childName local name to match
   * @return child text
   * @throws IllegalArgumentException when the child is missing or its text is blank
   */
  public String requireText(String childName) {
    String value = requireChild(childName).text();
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + "/" + childName + " must not be blank");
    }
    return value;
  }
}
