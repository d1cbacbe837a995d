package ca.gc.cra.premis.domain.premis;

import java.util.ArrayList;
import java.util.List;

/** Shared projection helpers for the record implementations. */
final class Trees {
  private Trees() {
    // Utility
  }

  static List<Identifier> readIdentifiers(TreeNode parent, String elementName) {
    List<Identifier> ids = new ArrayList<>();
    for (TreeNode node : parent.children(elementName)) {
      ids.add(Identifier.fromTree(node));
    }
    return ids;
  }

  static void writeIdentifiers(List<TreeNode> target, String elementName, List<Identifier> ids) {
    for (Identifier id : ids) {
      target.add(id.toTree(elementName));
    }
  }

  static List<String> readTexts(TreeNode parent, String elementName) {
    List<String> values = new ArrayList<>();
    for (TreeNode node : parent.children(elementName)) {
      if (node.text() != null) {
        values.add(node.text());
      }
    }
    return values;
  }

  static void requireName(TreeNode node, RecordKind kind) {
    if (!kind.elementName().equals(node.name())) {
      throw new IllegalArgumentException(
          "expected <" + kind.elementName() + "> but found <" + node.name() + ">");
    }
  }

  static List<Identifier> requireNonEmpty(String label, List<Identifier> ids) {
    if (ids == null || ids.isEmpty()) {
      throw new IllegalArgumentException(label + " must contain at least one identifier");
    }
    return List.copyOf(ids);
  }
}
