package ca.gc.cra.premis.domain.premis;

import ca.gc.cra.premis.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Independently identified rights statement nested inside a {@link PremisRights} entity.
 *
 * @param rightsStatementIdentifier statement identifier
 * @param rightsBasis basis of the statement (e.g., {@code copyright}, {@code license}); never blank
 * @param grantedActs acts permitted by the statement (e.g., {@code replicate}), each non-blank; never {@code null}
 * @param linkingObjectIdentifiers objects the statement applies to; never {@code null}
 * @since 0.1.0
 */
public record RightsStatement(
    Identifier rightsStatementIdentifier,
    String rightsBasis,
    List<String> grantedActs,
    List<Identifier> linkingObjectIdentifiers) {

  static final String ELEMENT = "rightsStatement";

  public RightsStatement {
    Objects.requireNonNull(rightsStatementIdentifier, "rightsStatementIdentifier");
    Strings.requireText("rightsBasis", rightsBasis);
    grantedActs = grantedActs == null ? List.of() : List.copyOf(grantedActs);
    for (String act : grantedActs) {
      Strings.requireText("grantedAct", act);
    }
    linkingObjectIdentifiers = linkingObjectIdentifiers == null ? List.of() : List.copyOf(linkingObjectIdentifiers);
  }

  /**
   * Creates a statement with no granted acts or links.
   *
   * @param identifier statement identifier
   * @param rightsBasis rights basis
   * @return rights statement
   */
  public static RightsStatement of(Identifier identifier, String rightsBasis) {
    return new RightsStatement(identifier, rightsBasis, List.of(), List.of());
  }

  TreeNode toTree() {
    List<TreeNode> children = new ArrayList<>();
    children.add(rightsStatementIdentifier.toTree("rightsStatementIdentifier"));
    children.add(TreeNode.leaf("rightsBasis", rightsBasis));
    for (String act : grantedActs) {
      children.add(TreeNode.element("rightsGranted", TreeNode.leaf("act", act)));
    }
    Trees.writeIdentifiers(children, "linkingObjectIdentifier", linkingObjectIdentifiers);
    return TreeNode.element(ELEMENT, children);
  }

  static RightsStatement fromTree(TreeNode node) {
    List<String> acts = new ArrayList<>();
    for (TreeNode granted : node.children("rightsGranted")) {
      acts.add(granted.requireText("act"));
    }
    return new RightsStatement(
        Identifier.fromTree(node.requireChild("rightsStatementIdentifier")),
        node.requireText("rightsBasis"),
        acts,
        Trees.readIdentifiers(node, "linkingObjectIdentifier"));
  }
}
