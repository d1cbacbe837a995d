package ca.gc.cra.premis.domain.premis;

import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> PREMIS rights entity aggregating one or more rights statements.
 * <p><strong>Role:</strong> Domain record stored in the rights registry; addressable under the identifier of
 * every statement it contains.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param rightsStatements contained statements in document order; never empty
 * @since 0.1.0
 */
public record PremisRights(List<RightsStatement> rightsStatements) implements PremisEntry {

  public PremisRights {
    if (rightsStatements == null || rightsStatements.isEmpty()) {
      throw new IllegalArgumentException("rights must contain at least one rightsStatement");
    }
    rightsStatements = List.copyOf(rightsStatements);
  }

  /**
   * Creates a rights entity from statements.
   *
   * @param statements one or more statements
   * @return rights record
   */
  public static PremisRights of(RightsStatement... statements) {
    return new PremisRights(List.of(statements));
  }

  @Override
  public RecordKind kind() {
    return RecordKind.RIGHTS;
  }

  @Override
  public List<Identifier> identifiers() {
    List<Identifier> ids = new ArrayList<>(rightsStatements.size());
    for (RightsStatement statement : rightsStatements) {
      ids.add(statement.rightsStatementIdentifier());
    }
    return List.copyOf(ids);
  }

  @Override
  public TreeNode toTree() {
    List<TreeNode> children = new ArrayList<>(rightsStatements.size());
    for (RightsStatement statement : rightsStatements) {
      children.add(statement.toTree());
    }
    return TreeNode.element(RecordKind.RIGHTS.elementName(), children);
  }

  /**
   * Rebuilds a rights entity from its element tree.
   *
   * @param node {@code rights} element
   * @return rights record
   * @throws IllegalArgumentException if no statement is present or a statement is incomplete
   */
  public static PremisRights fromTree(TreeNode node) {
    Trees.requireName(node, RecordKind.RIGHTS);
    List<RightsStatement> statements = new ArrayList<>();
    for (TreeNode child : node.children(RightsStatement.ELEMENT)) {
      statements.add(RightsStatement.fromTree(child));
    }
    return new PremisRights(statements);
  }
}
