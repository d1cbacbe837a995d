package ca.gc.cra.premis.domain.premis;

import java.util.ArrayList;
import java.util.List;

/**
 * PREMIS agent entity: a person, organization, or software acting in events.
 *
 * @param agentIdentifiers identifiers in document order; never empty
 * @param agentNames names of the agent; never {@code null}
 * @param agentType agent type (e.g., {@code software}), or {@code null}
 * @param linkingEventIdentifiers events the agent took part in; never {@code null}
 * @since 0.1.0
 */
public record PremisAgent(
    List<Identifier> agentIdentifiers,
    List<String> agentNames,
    String agentType,
    List<Identifier> linkingEventIdentifiers) implements PremisEntry {

  public PremisAgent {
    agentIdentifiers = Trees.requireNonEmpty("agentIdentifiers", agentIdentifiers);
    agentNames = agentNames == null ? List.of() : List.copyOf(agentNames);
    linkingEventIdentifiers = linkingEventIdentifiers == null ? List.of() : List.copyOf(linkingEventIdentifiers);
  }

  /**
   * Creates a named agent with a single identifier.
   *
   * @param identifier agent identifier
   * @param name agent name
   * @param agentType agent type, or {@code null}
   * @return agent record
   */
  public static PremisAgent of(Identifier identifier, String name, String agentType) {
    return new PremisAgent(List.of(identifier), List.of(name), agentType, List.of());
  }

  @Override
  public RecordKind kind() {
    return RecordKind.AGENT;
  }

  @Override
  public List<Identifier> identifiers() {
    return agentIdentifiers;
  }

  @Override
  public TreeNode toTree() {
    List<TreeNode> children = new ArrayList<>();
    Trees.writeIdentifiers(children, "agentIdentifier", agentIdentifiers);
    for (String name : agentNames) {
      children.add(TreeNode.leaf("agentName", name));
    }
    if (agentType != null) {
      children.add(TreeNode.leaf("agentType", agentType));
    }
    Trees.writeIdentifiers(children, "linkingEventIdentifier", linkingEventIdentifiers);
    return TreeNode.element(RecordKind.AGENT.elementName(), children);
  }

  /**
   * Rebuilds an agent from its element tree.
   *
   * @param node {@code agent} element
   * @return agent record
   */
  public static PremisAgent fromTree(TreeNode node) {
    Trees.requireName(node, RecordKind.AGENT);
    return new PremisAgent(
        Trees.readIdentifiers(node, "agentIdentifier"),
        Trees.readTexts(node, "agentName"),
        node.childText("agentType").orElse(null),
        Trees.readIdentifiers(node, "linkingEventIdentifier"));
  }
}
