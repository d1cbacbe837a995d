package ca.gc.cra.premis.domain.premis;

import ca.gc.cra.premis.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> PREMIS event entity recording a preservation action.
 * <p><strong>Role:</strong> Domain record stored in the event registry under its single identifier.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param eventIdentifier the event identifier
 * @param eventType action performed (e.g., {@code ingestion}, {@code fixity check}); never blank
 * @param eventDateTime when the action happened, kept verbatim; never blank
 * @param eventDetail free-text detail, or {@code null}
 * @param eventOutcome outcome such as {@code success}, or {@code null}
 * @param linkingAgentIdentifiers agents involved; never {@code null}
 * @param linkingObjectIdentifiers objects involved; never {@code null}
 * @since 0.1.0
 */
public record PremisEvent(
    Identifier eventIdentifier,
    String eventType,
    String eventDateTime,
    String eventDetail,
    String eventOutcome,
    List<Identifier> linkingAgentIdentifiers,
    List<Identifier> linkingObjectIdentifiers) implements PremisEntry {

  public PremisEvent {
    Objects.requireNonNull(eventIdentifier, "eventIdentifier");
    Strings.requireText("eventType", eventType);
    Strings.requireText("eventDateTime", eventDateTime);
    linkingAgentIdentifiers = linkingAgentIdentifiers == null ? List.of() : List.copyOf(linkingAgentIdentifiers);
    linkingObjectIdentifiers = linkingObjectIdentifiers == null ? List.of() : List.copyOf(linkingObjectIdentifiers);
  }

  /**
   * Creates an event with only the required fields.
   *
   * @param identifier event identifier
   * @param eventType event type
   * @param eventDateTime event timestamp
   * @return event without detail, outcome, or links
   */
  public static PremisEvent of(Identifier identifier, String eventType, String eventDateTime) {
    return new PremisEvent(identifier, eventType, eventDateTime, null, null, List.of(), List.of());
  }

  @Override
  public RecordKind kind() {
    return RecordKind.EVENT;
  }

  @Override
  public List<Identifier> identifiers() {
    return List.of(eventIdentifier);
  }

  @Override
  public TreeNode toTree() {
    List<TreeNode> children = new ArrayList<>();
    children.add(eventIdentifier.toTree("eventIdentifier"));
    children.add(TreeNode.leaf("eventType", eventType));
    children.add(TreeNode.leaf("eventDateTime", eventDateTime));
    if (eventDetail != null) {
      children.add(TreeNode.element("eventDetailInformation", TreeNode.leaf("eventDetail", eventDetail)));
    }
    if (eventOutcome != null) {
      children.add(TreeNode.element("eventOutcomeInformation", TreeNode.leaf("eventOutcome", eventOutcome)));
    }
    Trees.writeIdentifiers(children, "linkingAgentIdentifier", linkingAgentIdentifiers);
    Trees.writeIdentifiers(children, "linkingObjectIdentifier", linkingObjectIdentifiers);
    return TreeNode.element(RecordKind.EVENT.elementName(), children);
  }

  /**
   * Rebuilds an event from its element tree.
   *
   * @param node {@code event} element
   * @return event record
   * @throws IllegalArgumentException if required children are missing
   */
  public static PremisEvent fromTree(TreeNode node) {
    Trees.requireName(node, RecordKind.EVENT);
    return new PremisEvent(
        Identifier.fromTree(node.requireChild("eventIdentifier")),
        node.requireText("eventType"),
        node.requireText("eventDateTime"),
        node.child("eventDetailInformation").flatMap(info -> info.childText("eventDetail")).orElse(null),
        node.child("eventOutcomeInformation").flatMap(info -> info.childText("eventOutcome")).orElse(null),
        Trees.readIdentifiers(node, "linkingAgentIdentifier"),
        Trees.readIdentifiers(node, "linkingObjectIdentifier"));
  }
}
