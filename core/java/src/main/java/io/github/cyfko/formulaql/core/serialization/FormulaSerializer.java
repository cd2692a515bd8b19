package io.github.cyfko.formulaql.core.serialization;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.api.AttributeDescriptor;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeStore;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Renders a {@link NodeStore} as canonical formula text, the structural inverse of parsing.
 *
 * <h2>Rendering Rules</h2>
 * <ul>
 *   <li>Attribute: {@code {Name}} with the catalog's current name, {@value #UNRESOLVED_ATTRIBUTE}
 *       when the id does not resolve</li>
 *   <li>Operator: its symbol</li>
 *   <li>Value: plain decimal without trailing zeros, {@code 0} when absent</li>
 *   <li>Function: {@code name(arg0, arg1, ...)} for its argument groups by ascending index; a
 *       missing slot of a fixed-arity function renders empty</li>
 *   <li>Plain group: {@code (children)}</li>
 *   <li>Siblings are joined with a single space</li>
 * </ul>
 * <p>
 * Serializing starts from the roots; nodes not reachable from a root (orphans, parent cycles)
 * are not rendered. For any structurally valid store, parsing the output and serializing again
 * yields the same text.
 * </p>
 *
 * <pre>{@code
 * String text = FormulaSerializer.serialize(store, catalog);
 * // "IF({VIP}, {Price} * 0.9, {Price})"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaSerializer {

    /** Text rendered for an attribute whose id is missing from the catalog. */
    public static final String UNRESOLVED_ATTRIBUTE = "{attribute}";

    private FormulaSerializer() {}

    /**
     * Serializes the whole store.
     *
     * @param store   the nodes to render
     * @param catalog catalog used to render attribute names
     * @return canonical formula text, empty for an empty store
     */
    public static String serialize(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "Node store cannot be null");
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");
        return renderSequence(store.roots(), store, catalog);
    }

    /**
     * Serializes the subtree rooted at one node.
     *
     * @param store   the store holding the node
     * @param nodeId  id of the node to render
     * @param catalog catalog used to render attribute names
     * @return the node's text, empty if the id is unknown
     */
    public static String serializeNode(NodeStore store, String nodeId, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "Node store cannot be null");
        Objects.requireNonNull(catalog, "Attribute catalog cannot be null");
        return store.find(nodeId).map(node -> render(node, store, catalog)).orElse("");
    }

    private static String renderSequence(List<Node> nodes, NodeStore store, AttributeCatalog catalog) {
        return nodes.stream()
                .map(node -> render(node, store, catalog))
                .collect(Collectors.joining(" "));
    }

    private static String render(Node node, NodeStore store, AttributeCatalog catalog) {
        return switch (node.kind()) {
            case ATTRIBUTE -> catalog.lookup(node.attributeId())
                    .map(AttributeDescriptor::name)
                    .map(name -> "{" + name + "}")
                    .orElse(UNRESOLVED_ATTRIBUTE);
            case OPERATOR -> node.operator() == null ? "" : node.operator().symbol();
            case VALUE -> renderValue(node.value());
            case FUNCTION -> renderFunction(node, store, catalog);
            case GROUP -> "(" + renderSequence(store.childrenOf(node.id()), store, catalog) + ")";
        };
    }

    private static String renderValue(BigDecimal value) {
        if (value == null) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private static String renderFunction(Node node, NodeStore store, AttributeCatalog catalog) {
        String name = node.function() == null ? "function" : node.function().functionName();

        TreeMap<Integer, Node> slots = new TreeMap<>();
        for (Node child : store.childrenOf(node.id())) {
            if (child.isArgumentGroup()) {
                slots.putIfAbsent(child.argumentIndex(), child);
            }
        }
        if (slots.isEmpty()) {
            return name + "()";
        }

        // missing fixed slots print empty so the remaining arguments keep their position
        int fixed = node.function() == null ? 0 : node.function().signature().fixedArity().orElse(0);
        for (int i = 0; i < fixed; i++) {
            slots.putIfAbsent(i, null);
        }
        List<String> arguments = new ArrayList<>(slots.size());
        for (Node group : slots.values()) {
            arguments.add(group == null ? "" : renderSequence(store.childrenOf(group.id()), store, catalog));
        }
        return name + "(" + String.join(", ", arguments) + ")";
    }
}
