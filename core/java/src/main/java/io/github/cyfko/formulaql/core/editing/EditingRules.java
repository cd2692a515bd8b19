package io.github.cyfko.formulaql.core.editing;

import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.NodeStore;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Which node kinds an editor may offer to add, under a node or at root level.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EditingRules {

    private EditingRules() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Kinds that may be added as children of {@code node}.
     * <ul>
     *   <li>attributes, values and operators: none</li>
     *   <li>a function that already has argument groups: none, content goes into the groups</li>
     *   <li>a function without argument groups: a group</li>
     *   <li>a group: every kind</li>
     * </ul>
     *
     * @param store the store holding the node
     * @param node  the prospective parent
     * @return the allowed kinds, possibly empty
     */
    public static Set<NodeKind> allowedChildKinds(NodeStore store, Node node) {
        return switch (node.kind()) {
            case ATTRIBUTE, VALUE, OPERATOR -> EnumSet.noneOf(NodeKind.class);
            case FUNCTION -> store.childrenOf(node.id()).stream().anyMatch(Node::isArgumentGroup)
                    ? EnumSet.noneOf(NodeKind.class)
                    : EnumSet.of(NodeKind.GROUP);
            case GROUP -> EnumSet.allOf(NodeKind.class);
        };
    }

    /**
     * Kinds that may be added at root level. Another operator is refused while the root holds
     * operators but no operand.
     *
     * @param store the store
     * @return the allowed kinds
     */
    public static Set<NodeKind> allowedRootKinds(NodeStore store) {
        List<Node> roots = store.roots();
        boolean hasOperator = roots.stream().anyMatch(node -> node.kind() == NodeKind.OPERATOR);
        boolean hasOperand = roots.stream().anyMatch(node -> node.kind().isOperandLike());
        if (hasOperator && !hasOperand) {
            return EnumSet.complementOf(EnumSet.of(NodeKind.OPERATOR));
        }
        return EnumSet.allOf(NodeKind.class);
    }
}
