package io.github.cyfko.formulaql.core.editing;

import io.github.cyfko.formulaql.core.exception.NodeStoreException;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.FunctionSignature;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.NodeStore;
import io.github.cyfko.formulaql.core.model.Operator;
import io.github.cyfko.formulaql.core.spi.NodeIdGenerator;
import io.github.cyfko.formulaql.core.validation.BrokenConnection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * Compound edits a formula editor applies to a {@link NodeStore}.
 * <p>
 * Each edit mutates the given store in place and keeps argument groups consistent with the
 * function they belong to. Unknown ids raise a {@link NodeStoreException}; an edit that does not
 * apply to the target node raises an {@link IllegalArgumentException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeEdits {

    private static final Logger log = Logger.getLogger(NodeEdits.class.getName());

    private NodeEdits() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Sets the function of a function node and lays out its argument slots.
     * <p>
     * For a fixed-arity function the node's current argument groups, with their content, are
     * removed and one empty group per slot is appended. A variadic function keeps its current
     * groups; callers add slots with {@link #addArgument(NodeStore, String, NodeIdGenerator)}.
     * </p>
     *
     * @param store       the store to edit
     * @param nodeId      id of a function node
     * @param function    the function to assign
     * @param idGenerator source of ids for the new groups
     * @return the argument groups created, in slot order
     */
    public static List<Node> assignFunction(NodeStore store, String nodeId, FormulaFunction function,
                                            NodeIdGenerator idGenerator) {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(idGenerator, "idGenerator");
        requireKind(store, nodeId, NodeKind.FUNCTION);

        store.replace(nodeId, node -> node.withFunction(function));

        OptionalInt arity = function.signature().fixedArity();
        if (arity.isEmpty()) {
            return List.of();
        }

        for (Node child : store.childrenOf(nodeId)) {
            if (child.isArgumentGroup()) {
                store.removeSubtree(child.id());
            }
        }

        List<Node> groups = new ArrayList<>();
        for (int index = 0; index < arity.getAsInt(); index++) {
            groups.add(store.add(Node.argument(idGenerator.nextId(), nodeId, index)));
        }
        log.fine(() -> String.format("Assigned %s to node %s with %d argument slot(s)",
                function.functionName(), nodeId, groups.size()));
        return groups;
    }

    /**
     * Repairs a broken connection by placing an operator between its two operands.
     *
     * @param store       the store to edit
     * @param connection  the connection reported by the structural validator
     * @param operator    the operator to insert
     * @param idGenerator source of the new node id
     * @return the inserted operator node
     */
    public static Node insertOperator(NodeStore store, BrokenConnection connection, Operator operator,
                                      NodeIdGenerator idGenerator) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(idGenerator, "idGenerator");

        Node before = store.find(connection.before())
                .orElseThrow(() -> new NodeStoreException("Unknown node id: " + connection.before()));
        Node after = store.find(connection.after())
                .orElseThrow(() -> new NodeStoreException("Unknown node id: " + connection.after()));
        if (!Objects.equals(before.parentId(), after.parentId())) {
            throw new IllegalArgumentException(String.format(
                    "Nodes %s and %s are not siblings", before.id(), after.id()));
        }

        Node inserted = store.insertBefore(after.id(), Node.operator(idGenerator.nextId(), before.parentId(), operator));
        log.fine(() -> String.format("Inserted '%s' between %s and %s", operator.symbol(), before.id(), after.id()));
        return inserted;
    }

    /**
     * Appends the next argument group to a function.
     *
     * @param store       the store to edit
     * @param functionId  id of a function node
     * @param idGenerator source of the new node id
     * @return the new argument group
     * @throws IllegalArgumentException if the function has no name yet, all its fixed slots
     *                                  already exist or its highest index is already the largest int
     */
    public static Node addArgument(NodeStore store, String functionId, NodeIdGenerator idGenerator) {
        Objects.requireNonNull(idGenerator, "idGenerator");
        Node function = requireKind(store, functionId, NodeKind.FUNCTION);
        if (function.function() == null) {
            throw new IllegalArgumentException("Function node " + functionId + " has no function name");
        }

        int next = 0;
        for (Node child : store.childrenOf(functionId)) {
            if (child.isArgumentGroup()) {
                if (child.argumentIndex() == Integer.MAX_VALUE) {
                    throw new IllegalArgumentException("Function node " + functionId + " has no argument slot left");
                }
                next = Math.max(next, child.argumentIndex() + 1);
            }
        }

        FunctionSignature signature = function.function().signature();
        if (!signature.isVariadic() && next >= signature.arity()) {
            throw new IllegalArgumentException(String.format("Function '%s' takes %d argument(s)",
                    function.function().functionName(), signature.arity()));
        }
        return store.add(Node.argument(idGenerator.nextId(), functionId, next));
    }

    private static Node requireKind(NodeStore store, String nodeId, NodeKind kind) {
        Objects.requireNonNull(store, "store");
        Node node = store.find(nodeId).orElseThrow(() -> new NodeStoreException("Unknown node id: " + nodeId));
        if (node.kind() != kind) {
            throw new IllegalArgumentException(String.format("Node %s is a %s node, expected %s",
                    nodeId, node.kind().label(), kind.label()));
        }
        return node;
    }
}
