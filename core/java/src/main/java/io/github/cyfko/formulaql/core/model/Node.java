package io.github.cyfko.formulaql.core.model;

import java.math.BigDecimal;

/**
 * Immutable unit of a formula tree.
 * <p>
 * Nodes are kept flat in a {@link NodeStore}; the tree shape comes from {@code parentId}
 * references and from the order of siblings in the store. Only the payload matching the
 * node's {@link NodeKind} may be set:
 * </p>
 * <table border="1">
 * <caption>Payload per kind</caption>
 * <thead><tr><th>Kind</th><th>Payload</th></tr></thead>
 * <tbody>
 * <tr><td>ATTRIBUTE</td><td>{@code attributeId}</td></tr>
 * <tr><td>OPERATOR</td><td>{@code operator}</td></tr>
 * <tr><td>FUNCTION</td><td>{@code function}</td></tr>
 * <tr><td>VALUE</td><td>{@code value}</td></tr>
 * <tr><td>GROUP</td><td>{@code argumentIndex} (only for function argument slots)</td></tr>
 * </tbody>
 * </table>
 * <p>
 * The payload itself may be absent. An editor typically creates an empty operator or function
 * node first and fills it later; such incomplete nodes are legal here and reported by
 * structural validation.
 * </p>
 *
 * <pre>{@code
 * Node price = Node.attribute("n1", null, "price");
 * Node times = Node.operator("n2", null, Operator.MULTIPLY);
 * Node qty   = Node.attribute("n3", null, "quantity");
 * }</pre>
 *
 * @param id            unique, stable identifier
 * @param kind          node kind, never null
 * @param parentId      id of the parent node, null for root nodes
 * @param attributeId   catalog attribute id (attribute nodes)
 * @param operator      operator symbol (operator nodes)
 * @param function      called function (function nodes)
 * @param value         non-negative numeric literal (value nodes)
 * @param argumentIndex argument slot of the parent function (group nodes), null for plain groups
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Node(
        String id,
        NodeKind kind,
        String parentId,
        String attributeId,
        Operator operator,
        FormulaFunction function,
        BigDecimal value,
        Integer argumentIndex
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the id is blank, the kind is missing, a payload foreign
     *                                  to the kind is set, the node is its own parent, the value
     *                                  is negative or the argument index is negative
     */
    public Node {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind is required for node " + id);
        }
        if (id.equals(parentId)) {
            throw new IllegalArgumentException("Node " + id + " cannot be its own parent");
        }
        requireOnly(kind == NodeKind.ATTRIBUTE, attributeId, "attributeId", id, kind);
        requireOnly(kind == NodeKind.OPERATOR, operator, "operator", id, kind);
        requireOnly(kind == NodeKind.FUNCTION, function, "function", id, kind);
        requireOnly(kind == NodeKind.VALUE, value, "value", id, kind);
        requireOnly(kind == NodeKind.GROUP, argumentIndex, "argumentIndex", id, kind);
        // formula text has no signed literals, a minus sign is always the operator
        if (value != null && value.signum() < 0) {
            throw new IllegalArgumentException("Value of node " + id + " must be non-negative, got: " + value);
        }
        if (argumentIndex != null && argumentIndex < 0) {
            throw new IllegalArgumentException("argumentIndex must be non-negative, got: " + argumentIndex);
        }
    }

    private static void requireOnly(boolean allowed, Object payload, String field, String id, NodeKind kind) {
        if (!allowed && payload != null) {
            throw new IllegalArgumentException(String.format(
                    "Field '%s' is not allowed on %s node %s", field, kind.label(), id));
        }
    }

    public static Node attribute(String id, String parentId, String attributeId) {
        return new Node(id, NodeKind.ATTRIBUTE, parentId, attributeId, null, null, null, null);
    }

    public static Node operator(String id, String parentId, Operator operator) {
        return new Node(id, NodeKind.OPERATOR, parentId, null, operator, null, null, null);
    }

    public static Node function(String id, String parentId, FormulaFunction function) {
        return new Node(id, NodeKind.FUNCTION, parentId, null, null, function, null, null);
    }

    public static Node value(String id, String parentId, BigDecimal value) {
        return new Node(id, NodeKind.VALUE, parentId, null, null, null, value, null);
    }

    public static Node group(String id, String parentId) {
        return new Node(id, NodeKind.GROUP, parentId, null, null, null, null, null);
    }

    public static Node argument(String id, String functionId, int argumentIndex) {
        return new Node(id, NodeKind.GROUP, functionId, null, null, null, null, argumentIndex);
    }

    /**
     * Creates a node of the given kind with no payload, as an editor does before the user
     * picks an attribute, operator or function.
     *
     * @param id       node id
     * @param kind     node kind
     * @param parentId parent id, or null for a root node
     * @return the empty node
     */
    public static Node empty(String id, NodeKind kind, String parentId) {
        return new Node(id, kind, parentId, null, null, null, null, null);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * Whether this node is one argument slot of a function.
     *
     * @return {@code true} for groups carrying an argument index
     */
    public boolean isArgumentGroup() {
        return kind == NodeKind.GROUP && argumentIndex != null;
    }

    public Node withParentId(String newParentId) {
        return new Node(id, kind, newParentId, attributeId, operator, function, value, argumentIndex);
    }

    public Node withAttributeId(String newAttributeId) {
        return new Node(id, kind, parentId, newAttributeId, operator, function, value, argumentIndex);
    }

    public Node withOperator(Operator newOperator) {
        return new Node(id, kind, parentId, attributeId, newOperator, function, value, argumentIndex);
    }

    public Node withFunction(FormulaFunction newFunction) {
        return new Node(id, kind, parentId, attributeId, operator, newFunction, value, argumentIndex);
    }

    public Node withValue(BigDecimal newValue) {
        return new Node(id, kind, parentId, attributeId, operator, function, newValue, argumentIndex);
    }

    public Node withArgumentIndex(Integer newArgumentIndex) {
        return new Node(id, kind, parentId, attributeId, operator, function, value, newArgumentIndex);
    }
}
