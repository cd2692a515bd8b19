package io.github.cyfko.formulaql.core.validation;

import io.github.cyfko.formulaql.core.api.AttributeCatalog;
import io.github.cyfko.formulaql.core.model.FormulaFunction;
import io.github.cyfko.formulaql.core.model.Node;
import io.github.cyfko.formulaql.core.model.NodeKind;
import io.github.cyfko.formulaql.core.model.NodeStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Checks that a node store describes a well-formed expression, independently of types.
 * <p>
 * Root level: operand/operator alternation (see {@link SequenceShape}). Any level: function
 * arity and argument slots, dangling parent references, cyclic parent chains, children under
 * leaf nodes and nodes missing their payload. With a catalog, attribute references must
 * resolve.
 * </p>
 * <p>
 * The validator never mutates the store and never throws on malformed content; every problem
 * becomes an error message.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class StructuralValidator {

    private static final Logger log = Logger.getLogger(StructuralValidator.class.getName());

    private StructuralValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates the structure of a store without resolving attribute references.
     *
     * @param store the store to validate
     * @return the structural report
     */
    public static StructuralReport validate(NodeStore store) {
        return validate(store, null);
    }

    /**
     * Validates the structure of a store.
     *
     * @param store   the store to validate
     * @param catalog catalog used to resolve attribute references, or null to skip that check
     * @return the structural report
     */
    public static StructuralReport validate(NodeStore store, AttributeCatalog catalog) {
        Objects.requireNonNull(store, "store");

        List<String> errors = new ArrayList<>();
        SequenceShape rootShape = SequenceShape.check(store.roots());
        errors.addAll(rootShape.errors());

        Map<String, List<Node>> children = indexChildren(store);
        for (Node node : store) {
            checkNode(store, node, children, catalog, errors);
        }
        checkReachability(store, children, errors);

        log.fine(() -> String.format("Structural validation of %d nodes: %d error(s), %d broken connection(s)",
                store.size(), errors.size(), rootShape.brokenConnections().size()));
        return new StructuralReport(errors, rootShape.brokenConnections());
    }

    private static void checkNode(NodeStore store, Node node, Map<String, List<Node>> childIndex,
                                  AttributeCatalog catalog, List<String> errors) {
        List<Node> children = childIndex.getOrDefault(node.id(), List.of());
        if (node.parentId() != null && !store.exists(node.parentId())) {
            errors.add(ValidationMessages.orphan(node.id(), node.parentId()));
        }

        if (node.kind().isLeaf() && !children.isEmpty()) {
            errors.add(ValidationMessages.leafWithChildren(node.kind(), node.id()));
        }

        switch (node.kind()) {
            case ATTRIBUTE -> {
                if (node.attributeId() == null) {
                    errors.add(ValidationMessages.missingAttributeReference(node.id()));
                } else if (catalog != null && catalog.lookup(node.attributeId()).isEmpty()) {
                    errors.add(ValidationMessages.unresolvedAttribute(node.attributeId()));
                }
            }
            case OPERATOR -> {
                if (node.operator() == null) {
                    errors.add(ValidationMessages.incompleteOperator(node.id()));
                }
            }
            case FUNCTION -> {
                if (node.function() == null) {
                    errors.add(ValidationMessages.incompleteFunction(node.id()));
                } else {
                    checkArguments(node.function(), children, childIndex, errors);
                }
            }
            case GROUP -> {
                if (node.isArgumentGroup()) {
                    boolean underFunction = store.parentOf(node.id())
                            .map(parent -> parent.kind() == NodeKind.FUNCTION)
                            .orElse(false);
                    // a dangling parent is already reported as an orphan
                    if (!underFunction && (node.isRoot() || store.exists(node.parentId()))) {
                        errors.add(ValidationMessages.detachedArgumentGroup(node.id()));
                    }
                }
            }
            case VALUE -> {
                // a value carries no reference to check
            }
        }
    }

    private static void checkArguments(FormulaFunction function, List<Node> children,
                                       Map<String, List<Node>> childIndex, List<String> errors) {
        OptionalInt arity = function.signature().fixedArity();
        SortedMap<Integer, Node> slots = new TreeMap<>();

        for (Node child : children) {
            if (!child.isArgumentGroup()) {
                errors.add(ValidationMessages.nonArgumentChild(function, child.kind()));
                continue;
            }
            int index = child.argumentIndex();
            if (slots.putIfAbsent(index, child) != null) {
                errors.add(ValidationMessages.duplicateArgument(function, index));
            }
            if (arity.isPresent() && index >= arity.getAsInt()) {
                errors.add(ValidationMessages.argumentOutOfRange(function, index, arity.getAsInt()));
            }
        }

        if (arity.isPresent() && slots.size() != arity.getAsInt()) {
            errors.add(ValidationMessages.arity(function, arity.getAsInt(), slots.size()));
        }
        if (arity.isEmpty()) {
            checkContiguous(function, slots, errors);
        }
        // emptiness is judged on the first group of each slot, duplicates are reported above
        for (Map.Entry<Integer, Node> slot : slots.entrySet()) {
            if (!childIndex.containsKey(slot.getValue().id())) {
                errors.add(ValidationMessages.emptyArgument(function, slot.getKey()));
            }
        }
    }

    /** Variadic argument groups must be numbered {@code 0..k-1}; reports the first gap only. */
    private static void checkContiguous(FormulaFunction function, SortedMap<Integer, Node> slots, List<String> errors) {
        long expected = 0;
        for (int index : slots.keySet()) {
            if (index != expected) {
                errors.add(ValidationMessages.argumentGap(function, expected, index));
                return;
            }
            expected++;
        }
    }

    private static Map<String, List<Node>> indexChildren(NodeStore store) {
        Map<String, List<Node>> children = new HashMap<>();
        for (Node node : store) {
            if (node.parentId() != null) {
                children.computeIfAbsent(node.parentId(), key -> new ArrayList<>()).add(node);
            }
        }
        return children;
    }

    /**
     * Reports nodes whose parent exists but which no root reaches, which only happens on a
     * cyclic parent chain. Descendants of a dangling parent are left to the orphan check.
     */
    private static void checkReachability(NodeStore store, Map<String, List<Node>> children, List<String> errors) {
        Set<String> reachable = new HashSet<>();
        Deque<Node> pending = new ArrayDeque<>(store.roots());
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (reachable.add(node.id())) {
                pending.addAll(children.getOrDefault(node.id(), List.of()));
            }
        }

        for (Node node : store) {
            if (!reachable.contains(node.id()) && onCycle(store, node)) {
                errors.add(ValidationMessages.unreachable(node.id()));
            }
        }
    }

    private static boolean onCycle(NodeStore store, Node node) {
        Set<String> visited = new HashSet<>();
        Node current = node;
        while (current != null && visited.add(current.id())) {
            if (current.parentId() == null) {
                return false;
            }
            current = store.find(current.parentId()).orElse(null);
        }
        return current != null;
    }
}
