package io.github.cyfko.formulaql.core.model;

import io.github.cyfko.formulaql.core.exception.NodeStoreException;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Flat, order-preserving collection of the {@link Node}s of one formula.
 * <p>
 * The store is an arena: nodes reference their parent by id and the relative order of nodes
 * sharing a parent is the left-to-right reading order of the expression. Every mutation
 * preserves that order; insertions land exactly where requested.
 * </p>
 *
 * <h2>Queries</h2>
 * <p>
 * {@link #roots()}, {@link #childrenOf(String)} and {@link #exists(String)} are linear scans
 * over the collection. Formulas are expected to hold at most a few hundred nodes, so no
 * auxiliary index is maintained.
 * </p>
 *
 * <h2>Mutations</h2>
 * <p>
 * Mutations never repair the tree: removing a parent leaves its children pointing at a
 * missing node, which the structural validator reports as orphans. Use
 * {@link #removeSubtree(String)} for an explicit cascading delete. Ids are unique within a
 * store; any operation that would break uniqueness throws {@link NodeStoreException}.
 * </p>
 *
 * <p>This class is not thread-safe. It belongs to the caller's editing session; engine passes
 * only read it.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class NodeStore implements Iterable<Node> {

    private final List<Node> nodes;

    /**
     * Creates an empty store.
     */
    public NodeStore() {
        this.nodes = new ArrayList<>();
    }

    /**
     * Creates a store holding the given nodes, in iteration order.
     *
     * @param nodes the initial nodes
     * @throws NodeStoreException if two nodes share an id
     */
    public NodeStore(Collection<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes cannot be null");
        this.nodes = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            add(node);
        }
    }

    public static NodeStore of(Node... nodes) {
        return new NodeStore(Arrays.asList(nodes));
    }

    /**
     * Read-only view of all nodes in store order.
     *
     * @return unmodifiable list of nodes
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes().iterator();
    }

    // ------------------------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------------------------

    /**
     * Nodes without a parent, in store order.
     *
     * @return the top-level nodes of the expression
     */
    public List<Node> roots() {
        List<Node> roots = new ArrayList<>();
        for (Node node : nodes) {
            if (node.isRoot()) {
                roots.add(node);
            }
        }
        return roots;
    }

    /**
     * Nodes whose parent is {@code id}, in store order.
     *
     * @param id the parent id
     * @return the children, empty if none or if the id is unknown
     */
    public List<Node> childrenOf(String id) {
        List<Node> children = new ArrayList<>();
        for (Node node : nodes) {
            if (id != null && id.equals(node.parentId())) {
                children.add(node);
            }
        }
        return children;
    }

    public boolean exists(String id) {
        return indexOf(id) >= 0;
    }

    public Optional<Node> find(String id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(nodes.get(index));
    }

    /**
     * Resolves the parent of a node.
     *
     * @param id the child id
     * @return the parent, empty for roots, unknown ids and dangling parent references
     */
    public Optional<Node> parentOf(String id) {
        return find(id).map(Node::parentId).flatMap(this::find);
    }

    /**
     * Whether {@code ancestorId} appears on the parent chain of {@code nodeId}.
     * <p>
     * The walk stops at a root, at a dangling parent reference, or when it revisits a node, so
     * a cyclic parent chain terminates.
     * </p>
     *
     * @param ancestorId candidate ancestor
     * @param nodeId     node whose parent chain is walked
     * @return {@code true} if the candidate is a strict ancestor
     */
    public boolean isAncestor(String ancestorId, String nodeId) {
        if (ancestorId == null || nodeId == null) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        Optional<Node> current = find(nodeId);
        while (current.isPresent() && visited.add(current.get().id())) {
            String parentId = current.get().parentId();
            if (parentId == null) {
                return false;
            }
            if (parentId.equals(ancestorId)) {
                return true;
            }
            current = find(parentId);
        }
        return false;
    }

    // ------------------------------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------------------------------

    /**
     * Appends a node at the end of the store.
     *
     * @param node the node to add
     * @return the added node
     * @throws NodeStoreException if the id is already taken
     */
    public Node add(Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        requireFreeId(node.id());
        nodes.add(node);
        return node;
    }

    /**
     * Inserts a node immediately before the target node.
     *
     * @param targetId id of the node to insert before
     * @param node     the node to insert
     * @return the inserted node
     * @throws NodeStoreException if the target is unknown or the id is already taken
     */
    public Node insertBefore(String targetId, Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        int index = requireIndex(targetId);
        requireFreeId(node.id());
        nodes.add(index, node);
        return node;
    }

    /**
     * Inserts a node immediately after the target node.
     *
     * @param targetId id of the node to insert after
     * @param node     the node to insert
     * @return the inserted node
     * @throws NodeStoreException if the target is unknown or the id is already taken
     */
    public Node insertAfter(String targetId, Node node) {
        Objects.requireNonNull(node, "node cannot be null");
        int index = requireIndex(targetId);
        requireFreeId(node.id());
        nodes.add(index + 1, node);
        return node;
    }

    /**
     * Replaces a node in place with an updated version of itself.
     *
     * @param id      id of the node to update
     * @param updater function producing the new node from the current one
     * @return the updated node
     * @throws NodeStoreException if the id is unknown or the updater changed the id
     */
    public Node replace(String id, UnaryOperator<Node> updater) {
        Objects.requireNonNull(updater, "updater cannot be null");
        int index = requireIndex(id);
        Node updated = Objects.requireNonNull(updater.apply(nodes.get(index)), "updater returned null");
        if (!updated.id().equals(id)) {
            throw new NodeStoreException(String.format(
                    "Update of node %s cannot change its id to %s", id, updated.id()));
        }
        nodes.set(index, updated);
        return updated;
    }

    /**
     * Removes a single node. Its children are left in place.
     *
     * @param id id of the node to remove
     * @return the removed node, or empty if the id was unknown
     */
    public Optional<Node> remove(String id) {
        int index = indexOf(id);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(nodes.remove(index));
    }

    /**
     * Removes a node together with all of its descendants.
     *
     * @param id id of the subtree root
     * @return the removed nodes in store order, empty if the id was unknown
     */
    public List<Node> removeSubtree(String id) {
        if (!exists(id)) {
            return List.of();
        }
        List<Node> removed = new ArrayList<>();
        for (Node node : nodes) {
            if (node.id().equals(id) || isAncestor(id, node.id())) {
                removed.add(node);
            }
        }
        nodes.removeAll(removed);
        return removed;
    }

    /**
     * Independent copy of this store; nodes are immutable and shared.
     *
     * @return the copy
     */
    public NodeStore copy() {
        return new NodeStore(nodes);
    }

    // ------------------------------------------------------------------------------------------

    private int indexOf(String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private int requireIndex(String id) {
        int index = indexOf(id);
        if (index < 0) {
            throw new NodeStoreException("Node " + id + " does not exist");
        }
        return index;
    }

    private void requireFreeId(String id) {
        if (indexOf(id) >= 0) {
            throw new NodeStoreException("Duplicate node id: " + id);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeStore other)) return false;
        return nodes.equals(other.nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        return "NodeStore[size=" + nodes.size() + "]";
    }
}
