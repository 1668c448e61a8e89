package com.hcltech.composable.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The forest of parent pointers. Each source has at most one target, and following targets
 * from any node always reaches a node without one (its root).
 * <p>
 * Implementations only check graph-shaped preconditions; whether a node exists is the
 * caller's concern. Not thread-safe: mutations are expected to be serialized by the host.
 */
public interface LinkGraph {

    /** Single hop read. */
    Optional<NodeId> getTarget(NodeId node);

    /**
     * Follows targets until a node with none is reached.
     *
     * @throws CompositionException GRAPH_CORRUPTED if more than {@link #maxDepth()} hops are needed
     */
    NodeId findRoot(NodeId node);

    /** Hops from the node to its root; 0 for a root. */
    int depthOf(NodeId node);

    /** Direct children, in {@link NodeId} order. */
    Set<NodeId> getChildren(NodeId node);

    /** Every descendant, breadth first, children of one node in {@link NodeId} order. */
    List<NodeId> getSubtree(NodeId node);

    /**
     * Creates the edge source → target.
     *
     * @throws CompositionException SELF_LINK, ALREADY_LINKED, CYCLE_DETECTED or DEPTH_EXCEEDED
     */
    void link(NodeId source, NodeId target);

    /**
     * Replaces the edge out of source, returning the previous target.
     *
     * @throws CompositionException NOT_LINKED, SELF_LINK, CYCLE_DETECTED or DEPTH_EXCEEDED
     */
    NodeId updateTarget(NodeId source, NodeId newTarget);

    /**
     * Removes the edge out of source, returning the previous target.
     *
     * @throws CompositionException NOT_LINKED
     */
    NodeId unlink(NodeId source);

    int maxDepth();

    /** Snapshot of source → target. */
    Map<NodeId, NodeId> edges();

    /** Snapshot of target → sources. */
    Map<NodeId, Set<NodeId>> reverseIndex();
}
