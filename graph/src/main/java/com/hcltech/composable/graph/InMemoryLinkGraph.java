package com.hcltech.composable.graph;

import com.hcltech.composable.common.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hash-map backed {@link LinkGraph}. Roots are never cached: every query walks the parent
 * chain, so acyclicity is the only invariant to maintain.
 */
public final class InMemoryLinkGraph implements LinkGraph {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLinkGraph.class);

    public static final int DEFAULT_MAX_DEPTH = 4096;

    private final Map<NodeId, NodeId> targets = new HashMap<>();
    private final Map<NodeId, Set<NodeId>> children = new HashMap<>();
    private final int maxDepth;
    private final Metrics metrics;

    public InMemoryLinkGraph() {
        this(DEFAULT_MAX_DEPTH, Metrics.nullMetrics);
    }

    public InMemoryLinkGraph(int maxDepth, Metrics metrics) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.maxDepth = maxDepth;
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Reloads a persisted edge table as is. Nothing is checked, so a damaged table surfaces
     * later as GRAPH_CORRUPTED; run {@link ForestValidation} over the result to audit it.
     */
    public static InMemoryLinkGraph restore(Map<NodeId, NodeId> edges, int maxDepth, Metrics metrics) {
        InMemoryLinkGraph graph = new InMemoryLinkGraph(maxDepth, metrics);
        edges.forEach(graph::put);
        log.info("Restored {} edge(s) with depth bound {}", edges.size(), maxDepth);
        return graph;
    }

    @Override
    public Optional<NodeId> getTarget(NodeId node) {
        return Optional.ofNullable(targets.get(Objects.requireNonNull(node)));
    }

    @Override
    public NodeId findRoot(NodeId node) {
        Objects.requireNonNull(node);
        NodeId current = node;
        int hops = 0;
        NodeId next;
        while ((next = targets.get(current)) != null) {
            if (++hops > maxDepth) throw corrupted(node);
            current = next;
        }
        metrics.histogram("composable.findRoot.depth", hops);
        return current;
    }

    @Override
    public int depthOf(NodeId node) {
        Objects.requireNonNull(node);
        NodeId current = node;
        int hops = 0;
        while ((current = targets.get(current)) != null) {
            if (++hops > maxDepth) throw corrupted(node);
        }
        return hops;
    }

    @Override
    public Set<NodeId> getChildren(NodeId node) {
        Set<NodeId> kids = children.get(Objects.requireNonNull(node));
        return kids == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(kids));
    }

    @Override
    public List<NodeId> getSubtree(NodeId node) {
        List<NodeId> out = new ArrayList<>();
        Deque<NodeId> queue = new ArrayDeque<>(getChildren(node));
        while (!queue.isEmpty()) {
            NodeId n = queue.removeFirst();
            out.add(n);
            queue.addAll(getChildren(n));
        }
        return out;
    }

    @Override
    public void link(NodeId source, NodeId target) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
        if (source.equals(target))
            throw new CompositionException(ErrorKind.SELF_LINK, source + " cannot target itself", source);
        NodeId existing = targets.get(source);
        if (existing != null)
            throw new CompositionException(ErrorKind.ALREADY_LINKED,
                    source + " already targets " + existing + "; use updateTarget", source, existing);
        checkNoCycle(source, target);
        checkDepth(source, target);
        put(source, target);
        log.debug("Edge {} -> {} created", source, target);
    }

    @Override
    public NodeId updateTarget(NodeId source, NodeId newTarget) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(newTarget);
        NodeId old = targets.get(source);
        if (old == null)
            throw new CompositionException(ErrorKind.NOT_LINKED, source + " has no target; use link", source);
        if (source.equals(newTarget))
            throw new CompositionException(ErrorKind.SELF_LINK, source + " cannot target itself", source);
        checkNoCycle(source, newTarget);
        checkDepth(source, newTarget);
        remove(source, old);
        put(source, newTarget);
        log.debug("Edge {} -> {} replaced by {} -> {}", source, old, source, newTarget);
        return old;
    }

    @Override
    public NodeId unlink(NodeId source) {
        Objects.requireNonNull(source);
        NodeId old = targets.get(source);
        if (old == null)
            throw new CompositionException(ErrorKind.NOT_LINKED, source + " has no target", source);
        remove(source, old);
        log.debug("Edge {} -> {} removed", source, old);
        return old;
    }

    @Override
    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public Map<NodeId, NodeId> edges() {
        return Map.copyOf(targets);
    }

    @Override
    public Map<NodeId, Set<NodeId>> reverseIndex() {
        Map<NodeId, Set<NodeId>> copy = new HashMap<>();
        children.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    // Walks root-ward from the prospective target. Reaching source means source is an
    // ancestor of target, so source -> target would close a loop. The walk passes through
    // source's current edge only after reaching source, so updateTarget needs no special case.
    private void checkNoCycle(NodeId source, NodeId target) {
        NodeId current = target;
        int hops = 0;
        while (current != null) {
            if (current.equals(source))
                throw new CompositionException(ErrorKind.CYCLE_DETECTED,
                        "linking " + source + " to " + target + " would create a cycle", source, target);
            if (++hops > maxDepth + 1) throw corrupted(target);
            current = targets.get(current);
        }
    }

    // The deepest node under source ends up depthOf(target) + 1 + height(source) hops from its root.
    private void checkDepth(NodeId source, NodeId target) {
        int depth = depthOf(target) + 1 + height(source);
        if (depth > maxDepth)
            throw new CompositionException(ErrorKind.DEPTH_EXCEEDED,
                    "linking " + source + " to " + target + " would put nodes " + depth
                            + " hops from their root; the bound is " + maxDepth, source, target);
    }

    // Levels below node, walked through the children index. Only called once cycles are ruled out.
    private int height(NodeId node) {
        int levels = 0;
        List<NodeId> level = List.of(node);
        while (true) {
            List<NodeId> next = new ArrayList<>();
            for (NodeId n : level) {
                Set<NodeId> kids = children.get(n);
                if (kids != null) next.addAll(kids);
            }
            if (next.isEmpty()) return levels;
            if (++levels > maxDepth) throw corrupted(node);
            level = next;
        }
    }

    private void put(NodeId source, NodeId target) {
        targets.put(source, target);
        children.computeIfAbsent(target, k -> new HashSet<>()).add(source);
    }

    private void remove(NodeId source, NodeId target) {
        targets.remove(source);
        Set<NodeId> kids = children.get(target);
        if (kids != null) {
            kids.remove(source);
            if (kids.isEmpty()) children.remove(target);
        }
    }

    private CompositionException corrupted(NodeId start) {
        List<NodeId> chain = new ArrayList<>();
        NodeId current = start;
        for (int i = 0; i <= maxDepth && current != null; i++) {
            chain.add(current);
            current = targets.get(current);
        }
        log.error("Root resolution from {} exceeded {} hops; graph invariant broken", start, maxDepth);
        return new CompositionException(ErrorKind.GRAPH_CORRUPTED,
                "root of " + start + " not reached within " + maxDepth + " hops", chain, null);
    }
}
