package com.hcltech.composable.graph;

import java.util.List;
import java.util.Objects;

/**
 * Raised when a graph, ledger or protocol operation is refused. The operation that raised
 * it has left no partial state behind.
 */
public class CompositionException extends RuntimeException {
    private final ErrorKind kind;
    private final List<NodeId> nodes;

    public CompositionException(ErrorKind kind, String message, List<NodeId> nodes, Throwable cause) {
        super(kind + ": " + message, cause);
        this.kind = Objects.requireNonNull(kind);
        this.nodes = List.copyOf(nodes);
    }

    public CompositionException(ErrorKind kind, String message, NodeId... nodes) {
        this(kind, message, List.of(nodes), null);
    }

    public ErrorKind kind() {
        return kind;
    }

    /** The nodes the failure is about; for GRAPH_CORRUPTED the chain that was walked. */
    public List<NodeId> nodes() {
        return nodes;
    }
}
