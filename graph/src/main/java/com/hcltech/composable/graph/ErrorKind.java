package com.hcltech.composable.graph;

/** Every way a composition operation can be refused. */
public enum ErrorKind {
    /** The referenced node, edge or attachment does not exist. */
    NOT_FOUND,
    /** link called on a source that already has a target; use updateTarget. */
    ALREADY_LINKED,
    /** updateTarget or unlink called on a source with no target. */
    NOT_LINKED,
    SELF_LINK,
    CYCLE_DETECTED,
    /** The edge would leave some node further from its root than the depth bound allows. */
    DEPTH_EXCEEDED,
    /** Non-positive amount, or more than the recorded balance. */
    INVALID_AMOUNT,
    UNAUTHORIZED,
    CUSTODY_TRANSFER_FAILED,
    /**
     * Root resolution exceeded its bound. Signals a broken invariant, never a bad input,
     * so it is never retried.
     */
    GRAPH_CORRUPTED
}
