package com.hcltech.composable.protocol.config;

/** What a non-fungible link/unlink does with custody of the source node. */
public enum CustodyPolicy {
    /** Custody never moves; the graph only records composition. */
    NONE,
    /** Linked nodes are held by the custody address and released to the unlink recipient. */
    ESCROW
}
