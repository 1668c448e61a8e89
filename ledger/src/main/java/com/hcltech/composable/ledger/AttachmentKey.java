package com.hcltech.composable.ledger;

import com.hcltech.composable.graph.NodeId;

import java.util.Objects;

/** One row of the attachments table: a resource held by a node. */
public record AttachmentKey(ResourceKey resource, NodeId owner) {
    public AttachmentKey {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(owner, "owner");
    }
}
