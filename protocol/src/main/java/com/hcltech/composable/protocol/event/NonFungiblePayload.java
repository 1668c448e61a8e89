package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.protocol.Family;

import java.util.Objects;

public record NonFungiblePayload(NodeId node) implements Payload {
    public NonFungiblePayload {
        Objects.requireNonNull(node, "node");
    }

    @Override
    public Family family() {
        return Family.NON_FUNGIBLE;
    }
}
