package com.hcltech.composable.protocol.collaborator;

import com.hcltech.composable.graph.NodeId;

import java.util.Optional;

/** The contract(s) that mint and move the node-bearing tokens. */
public interface NonFungibleAssets {

    /**
     * Current holder of the node, or empty if it does not exist. Implementations may also
     * throw for ids they do not recognise; callers treat that as non-existence.
     */
    Optional<String> ownerOf(NodeId node);

    /** Moves custody of the node. Throws if the transfer is refused. */
    void transfer(String from, String to, NodeId node, byte[] data);
}
