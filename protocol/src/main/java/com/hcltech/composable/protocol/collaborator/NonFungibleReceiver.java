package com.hcltech.composable.protocol.collaborator;

import com.hcltech.composable.graph.NodeId;

/**
 * Implemented by custody holders. A non-fungible collaborator delivering a node to a
 * receiver must reject the transfer unless the callback answers {@link #MAGIC}.
 */
public interface NonFungibleReceiver {
    int MAGIC = 0x150b7a02;

    int onNonFungibleReceived(String operator, String from, NodeId node, byte[] data);
}
