package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.ledger.ResourceKey;

import java.math.BigInteger;

/**
 * An amount of a fungible resource.
 * <p>
 * For link the owner is absent and the amount is what the actor deposits. For updateTarget
 * and unlink the owner is the node currently holding the attachment, and an absent amount
 * means the whole balance.
 */
public interface LeafPayload extends Payload {

    ResourceKey resource();

    /** Nullable. */
    BigInteger amount();

    /** Nullable. */
    NodeId owner();

    /** The same resource with the amount and owner actually moved. */
    LeafPayload settled(BigInteger amount, NodeId owner);
}
