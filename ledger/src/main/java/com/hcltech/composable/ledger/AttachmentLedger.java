package com.hcltech.composable.ledger;

import com.hcltech.composable.graph.NodeId;

import java.math.BigInteger;
import java.util.Map;

/**
 * Per-node balances of fungible resources. Balances are never negative and an absent entry
 * reads as zero. The ledger only books; custody is moved by the caller.
 */
public interface AttachmentLedger {

    /**
     * Adds to the balance of (resource, owner).
     *
     * @throws com.hcltech.composable.graph.CompositionException INVALID_AMOUNT if amount is not positive
     */
    void deposit(ResourceKey resource, NodeId owner, BigInteger amount);

    /**
     * Zeroes the balance of (resource, owner) and returns what it was.
     *
     * @throws com.hcltech.composable.graph.CompositionException NOT_FOUND if the balance is already zero
     */
    BigInteger withdrawAll(ResourceKey resource, NodeId owner);

    /**
     * Removes part of a balance and returns what is left.
     *
     * @throws com.hcltech.composable.graph.CompositionException NOT_FOUND if the balance is zero,
     *                                                            INVALID_AMOUNT if amount is not positive or exceeds it
     */
    BigInteger withdraw(ResourceKey resource, NodeId owner, BigInteger amount);

    BigInteger balanceOf(ResourceKey resource, NodeId owner);

    /** Sum over every owner node. */
    BigInteger totalOf(ResourceKey resource);

    /** Non-zero balances held by one node. */
    Map<ResourceKey, BigInteger> attachmentsOf(NodeId owner);

    /** Every non-zero balance. */
    Map<AttachmentKey, BigInteger> snapshot();
}
