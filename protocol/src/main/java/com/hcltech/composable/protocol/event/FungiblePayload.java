package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.ledger.ResourceKey;
import com.hcltech.composable.protocol.Family;

import java.math.BigInteger;
import java.util.Objects;

public record FungiblePayload(String currency, BigInteger amount, NodeId owner) implements LeafPayload {
    public FungiblePayload {
        Objects.requireNonNull(currency, "currency");
    }

    public static FungiblePayload deposit(String currency, BigInteger amount) {
        return new FungiblePayload(currency, amount, null);
    }

    public static FungiblePayload attachedTo(String currency, NodeId owner) {
        return new FungiblePayload(currency, null, owner);
    }

    @Override
    public Family family() {
        return Family.FUNGIBLE;
    }

    @Override
    public ResourceKey resource() {
        return ResourceKey.currency(currency);
    }

    @Override
    public FungiblePayload settled(BigInteger amount, NodeId owner) {
        return new FungiblePayload(currency, amount, owner);
    }
}
