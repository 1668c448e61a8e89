package com.hcltech.composable.protocol.event;

import com.hcltech.composable.graph.NodeId;
import com.hcltech.composable.ledger.ResourceKey;
import com.hcltech.composable.protocol.Family;

import java.math.BigInteger;
import java.util.Objects;

public record CountedAssetPayload(String contract, BigInteger assetId, BigInteger amount, NodeId owner)
        implements LeafPayload {
    public CountedAssetPayload {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(assetId, "assetId");
    }

    public static CountedAssetPayload deposit(String contract, BigInteger assetId, BigInteger amount) {
        return new CountedAssetPayload(contract, assetId, amount, null);
    }

    public static CountedAssetPayload attachedTo(String contract, BigInteger assetId, NodeId owner) {
        return new CountedAssetPayload(contract, assetId, null, owner);
    }

    @Override
    public Family family() {
        return Family.COUNTED_ASSET;
    }

    @Override
    public ResourceKey resource() {
        return ResourceKey.countedAsset(contract, assetId);
    }

    @Override
    public CountedAssetPayload settled(BigInteger amount, NodeId owner) {
        return new CountedAssetPayload(contract, assetId, amount, owner);
    }
}
