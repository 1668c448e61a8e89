package com.hcltech.composable.ledger;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Which fungible resource an attachment holds. Currencies are identified by contract alone;
 * counted assets by contract plus asset id.
 */
public record ResourceKey(ResourceKind kind, String contract, BigInteger assetId) implements Comparable<ResourceKey> {

    private static final Comparator<ResourceKey> ORDER = Comparator.comparing(ResourceKey::kind)
            .thenComparing(ResourceKey::contract)
            .thenComparing(ResourceKey::assetId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public ResourceKey {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(contract, "contract");
        if (contract.isBlank()) throw new IllegalArgumentException("contract must not be blank");
        contract = contract.trim().toLowerCase(Locale.ROOT);
        if (kind == ResourceKind.CURRENCY && assetId != null)
            throw new IllegalArgumentException("currency " + contract + " has no asset id");
        if (kind == ResourceKind.COUNTED_ASSET && (assetId == null || assetId.signum() < 0))
            throw new IllegalArgumentException("counted asset in " + contract + " needs a non-negative asset id");
    }

    public static ResourceKey currency(String contract) {
        return new ResourceKey(ResourceKind.CURRENCY, contract, null);
    }

    public static ResourceKey countedAsset(String contract, BigInteger assetId) {
        return new ResourceKey(ResourceKind.COUNTED_ASSET, contract, assetId);
    }

    public static ResourceKey countedAsset(String contract, long assetId) {
        return countedAsset(contract, BigInteger.valueOf(assetId));
    }

    @Override
    public int compareTo(ResourceKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return kind == ResourceKind.CURRENCY ? contract : contract + "/" + assetId;
    }
}
