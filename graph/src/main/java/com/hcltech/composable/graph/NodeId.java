package com.hcltech.composable.graph;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a participant in the composability graph: a collection address plus the
 * per-collection token id. Two ids are the same node iff both parts are equal; collection
 * addresses are compared case-insensitively (they are stored lower case).
 */
public record NodeId(String collection, BigInteger tokenId) implements Comparable<NodeId> {

    private static final Comparator<NodeId> ORDER =
            Comparator.comparing(NodeId::collection).thenComparing(NodeId::tokenId);

    public NodeId {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(tokenId, "tokenId");
        if (collection.isBlank()) throw new IllegalArgumentException("collection must not be blank");
        if (tokenId.signum() < 0) throw new IllegalArgumentException("tokenId must not be negative: " + tokenId);
        collection = collection.trim().toLowerCase(Locale.ROOT);
    }

    public static NodeId of(String collection, long tokenId) {
        return new NodeId(collection, BigInteger.valueOf(tokenId));
    }

    @Override
    public int compareTo(NodeId o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return collection + "#" + tokenId;
    }
}
