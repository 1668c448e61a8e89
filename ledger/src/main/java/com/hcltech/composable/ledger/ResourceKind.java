package com.hcltech.composable.ledger;

public enum ResourceKind {
    /** A currency-like fungible resource, keyed by its contract. */
    CURRENCY,
    /** Counted units of one asset id inside a multi-asset contract. */
    COUNTED_ASSET
}
