package com.hcltech.composable.protocol;

/** The three families of mutating operations, one per kind of thing being composed. */
public enum Family {
    NON_FUNGIBLE("nonFungible"),
    FUNGIBLE("fungible"),
    COUNTED_ASSET("countedAsset");

    private final String metricName;

    Family(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
