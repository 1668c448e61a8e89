package com.hcltech.composable.protocol;

public enum Operation {
    LINK("link"),
    UPDATE_TARGET("updateTarget"),
    UNLINK("unlink");

    private final String metricName;

    Operation(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }
}
