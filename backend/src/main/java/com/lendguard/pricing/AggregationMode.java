package com.lendguard.pricing;

/**
 * Oracle aggregation modes, with the felt value the oracle contract expects in calldata.
 */
public enum AggregationMode {
    MEDIAN(0),
    MEAN(1);

    private final int code;

    AggregationMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
