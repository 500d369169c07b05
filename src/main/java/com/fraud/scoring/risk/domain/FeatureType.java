package com.fraud.scoring.risk.domain;

/**
 * Semantic type of an engineered feature. The encoder scales NUMERIC and FLAG columns and
 * target-encodes CATEGORICAL ones, so the distinction is part of the model contract.
 */
public enum FeatureType {
    NUMERIC,
    /** Boolean indicator, encoded as 1.0 / 0.0. */
    FLAG,
    CATEGORICAL;

    public boolean isNumeric() {
        return this != CATEGORICAL;
    }
}
