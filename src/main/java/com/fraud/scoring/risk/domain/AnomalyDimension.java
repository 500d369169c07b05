package com.fraud.scoring.risk.domain;

/**
 * Dimension an anomaly finding belongs to. DIGIT_PATTERN is auxiliary: it is reported and
 * scored but never counts toward the overall band.
 */
public enum AnomalyDimension {
    AMOUNT(true),
    TIME(true),
    LOCATION(true),
    DIGIT_PATTERN(false);

    private final boolean primary;

    AnomalyDimension(boolean primary) {
        this.primary = primary;
    }

    public boolean isPrimary() {
        return primary;
    }
}
