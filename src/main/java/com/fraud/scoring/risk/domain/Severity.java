package com.fraud.scoring.risk.domain;

/**
 * Severity of a single anomaly finding.
 */
public enum Severity {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    /** MEDIUM or HIGH. */
    public boolean isElevated() {
        return this == MEDIUM || this == HIGH;
    }
}
