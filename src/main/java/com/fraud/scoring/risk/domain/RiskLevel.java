package com.fraud.scoring.risk.domain;

/**
 * Ordered risk band. Used for the anomaly report's overall band, the risk score category and
 * the alert level, so the three always speak the same scale.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
