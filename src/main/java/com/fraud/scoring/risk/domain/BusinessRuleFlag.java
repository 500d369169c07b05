package com.fraud.scoring.risk.domain;

/**
 * Business conditions that add the fixed business-rule bonus to the risk score.
 */
public enum BusinessRuleFlag {
    /** Amount at or above the configured absolute limit. */
    LARGE_AMOUNT,
    HIGH_RISK_CATEGORY,
    /** No usable history, or a single prior transaction. */
    NEW_CUSTOMER,
    /** Too many transactions in the last hour or day. */
    HIGH_VELOCITY,
    /** Two or more anomalies at medium or high severity. */
    MULTIPLE_ELEVATED_ANOMALIES
}
