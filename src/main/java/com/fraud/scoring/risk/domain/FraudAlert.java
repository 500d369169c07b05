package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Alert emitted when a transaction is blocked or sent to manual review.
 * Consumed by the orchestration layer for dashboards and investigator queues.
 */
@Value
@Builder
public class FraudAlert {

    String alertId;
    Instant timestamp;
    RiskLevel level;
    String transactionId;
    DecisionAction action;
    /** 0-100. */
    int riskScore;
    /** Null when no model answered. */
    Double fraudProbability;
    BigDecimal amount;
    String message;
    List<String> recommendedActions;
    List<String> keyFactors;
}
