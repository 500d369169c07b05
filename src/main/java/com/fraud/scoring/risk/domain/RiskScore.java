package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Combined 0-100 risk score for one transaction.
 */
@Value
@Builder
public class RiskScore {

    int total;
    RiskLevel category;
    ScoreBreakdown breakdown;
    Set<BusinessRuleFlag> businessFlags;
    /** Amount deviation was too extreme to trust the model; score was driven by anomalies. */
    boolean extremeDeviationOverride;
    /** Model contribution was discounted for a large (but not extreme) deviation. */
    boolean modelDiscounted;
    /** No model answered; the score is anomaly and rule driven only. */
    boolean modelUnavailable;
}
