package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one anomaly check.
 */
@Value
@Builder
public class AnomalyFinding {

    AnomalyDimension dimension;
    boolean anomaly;
    Severity severity;
    String explanation;

    public static AnomalyFinding clear(AnomalyDimension dimension, String explanation) {
        return AnomalyFinding.builder()
                .dimension(dimension)
                .anomaly(false)
                .severity(Severity.NONE)
                .explanation(explanation)
                .build();
    }
}
