package com.fraud.scoring.api;

import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.Decision;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.FraudAlert;
import com.fraud.scoring.risk.domain.RiskScore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything returned to the caller for one transaction: the decision plus the intermediate
 * results it was derived from, for audit by the orchestration layer.
 * Only {@code decision} is guaranteed non-null; the others are absent when the pipeline failed
 * before producing them.
 */
@Value
@Builder
public class FraudAnalysisResult {

    String transactionId;
    Instant analyzedAt;
    Decision decision;
    RiskScore riskScore;
    AnomalyReport anomalyReport;
    /** Null when no model answered. */
    EnsemblePrediction ensemblePrediction;
    /** Null for approved transactions. */
    FraudAlert alert;
}
