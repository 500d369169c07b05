package com.fraud.scoring.risk.engine;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.risk.domain.AnomalyFinding;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.Decision;
import com.fraud.scoring.risk.domain.DecisionAction;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.RiskScore;
import com.fraud.scoring.risk.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a risk score to APPROVE, BLOCK or MANUAL_REVIEW. Deterministic: the same inputs always
 * give an equal decision. Never throws; an internal error yields a zero-confidence review.
 */
@Slf4j
@Service
public class DecisionPolicy {

    static final Map<DecisionAction, List<String>> RECOMMENDED_ACTIONS = Map.of(
            DecisionAction.BLOCK, List.of(
                    "Block transaction immediately",
                    "Send SMS verification to customer",
                    "Alert fraud investigation team",
                    "Freeze card temporarily"),
            DecisionAction.MANUAL_REVIEW, List.of(
                    "Queue for manual review",
                    "Contact customer via App",
                    "Flag in fraud dashboard"),
            DecisionAction.APPROVE, List.of(
                    "Approve transaction",
                    "Log for later review"));

    private final FraudScoringProperties.Decision config;

    public DecisionPolicy(FraudScoringProperties properties) {
        this.config = properties.getDecision();
    }

    /**
     * @param prediction null when no model answered
     */
    public Decision decide(RiskScore score, AnomalyReport report, EnsemblePrediction prediction) {
        try {
            return evaluate(score, report, prediction);
        } catch (RuntimeException e) {
            log.error("Decision policy failed, routing to manual review", e);
            return systemError(e);
        }
    }

    /**
     * Zero-confidence review naming the failure class. Used for any failure between feature
     * engineering and the final decision.
     */
    public Decision systemError(Throwable failure) {
        return Decision.builder()
                .action(DecisionAction.MANUAL_REVIEW)
                .confidence(0)
                .reasoning("Automated analysis failed (" + failure.getClass().getSimpleName() + "); manual review required")
                .keyFactors(List.of("System Error: " + failure.getClass().getSimpleName()))
                .recommendedActions(RECOMMENDED_ACTIONS.get(DecisionAction.MANUAL_REVIEW))
                .build();
    }

    private Decision evaluate(RiskScore score, AnomalyReport report, EnsemblePrediction prediction) {
        int total = score.getTotal();
        boolean modelAvailable = prediction != null && !score.isModelUnavailable();

        DecisionAction action;
        String reasoning;
        if (score.isExtremeDeviationOverride()) {
            action = DecisionAction.BLOCK;
            reasoning = String.format(Locale.ROOT, "Amount deviates %.0f standard deviations from the customer's history; "
                    + "blocked regardless of model output", Math.abs(report.getAmountZScore()));
        } else if (total > config.getBlockAbove()) {
            action = DecisionAction.BLOCK;
            reasoning = String.format(Locale.ROOT, "Risk score %d (%s) exceeds the block threshold of %d",
                    total, score.getCategory(), config.getBlockAbove());
        } else if (total < config.getApproveBelow() && !report.hasSeverity(Severity.HIGH) && modelAvailable) {
            action = DecisionAction.APPROVE;
            reasoning = String.format(Locale.ROOT, "Risk score %d (%s) is below the approval threshold of %d with no high-severity anomaly",
                    total, score.getCategory(), config.getApproveBelow());
        } else {
            action = DecisionAction.MANUAL_REVIEW;
            reasoning = reviewReason(total, score, report, modelAvailable);
        }

        int confidence;
        switch (action) {
            case BLOCK:
                confidence = total;
                break;
            case APPROVE:
                confidence = 100 - total;
                break;
            default:
                confidence = config.getReviewConfidence();
        }
        if (!modelAvailable) {
            confidence = confidence / 2;
        }
        confidence = Math.max(0, Math.min(100, confidence));

        Decision decision = Decision.builder()
                .action(action)
                .confidence(confidence)
                .reasoning(reasoning)
                .keyFactors(keyFactors(score, report, prediction))
                .recommendedActions(RECOMMENDED_ACTIONS.get(action))
                .build();
        log.debug("Decision {} (confidence {}) for score {}", action, confidence, total);
        return decision;
    }

    private String reviewReason(int total, RiskScore score, AnomalyReport report, boolean modelAvailable) {
        if (!modelAvailable) {
            return String.format(Locale.ROOT, "No model prediction available; risk score %d (%s) from anomalies and rules needs review",
                    total, score.getCategory());
        }
        if (total < config.getApproveBelow() && report.hasSeverity(Severity.HIGH)) {
            return String.format(Locale.ROOT, "Risk score %d is low but a high-severity anomaly was detected", total);
        }
        return String.format(Locale.ROOT, "Risk score %d (%s) is between %d and %d",
                total, score.getCategory(), config.getApproveBelow(), config.getBlockAbove());
    }

    private List<String> keyFactors(RiskScore score, AnomalyReport report, EnsemblePrediction prediction) {
        List<String> factors = new ArrayList<>();
        if (score.isExtremeDeviationOverride()) {
            factors.add(String.format(Locale.ROOT, "Extreme amount deviation (z-score %.1f)", report.getAmountZScore()));
        }
        if (prediction != null) {
            factors.add(String.format(Locale.ROOT, "Model fraud probability %.1f%% (%s)",
                    prediction.getFraudProbability() * 100, prediction.getConsensus()));
            if (prediction.hasPartialFailure()) {
                factors.add("Partial model failure: " + prediction.getPartialFailure().describe());
            }
        } else {
            factors.add("Model unavailable; scored on anomalies and business rules only");
        }
        if (score.isModelDiscounted()) {
            factors.add("Model contribution discounted for large amount deviation");
        }
        for (AnomalyFinding finding : report.triggered()) {
            factors.add(finding.getDimension() + " anomaly (" + finding.getSeverity() + "): " + finding.getExplanation());
        }
        for (BusinessRuleFlag flag : score.getBusinessFlags()) {
            factors.add("Business rule: " + flag);
        }
        return List.copyOf(factors);
    }
}
