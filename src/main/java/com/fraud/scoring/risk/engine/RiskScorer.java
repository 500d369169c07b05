package com.fraud.scoring.risk.engine;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.risk.domain.AnomalyFinding;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.RiskLevel;
import com.fraud.scoring.risk.domain.RiskScore;
import com.fraud.scoring.risk.domain.ScoreBreakdown;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Combines the ensemble probability, anomaly findings and business rules into a 0-100 score.
 * Weighting: model up to 50, anomalies up to 40, business rules up to 10.
 * <p>
 * An amount far outside the customer's history overrides the model: beyond
 * {@code modelDiscountZScore} the model counts half, beyond {@code extremeDeviationZScore} it is
 * ignored and the score is pinned near the top.
 */
@Slf4j
@Service
public class RiskScorer {

    private final FraudScoringProperties.Scoring config;

    public RiskScorer(FraudScoringProperties properties) {
        this.config = properties.getScoring();
    }

    /**
     * @param prediction null when no model answered
     */
    public RiskScore score(EnsemblePrediction prediction, AnomalyReport report, Set<BusinessRuleFlag> businessFlags) {
        boolean modelUnavailable = prediction == null;
        double probability = modelUnavailable ? 0.0 : prediction.getFraudProbability();
        double model = clamp(probability * config.getModelMaxPoints(), 0.0, config.getModelMaxPoints());

        double deviation = Math.abs(report.getAmountZScore());
        boolean override = deviation > config.getExtremeDeviationZScore();
        boolean discounted = false;
        if (override) {
            model = 0.0;
        } else if (deviation > config.getModelDiscountZScore() && !modelUnavailable) {
            model *= config.getModelDiscountFactor();
            discounted = true;
        }

        double anomaly = 0.0;
        for (AnomalyFinding finding : report.triggered()) {
            anomaly += severityPoints(finding);
        }
        anomaly = Math.min(anomaly, config.getAnomalyCap());

        double business = businessFlags.isEmpty() ? 0.0 : config.getBusinessRuleBonus();

        double components = model + anomaly + business;
        int total = (int) clamp(Math.floor(components), 0, 100);
        double uplift = 0.0;
        if (override) {
            total = Math.max(total, config.getExtremeDeviationScore());
            uplift = Math.max(0.0, total - components);
            log.warn("Extreme amount deviation (|z|={}), model bypassed, score forced to {}", deviation, total);
        }

        RiskScore score = RiskScore.builder()
                .total(total)
                .category(category(total))
                .breakdown(ScoreBreakdown.builder()
                        .modelContribution(model)
                        .anomalyContribution(anomaly)
                        .businessRuleContribution(business)
                        .overrideContribution(uplift)
                        .build())
                .businessFlags(businessFlags)
                .extremeDeviationOverride(override)
                .modelDiscounted(discounted)
                .modelUnavailable(modelUnavailable)
                .build();
        log.debug("Risk score {} ({}): model={}, anomaly={}, business={}, override={}, flags={}",
                total, score.getCategory(), model, anomaly, business, uplift, businessFlags);
        return score;
    }

    /**
     * The one mapping from a 0-100 score to its category.
     */
    public RiskLevel category(int score) {
        if (score <= config.getLowMax()) return RiskLevel.LOW;
        if (score <= config.getMediumMax()) return RiskLevel.MEDIUM;
        if (score <= config.getHighMax()) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }

    private double severityPoints(AnomalyFinding finding) {
        switch (finding.getSeverity()) {
            case HIGH:
                return config.getHighSeverityPoints();
            case MEDIUM:
                return config.getMediumSeverityPoints();
            case LOW:
                return config.getLowSeverityPoints();
            default:
                return 0.0;
        }
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
