package com.fraud.scoring.risk.anomaly;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.risk.domain.AnomalyDimension;
import com.fraud.scoring.risk.domain.AnomalyFinding;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import com.fraud.scoring.risk.domain.RiskLevel;
import com.fraud.scoring.risk.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Locale;
import java.util.Set;

/**
 * Statistical checks that run next to the models: amount deviation, time of day, distance and
 * leading-digit pattern. No model call, no state; thresholds come from {@code fraud.anomaly.*}.
 */
@Slf4j
@Component
public class AnomalyDetector {

    private final FraudScoringProperties.Anomaly config;

    public AnomalyDetector(FraudScoringProperties properties) {
        this.config = properties.getAnomaly();
    }

    public AnomalyReport detect(EngineeredFeatures features) {
        return detect(features, Collections.emptySet());
    }

    /**
     * @param usualHours hours the customer normally transacts in; empty or null when unknown
     */
    public AnomalyReport detect(EngineeredFeatures features, Set<Integer> usualHours) {
        AnomalyFinding amount = amountFinding(features.getAmtZScore());
        AnomalyFinding time = timeFinding(features, usualHours);
        AnomalyFinding location = locationFinding(features.getDistanceKm());
        AnomalyFinding digits = digitFinding(features);

        AnomalyReport.AnomalyReportBuilder report = AnomalyReport.builder()
                .finding(AnomalyDimension.AMOUNT, amount)
                .finding(AnomalyDimension.TIME, time)
                .finding(AnomalyDimension.LOCATION, location)
                .finding(AnomalyDimension.DIGIT_PATTERN, digits)
                .amountZScore(features.getAmtZScore())
                .distanceKm(features.getDistanceKm());

        int triggered = 0;
        int primaryTriggered = 0;
        boolean primaryHigh = false;
        for (AnomalyFinding finding : new AnomalyFinding[]{amount, time, location, digits}) {
            if (!finding.isAnomaly()) continue;
            triggered++;
            if (finding.getDimension().isPrimary()) {
                primaryTriggered++;
                primaryHigh |= finding.getSeverity() == Severity.HIGH;
            }
        }
        RiskLevel band = band(primaryTriggered, primaryHigh);

        log.debug("Anomaly check: z={}, hour={}, distanceKm={}, triggered={}, band={}",
                features.getAmtZScore(), features.getHour(), features.getDistanceKm(), triggered, band);
        return report.triggeredCount(triggered).overallRisk(band).build();
    }

    private AnomalyFinding amountFinding(double zScore) {
        double magnitude = Math.abs(zScore);
        if (!Double.isFinite(zScore) || magnitude <= config.getZScoreThreshold()) {
            return AnomalyFinding.clear(AnomalyDimension.AMOUNT,
                    String.format(Locale.ROOT, "Amount within normal range (z-score %.2f)", zScore));
        }
        Severity severity = magnitude > config.getZScoreHighThreshold() ? Severity.HIGH : Severity.MEDIUM;
        String direction = zScore > 0 ? "above" : "below";
        return AnomalyFinding.builder()
                .dimension(AnomalyDimension.AMOUNT)
                .anomaly(true)
                .severity(severity)
                .explanation(String.format(Locale.ROOT, "Amount is %.1f standard deviations %s customer average", magnitude, direction))
                .build();
    }

    private AnomalyFinding timeFinding(EngineeredFeatures features, Set<Integer> usualHours) {
        int hour = features.getHour();
        boolean night = features.isNight();
        boolean unusual = usualHours != null && !usualHours.isEmpty() && !usualHours.contains(hour);
        if (!night && !unusual) {
            return AnomalyFinding.clear(AnomalyDimension.TIME,
                    String.format(Locale.ROOT, "Transaction at %02d:00 is within normal hours", hour));
        }

        Severity severity;
        String explanation;
        if (night && unusual) {
            severity = Severity.HIGH;
            explanation = String.format(Locale.ROOT, "Night transaction at %02d:00, outside the customer's usual hours", hour);
        } else if (unusual) {
            severity = Severity.MEDIUM;
            explanation = String.format(Locale.ROOT, "Transaction at %02d:00 is outside the customer's usual hours", hour);
        } else if (features.isFraudPeakHour()) {
            severity = Severity.MEDIUM;
            explanation = String.format(Locale.ROOT, "Night transaction at %02d:00, a peak fraud hour", hour);
        } else {
            severity = Severity.LOW;
            explanation = String.format(Locale.ROOT, "Night transaction at %02d:00", hour);
        }
        return AnomalyFinding.builder()
                .dimension(AnomalyDimension.TIME)
                .anomaly(true)
                .severity(severity)
                .explanation(explanation)
                .build();
    }

    private AnomalyFinding locationFinding(double distanceKm) {
        if (!Double.isFinite(distanceKm) || distanceKm <= config.getDistanceThresholdKm()) {
            return AnomalyFinding.clear(AnomalyDimension.LOCATION,
                    String.format(Locale.ROOT, "Transaction %.1f km from home", distanceKm));
        }
        Severity severity = distanceKm > config.getDistanceHighThresholdKm() ? Severity.HIGH : Severity.MEDIUM;
        return AnomalyFinding.builder()
                .dimension(AnomalyDimension.LOCATION)
                .anomaly(true)
                .severity(severity)
                .explanation(String.format(Locale.ROOT, "Transaction %.0f km from home location", distanceKm))
                .build();
    }

    private AnomalyFinding digitFinding(EngineeredFeatures features) {
        if (features.getBenfordExpected() >= config.getBenfordMinExpected()) {
            return AnomalyFinding.clear(AnomalyDimension.DIGIT_PATTERN,
                    "Leading digit " + features.getFirstDigit() + " follows Benford's law");
        }
        return AnomalyFinding.builder()
                .dimension(AnomalyDimension.DIGIT_PATTERN)
                .anomaly(true)
                .severity(Severity.LOW)
                .explanation(String.format(Locale.ROOT, "Leading digit %d is rare under Benford's law (expected %.1f%%)",
                        features.getFirstDigit(), features.getBenfordExpected() * 100))
                .build();
    }

    static RiskLevel band(int primaryTriggered, boolean anyPrimaryHigh) {
        if (primaryTriggered >= 3) return RiskLevel.CRITICAL;
        if (primaryTriggered == 2 || anyPrimaryHigh) return RiskLevel.HIGH;
        if (primaryTriggered == 1) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
