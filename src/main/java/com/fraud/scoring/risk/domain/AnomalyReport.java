package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Statistical anomaly findings for one transaction, independent of the trained models.
 */
@Value
@Builder
public class AnomalyReport {

    @Singular
    Map<AnomalyDimension, AnomalyFinding> findings;
    RiskLevel overallRisk;
    /** Findings that fired, auxiliary ones included. */
    int triggeredCount;
    /** Amount z-score the report was computed from. */
    double amountZScore;
    double distanceKm;

    public Optional<AnomalyFinding> finding(AnomalyDimension dimension) {
        return Optional.ofNullable(findings.get(dimension));
    }

    public List<AnomalyFinding> triggered() {
        return findings.values().stream().filter(AnomalyFinding::isAnomaly).collect(Collectors.toList());
    }

    public boolean hasSeverity(Severity severity) {
        return findings.values().stream()
                .anyMatch(f -> f.isAnomaly() && f.getSeverity() == severity);
    }

    /** Triggered findings at MEDIUM or HIGH. */
    public long elevatedCount() {
        return findings.values().stream()
                .filter(f -> f.isAnomaly() && f.getSeverity().isElevated())
                .count();
    }
}
