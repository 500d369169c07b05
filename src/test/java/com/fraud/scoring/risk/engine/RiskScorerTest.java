package com.fraud.scoring.risk.engine;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.risk.domain.AnomalyDimension;
import com.fraud.scoring.risk.domain.AnomalyFinding;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.ConsensusLabel;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.RiskLevel;
import com.fraud.scoring.risk.domain.RiskScore;
import com.fraud.scoring.risk.domain.ScoreBreakdown;
import com.fraud.scoring.risk.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RiskScorerTest {

    private RiskScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RiskScorer(new FraudScoringProperties());
    }

    static EnsemblePrediction prediction(double probability) {
        return EnsemblePrediction.builder()
                .modelProbabilities(Map.of("xgboost", probability))
                .fraudProbability(probability)
                .fraud(probability > 0.5)
                .threshold(0.5)
                .consensus(ConsensusLabel.SINGLE_MODEL)
                .spread(0.0)
                .build();
    }

    static AnomalyFinding fired(AnomalyDimension dimension, Severity severity) {
        return AnomalyFinding.builder()
                .dimension(dimension)
                .anomaly(true)
                .severity(severity)
                .explanation(dimension + " " + severity)
                .build();
    }

    static AnomalyReport report(double zScore, AnomalyFinding... fired) {
        AnomalyReport.AnomalyReportBuilder builder = AnomalyReport.builder()
                .amountZScore(zScore)
                .distanceKm(0.0)
                .overallRisk(RiskLevel.LOW)
                .triggeredCount(fired.length);
        for (AnomalyDimension dimension : AnomalyDimension.values()) {
            AnomalyFinding finding = AnomalyFinding.clear(dimension, "clear");
            for (AnomalyFinding f : fired) {
                if (f.getDimension() == dimension) finding = f;
            }
            builder.finding(dimension, finding);
        }
        return builder.build();
    }

    @Test
    void cleanTransactionScoresOnlyModelPoints() {
        RiskScore score = scorer.score(prediction(0.1), report(0.2), Set.of());

        assertThat(score.getTotal()).isEqualTo(5);
        assertThat(score.getCategory()).isEqualTo(RiskLevel.LOW);
        assertThat(score.getBreakdown().getModelContribution()).isEqualTo(5.0);
        assertThat(score.getBreakdown().getAnomalyContribution()).isZero();
        assertThat(score.isModelUnavailable()).isFalse();
    }

    @Test
    void scoreStaysWithinBoundsAndIsMonotonicInProbability() {
        AnomalyReport worst = report(4.0,
                fired(AnomalyDimension.AMOUNT, Severity.HIGH),
                fired(AnomalyDimension.TIME, Severity.HIGH),
                fired(AnomalyDimension.LOCATION, Severity.HIGH),
                fired(AnomalyDimension.DIGIT_PATTERN, Severity.LOW));
        Set<BusinessRuleFlag> allFlags = EnumSet.allOf(BusinessRuleFlag.class);

        int previous = -1;
        for (int i = 0; i <= 100; i++) {
            double p = i / 100.0;
            int total = scorer.score(prediction(p), worst, allFlags).getTotal();
            assertThat(total).isBetween(0, 100).isGreaterThanOrEqualTo(previous);
            previous = total;
        }
        assertThat(previous).isEqualTo(100);
    }

    @Test
    void anomalyPointsAreCappedAtForty() {
        RiskScore score = scorer.score(prediction(0.0), report(6.0,
                fired(AnomalyDimension.AMOUNT, Severity.HIGH),
                fired(AnomalyDimension.TIME, Severity.HIGH),
                fired(AnomalyDimension.LOCATION, Severity.MEDIUM)), Set.of());

        assertThat(score.getBreakdown().getAnomalyContribution()).isEqualTo(40.0);
        assertThat(score.getTotal()).isEqualTo(40);
    }

    @Test
    void severityPointsAddUp() {
        RiskScore score = scorer.score(prediction(0.0), report(0.0,
                fired(AnomalyDimension.TIME, Severity.MEDIUM),
                fired(AnomalyDimension.DIGIT_PATTERN, Severity.LOW)), Set.of());

        assertThat(score.getTotal()).isEqualTo(15);
    }

    @Test
    void businessBonusIsAddedOnceWhateverTheFlagCount() {
        RiskScore one = scorer.score(prediction(0.0), report(0.0), Set.of(BusinessRuleFlag.NEW_CUSTOMER));
        RiskScore all = scorer.score(prediction(0.0), report(0.0), EnumSet.allOf(BusinessRuleFlag.class));

        assertThat(one.getBreakdown().getBusinessRuleContribution()).isEqualTo(10.0);
        assertThat(all.getBreakdown().getBusinessRuleContribution()).isEqualTo(10.0);
        assertThat(all.getBusinessFlags()).hasSize(BusinessRuleFlag.values().length);
    }

    @Test
    void totalIsFloored() {
        assertThat(scorer.score(prediction(0.599), report(0.0), Set.of()).getTotal()).isEqualTo(29);
    }

    @Test
    void largeDeviationHalvesModelContribution() {
        RiskScore score = scorer.score(prediction(0.8), report(150.0, fired(AnomalyDimension.AMOUNT, Severity.HIGH)), Set.of());

        assertThat(score.isModelDiscounted()).isTrue();
        assertThat(score.isExtremeDeviationOverride()).isFalse();
        assertThat(score.getBreakdown().getModelContribution()).isEqualTo(20.0);
        assertThat(score.getTotal()).isEqualTo(40);
    }

    @Test
    void extremeDeviationOverridesModel() {
        RiskScore score = scorer.score(prediction(0.01), report(-2500.0, fired(AnomalyDimension.AMOUNT, Severity.HIGH)), Set.of());

        assertThat(score.isExtremeDeviationOverride()).isTrue();
        assertThat(score.getBreakdown().getModelContribution()).isZero();
        assertThat(score.getTotal()).isGreaterThanOrEqualTo(99);
        assertThat(score.getCategory()).isEqualTo(RiskLevel.CRITICAL);
        ScoreBreakdown breakdown = score.getBreakdown();
        assertThat(breakdown.getOverrideContribution()).isEqualTo(79.0);
        assertThat(breakdown.getModelContribution() + breakdown.getAnomalyContribution()
                + breakdown.getBusinessRuleContribution() + breakdown.getOverrideContribution())
                .isEqualTo((double) score.getTotal());
    }

    @Test
    void extremeDeviationUpliftCoversAnomaliesAndRules() {
        RiskScore score = scorer.score(prediction(0.02),
                report(24995.0, fired(AnomalyDimension.AMOUNT, Severity.HIGH), fired(AnomalyDimension.LOCATION, Severity.HIGH)),
                EnumSet.of(BusinessRuleFlag.LARGE_AMOUNT));

        ScoreBreakdown breakdown = score.getBreakdown();
        assertThat(score.getTotal()).isEqualTo(99);
        assertThat(breakdown.getAnomalyContribution()).isEqualTo(40.0);
        assertThat(breakdown.getBusinessRuleContribution()).isEqualTo(10.0);
        assertThat(breakdown.getOverrideContribution()).isEqualTo(49.0);
    }

    @Test
    void noUpliftWithoutExtremeDeviation() {
        RiskScore score = scorer.score(prediction(0.8), report(150.0, fired(AnomalyDimension.AMOUNT, Severity.HIGH)), Set.of());

        assertThat(score.getBreakdown().getOverrideContribution()).isZero();
    }

    @Test
    void missingPredictionScoresAnomaliesAndRulesOnly() {
        RiskScore score = scorer.score(null, report(4.0, fired(AnomalyDimension.AMOUNT, Severity.MEDIUM)),
                Set.of(BusinessRuleFlag.HIGH_RISK_CATEGORY));

        assertThat(score.isModelUnavailable()).isTrue();
        assertThat(score.getBreakdown().getModelContribution()).isZero();
        assertThat(score.getTotal()).isEqualTo(20);
    }

    @Test
    void categoryBoundariesAreInclusive() {
        assertThat(scorer.category(0)).isEqualTo(RiskLevel.LOW);
        assertThat(scorer.category(30)).isEqualTo(RiskLevel.LOW);
        assertThat(scorer.category(31)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(scorer.category(60)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(scorer.category(61)).isEqualTo(RiskLevel.HIGH);
        assertThat(scorer.category(85)).isEqualTo(RiskLevel.HIGH);
        assertThat(scorer.category(86)).isEqualTo(RiskLevel.CRITICAL);
        assertThat(scorer.category(100)).isEqualTo(RiskLevel.CRITICAL);
    }
}
