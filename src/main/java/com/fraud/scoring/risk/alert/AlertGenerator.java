package com.fraud.scoring.risk.alert;

import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.domain.Transaction;
import com.fraud.scoring.risk.domain.Decision;
import com.fraud.scoring.risk.domain.DecisionAction;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.FraudAlert;
import com.fraud.scoring.risk.domain.RiskLevel;
import com.fraud.scoring.risk.domain.RiskScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Raises a {@link FraudAlert} for every blocked or reviewed transaction. Approved transactions
 * produce nothing.
 */
@Slf4j
@Component
public class AlertGenerator {

    private final FraudScoringProperties.Alerts config;
    private final Clock clock;

    public AlertGenerator(FraudScoringProperties properties, Clock clock) {
        this.config = properties.getAlerts();
        this.clock = clock;
    }

    /**
     * @param score null when the pipeline failed before scoring
     * @param prediction null when no model answered
     */
    public Optional<FraudAlert> generate(Transaction transaction, Decision decision, RiskScore score,
                                         EnsemblePrediction prediction) {
        if (!config.isEnabled() || decision.getAction() == DecisionAction.APPROVE) {
            return Optional.empty();
        }

        int riskScore = score != null ? score.getTotal() : 0;
        RiskLevel level = score != null ? score.getCategory() : RiskLevel.MEDIUM;
        List<String> factors = decision.getKeyFactors();
        if (factors.size() > config.getMaxKeyFactors()) {
            factors = factors.subList(0, config.getMaxKeyFactors());
        }

        FraudAlert alert = FraudAlert.builder()
                .alertId(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .level(level)
                .transactionId(transaction.getTransactionId())
                .action(decision.getAction())
                .riskScore(riskScore)
                .fraudProbability(prediction != null ? prediction.getFraudProbability() : null)
                .amount(transaction.getAmount())
                .message(message(transaction, decision, riskScore, level))
                .recommendedActions(decision.getRecommendedActions())
                .keyFactors(List.copyOf(factors))
                .build();
        log.info("Fraud alert {} raised: transactionId={}, level={}, action={}, score={}",
                alert.getAlertId(), alert.getTransactionId(), level, decision.getAction(), riskScore);
        return Optional.of(alert);
    }

    private static String message(Transaction transaction, Decision decision, int riskScore, RiskLevel level) {
        String verb = decision.getAction() == DecisionAction.BLOCK ? "blocked" : "held for manual review";
        return String.format(Locale.ROOT, "%s risk: transaction %s for %s %s (score %d/100, confidence %d%%)",
                level, transaction.getTransactionId(), transaction.getAmount(), verb,
                riskScore, decision.getConfidence());
    }
}
