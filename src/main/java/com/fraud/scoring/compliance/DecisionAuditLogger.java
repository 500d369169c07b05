package com.fraud.scoring.compliance;

import com.fraud.scoring.api.FraudAnalysisResult;
import com.fraud.scoring.domain.Transaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs every scoring request and its decision for audit. One line per event, greppable by the
 * {@code [AUDIT]} prefix; the orchestration layer ships these to its own audit store.
 */
@Slf4j
@Component
public class DecisionAuditLogger {

    public void logRequest(Transaction transaction) {
        log.info("[AUDIT] FRAUD_CHECK_REQUEST transactionId={} amount={} category={} merchant={}",
                transaction.getTransactionId(),
                transaction.getAmount(),
                transaction.getCategory(),
                transaction.getMerchant());
    }

    public void logDecision(FraudAnalysisResult result) {
        log.info("[AUDIT] FRAUD_DECISION transactionId={} action={} confidence={} score={} category={} probability={} anomalyBand={} alertId={}",
                result.getTransactionId(),
                result.getDecision().getAction(),
                result.getDecision().getConfidence(),
                result.getRiskScore() != null ? result.getRiskScore().getTotal() : null,
                result.getRiskScore() != null ? result.getRiskScore().getCategory() : null,
                result.getEnsemblePrediction() != null ? result.getEnsemblePrediction().getFraudProbability() : null,
                result.getAnomalyReport() != null ? result.getAnomalyReport().getOverallRisk() : null,
                result.getAlert() != null ? result.getAlert().getAlertId() : null);
    }

    public void logRejected(Transaction transaction, String reason) {
        log.info("[AUDIT] FRAUD_CHECK_REJECTED transactionId={} reason={}",
                transaction != null ? transaction.getTransactionId() : null, reason);
    }
}
