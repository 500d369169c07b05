package com.fraud.scoring.core;

import com.fraud.scoring.api.FraudAnalysisResult;
import com.fraud.scoring.api.InvalidInputException;
import com.fraud.scoring.api.PredictionUnavailableException;
import com.fraud.scoring.compliance.DecisionAuditLogger;
import com.fraud.scoring.domain.CustomerHistory;
import com.fraud.scoring.domain.Transaction;
import com.fraud.scoring.risk.alert.AlertGenerator;
import com.fraud.scoring.risk.anomaly.AnomalyDetector;
import com.fraud.scoring.risk.domain.AnomalyReport;
import com.fraud.scoring.risk.domain.BusinessRuleFlag;
import com.fraud.scoring.risk.domain.Decision;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.FraudAlert;
import com.fraud.scoring.risk.domain.RiskScore;
import com.fraud.scoring.risk.engine.BusinessRuleEvaluator;
import com.fraud.scoring.risk.engine.DecisionPolicy;
import com.fraud.scoring.risk.engine.EnsemblePredictor;
import com.fraud.scoring.risk.engine.RiskScorer;
import com.fraud.scoring.risk.features.FeatureEngineer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;

/**
 * Scores one transaction end to end: features, anomalies and ensemble, risk score, decision,
 * alert. Bad input is rejected with {@link InvalidInputException}; every other failure still
 * returns a decision (a zero-confidence manual review).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudScoringPipeline {

    private final FeatureEngineer featureEngineer;
    private final AnomalyDetector anomalyDetector;
    private final EnsemblePredictor ensemblePredictor;
    private final BusinessRuleEvaluator businessRuleEvaluator;
    private final RiskScorer riskScorer;
    private final DecisionPolicy decisionPolicy;
    private final AlertGenerator alertGenerator;
    private final DecisionAuditLogger auditLogger;
    private final Clock clock;

    /**
     * @param history customer baseline, or null for a first-time customer
     * @throws InvalidInputException when the transaction cannot be scored at all
     */
    public FraudAnalysisResult analyze(Transaction transaction, CustomerHistory history) {
        if (transaction != null) {
            auditLogger.logRequest(transaction);
        }

        EngineeredFeatures features;
        try {
            features = featureEngineer.engineer(transaction, history);
        } catch (InvalidInputException e) {
            auditLogger.logRejected(transaction, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Feature engineering failed for transaction {}", transaction.getTransactionId(), e);
            return finish(transaction, decisionPolicy.systemError(e), null, null, null);
        }

        AnomalyReport report = null;
        EnsemblePrediction prediction = null;
        RiskScore score = null;
        try {
            report = anomalyDetector.detect(features, history != null ? history.getUsualHours() : null);
            prediction = predict(transaction, features);
            Set<BusinessRuleFlag> flags = businessRuleEvaluator.evaluate(features, history, report);
            score = riskScorer.score(prediction, report, flags);
        } catch (RuntimeException e) {
            log.error("Scoring failed for transaction {}", transaction.getTransactionId(), e);
            return finish(transaction, decisionPolicy.systemError(e), score, report, prediction);
        }

        Decision decision = decisionPolicy.decide(score, report, prediction);
        return finish(transaction, decision, score, report, prediction);
    }

    private EnsemblePrediction predict(Transaction transaction, EngineeredFeatures features) {
        try {
            return ensemblePredictor.predict(features);
        } catch (PredictionUnavailableException e) {
            log.warn("No model prediction for transaction {}, scoring on anomalies and rules only: {}",
                    transaction.getTransactionId(), e.getMessage());
            return null;
        }
    }

    private FraudAnalysisResult finish(Transaction transaction, Decision decision, RiskScore score,
                                       AnomalyReport report, EnsemblePrediction prediction) {
        FraudAlert alert = null;
        try {
            alert = alertGenerator.generate(transaction, decision, score, prediction).orElse(null);
        } catch (RuntimeException e) {
            log.error("Alert generation failed for transaction {}", transaction.getTransactionId(), e);
        }
        FraudAnalysisResult result = FraudAnalysisResult.builder()
                .transactionId(transaction.getTransactionId())
                .analyzedAt(clock.instant())
                .decision(decision)
                .riskScore(score)
                .anomalyReport(report)
                .ensemblePrediction(prediction)
                .alert(alert)
                .build();
        auditLogger.logDecision(result);
        return result;
    }
}
