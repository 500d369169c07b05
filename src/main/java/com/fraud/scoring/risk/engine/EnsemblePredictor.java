package com.fraud.scoring.risk.engine;

import com.fraud.scoring.api.FeatureContractException;
import com.fraud.scoring.api.PredictionUnavailableException;
import com.fraud.scoring.artifact.ArtifactBundle;
import com.fraud.scoring.config.FraudScoringProperties;
import com.fraud.scoring.risk.domain.ConsensusLabel;
import com.fraud.scoring.risk.domain.EngineeredFeatures;
import com.fraud.scoring.risk.domain.EnsemblePrediction;
import com.fraud.scoring.risk.domain.PartialModelFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every loaded classifier on the encoded features and reduces their probabilities with
 * explicit per-model weights. A model that throws or answers outside [0, 1] is left out; the
 * prediction carries a {@link PartialModelFailure} notice naming it.
 */
@Slf4j
@Service
public class EnsemblePredictor {

    private final FeatureEncoder encoder;
    private final List<FraudClassifier> classifiers;
    private final Map<String, Double> weights;
    private final FraudScoringProperties.Ensemble config;

    public EnsemblePredictor(ArtifactBundle artifacts, FraudScoringProperties properties) {
        this.encoder = artifacts.getEncoder();
        this.classifiers = List.copyOf(artifacts.getClassifiers());
        this.config = properties.getEnsemble();
        this.weights = resolveWeights(classifiers, config.getWeights());
        log.info("Ensemble ready: weights={}, threshold={}", weights, config.getDecisionThreshold());
    }

    /**
     * @throws FeatureContractException when the encoder rejects the feature set
     * @throws PredictionUnavailableException when no weighted model produced a probability
     */
    public EnsemblePrediction predict(EngineeredFeatures features) {
        double[] encoded = encode(features);

        Map<String, Double> probabilities = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (FraudClassifier classifier : classifiers) {
            String name = classifier.getName();
            try {
                double p = classifier.predictProbability(encoded.clone());
                if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                    log.warn("Model '{}' returned invalid probability {}, excluding it", name, p);
                    failures.put(name, "invalid probability " + p);
                } else {
                    probabilities.put(name, p);
                }
            } catch (RuntimeException e) {
                log.warn("Model '{}' failed, excluding it: {}", name, e.toString());
                failures.put(name, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        List<Double> votes = new ArrayList<>();
        for (Map.Entry<String, Double> entry : probabilities.entrySet()) {
            double weight = weights.get(entry.getKey());
            if (weight <= 0.0) continue;
            weightedSum += weight * entry.getValue();
            totalWeight += weight;
            votes.add(entry.getValue());
        }
        if (votes.isEmpty()) {
            throw new PredictionUnavailableException("No weighted model produced a prediction; failed=" + failures.keySet());
        }

        double probability = Math.min(1.0, Math.max(0.0, weightedSum / totalWeight));
        double spread = Collections.max(votes) - Collections.min(votes);
        PartialModelFailure partialFailure = null;
        if (!failures.isEmpty()) {
            partialFailure = PartialModelFailure.builder()
                    .failedModels(Collections.unmodifiableMap(failures))
                    .survivingModels(probabilities.size())
                    .build();
            log.warn("Partial ensemble failure: {}", partialFailure.describe());
        }

        EnsemblePrediction prediction = EnsemblePrediction.builder()
                .modelProbabilities(Collections.unmodifiableMap(probabilities))
                .fraudProbability(probability)
                .fraud(probability > config.getDecisionThreshold())
                .threshold(config.getDecisionThreshold())
                .consensus(consensus(votes.size(), spread))
                .spread(spread)
                .partialFailure(partialFailure)
                .build();
        log.debug("Ensemble prediction: p={}, models={}, consensus={}",
                probability, probabilities, prediction.getConsensus());
        return prediction;
    }

    private double[] encode(EngineeredFeatures features) {
        double[] encoded;
        try {
            encoded = encoder.encode(features);
        } catch (FeatureContractException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FeatureContractException("Encoder rejected features: " + e.getMessage(), e);
        }
        if (encoded == null || encoded.length != encoder.columns().size()) {
            throw new FeatureContractException("Encoder produced " + (encoded == null ? "no" : encoded.length)
                    + " values for " + encoder.columns().size() + " columns");
        }
        return encoded;
    }

    ConsensusLabel consensus(int voters, double spread) {
        if (voters == 1) return ConsensusLabel.SINGLE_MODEL;
        if (spread <= config.getStrongAgreementSpread()) return ConsensusLabel.STRONG_AGREEMENT;
        if (spread <= config.getModerateAgreementSpread()) return ConsensusLabel.MODERATE_AGREEMENT;
        return ConsensusLabel.WEAK_AGREEMENT;
    }

    private static Map<String, Double> resolveWeights(List<FraudClassifier> classifiers, Map<String, Double> configured) {
        if (classifiers.isEmpty()) {
            throw new IllegalStateException("Ensemble has no models");
        }
        Map<String, Double> resolved = new LinkedHashMap<>();
        boolean anyPositive = false;
        for (FraudClassifier classifier : classifiers) {
            Double weight = configured.get(classifier.getName());
            if (weight == null) {
                throw new IllegalStateException("No weight configured for model '" + classifier.getName()
                        + "' (fraud.ensemble.weights)");
            }
            if (!Double.isFinite(weight) || weight < 0.0) {
                throw new IllegalStateException("Weight for model '" + classifier.getName() + "' must be >= 0, got " + weight);
            }
            anyPositive |= weight > 0.0;
            resolved.put(classifier.getName(), weight);
        }
        if (!anyPositive) {
            throw new IllegalStateException("Every loaded model has weight 0; nothing would vote");
        }
        return Collections.unmodifiableMap(resolved);
    }
}
