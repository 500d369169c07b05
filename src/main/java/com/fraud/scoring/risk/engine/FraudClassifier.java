package com.fraud.scoring.risk.engine;

/**
 * One trained member of the ensemble. The serialized form behind it is an artifact concern;
 * the pipeline only needs a probability of the fraud class for an encoded row.
 * Implementations are immutable and safe to share across threads.
 */
public interface FraudClassifier {

    /**
     * Name used to look up the model's ensemble weight.
     */
    String getName();

    /**
     * @param encoded row produced by the {@link FeatureEncoder}
     * @return probability of fraud in [0, 1]
     */
    double predictProbability(double[] encoded);
}
