package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Output of the model ensemble for one transaction.
 */
@Value
@Builder
public class EnsemblePrediction {

    /** Probability per model that answered, zero-weight models included. */
    Map<String, Double> modelProbabilities;
    /** Weighted probability over the voting models. */
    double fraudProbability;
    boolean fraud;
    double threshold;
    ConsensusLabel consensus;
    /** max - min over the voting models. */
    double spread;
    /** Null when every model answered. */
    PartialModelFailure partialFailure;

    public boolean hasPartialFailure() {
        return partialFailure != null;
    }
}
