package com.fraud.scoring.risk.engine;

import com.fraud.scoring.risk.domain.EngineeredFeatures;

import java.util.List;

/**
 * Turns engineered features into the numeric vector the classifiers were trained on
 * (scaling for numeric columns, target encoding for categorical ones).
 * Implementations are immutable and safe to share across threads.
 */
public interface FeatureEncoder {

    /**
     * Column names in output order.
     */
    List<String> columns();

    /**
     * @return one value per entry of {@link #columns()}
     * @throws com.fraud.scoring.api.FeatureContractException when the features do not satisfy the encoder's contract
     */
    double[] encode(EngineeredFeatures features);
}
