package com.fraud.scoring.artifact;

import com.fraud.scoring.risk.engine.FeatureEncoder;
import com.fraud.scoring.risk.engine.FraudClassifier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything the pipeline reads from disk: encoder, ensemble members and frequency tables.
 * Built once at startup and shared read-only by every request.
 */
@Value
@Builder
public class ArtifactBundle {

    FeatureEncoder encoder;
    @Singular
    List<FraudClassifier> classifiers;
    FrequencyTables frequencyTables;
}
