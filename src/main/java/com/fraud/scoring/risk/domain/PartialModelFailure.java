package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Notice attached to an ensemble prediction when some, but not all, models failed.
 * The prediction was computed from the survivors.
 */
@Value
@Builder
public class PartialModelFailure {

    /** Model name to failure reason. */
    Map<String, String> failedModels;
    int survivingModels;

    public String describe() {
        return failedModels.size() + " model(s) failed " + failedModels.keySet()
                + ", prediction uses " + survivingModels + " survivor(s)";
    }
}
