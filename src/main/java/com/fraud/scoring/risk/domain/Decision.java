package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Final, immutable outcome for one transaction.
 */
@Value
@Builder
public class Decision {

    DecisionAction action;
    /** 0-100. */
    int confidence;
    String reasoning;
    List<String> keyFactors;
    List<String> recommendedActions;
}
