package com.fraud.scoring.risk.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Contribution of each scoring component, before the total is floored and capped. The parts
 * always add up to at least the reported total.
 */
@Value
@Builder
public class ScoreBreakdown {

    /** 0-50. */
    double modelContribution;
    /** 0-40. */
    double anomalyContribution;
    /** 0-10. */
    double businessRuleContribution;
    /** Points added when an extreme amount deviation lifts the total to its floor; 0 otherwise. */
    double overrideContribution;
}
