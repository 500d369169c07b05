package com.fraud.scoring.risk.domain;

/**
 * How closely the voting models agree, from the spread between their highest and lowest
 * probability. Diagnostic only; it never changes the reduced probability.
 */
public enum ConsensusLabel {
    STRONG_AGREEMENT,
    MODERATE_AGREEMENT,
    WEAK_AGREEMENT,
    SINGLE_MODEL
}
