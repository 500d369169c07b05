package com.fraud.scoring.risk.domain;

public enum DecisionAction {
    APPROVE,
    BLOCK,
    MANUAL_REVIEW
}
