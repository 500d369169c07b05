package com.fraud.scoring.api;

/**
 * Thrown when engineered features do not satisfy the encoder's column contract
 * (unknown column, wrong type, non-finite value). Surfaced as a typed error instead of an opaque
 * encoder failure.
 */
public class FeatureContractException extends RuntimeException {

    public FeatureContractException(String message) {
        super(message);
    }

    public FeatureContractException(String message, Throwable cause) {
        super(message, cause);
    }
}
