package com.fraud.scoring.api;

/**
 * Thrown when every weighted ensemble member failed. The pipeline degrades to
 * anomaly-only scoring instead of failing the transaction.
 */
public class PredictionUnavailableException extends RuntimeException {

    public PredictionUnavailableException(String message) {
        super(message);
    }

    public PredictionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
