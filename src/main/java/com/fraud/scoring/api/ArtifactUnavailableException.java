package com.fraud.scoring.api;

/**
 * Thrown when the encoder, a model or a frequency table cannot be loaded. Fatal at startup;
 * recovery is a restart with corrected artifacts.
 */
public class ArtifactUnavailableException extends RuntimeException {

    public ArtifactUnavailableException(String message) {
        super(message);
    }

    public ArtifactUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
