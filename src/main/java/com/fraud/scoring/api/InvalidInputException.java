package com.fraud.scoring.api;

/**
 * Thrown when a raw transaction field is missing, unparseable or out of range.
 * The transaction is rejected rather than scored with corrupted features.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
