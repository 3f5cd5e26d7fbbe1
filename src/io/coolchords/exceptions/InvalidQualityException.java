package io.coolchords.exceptions;

/**
 * Thrown when a chord quality key is unknown or missing
 */
public class InvalidQualityException extends RuntimeException {
    public InvalidQualityException(String message) {
        super(message);
    }
}
