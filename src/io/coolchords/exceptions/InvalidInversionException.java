package io.coolchords.exceptions;

/**
 * Thrown when an inversion index is not valid for the chord quality
 */
public class InvalidInversionException extends RuntimeException {
    public InvalidInversionException(String message) {
        super(message);
    }
}
