package io.coolchords.exceptions;

/**
 * Thrown when a chord filter does not match a single buildable chord
 */
public class NoValidChordsException extends RuntimeException {
    public NoValidChordsException(String message) {
        super(message);
    }
}
