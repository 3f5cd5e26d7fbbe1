package io.coolchords.exceptions;

/**
 * Thrown when a requested or derived octave falls outside 1 to 8
 */
public class OctaveOutOfRangeException extends RuntimeException {
    public OctaveOutOfRangeException(String message) {
        super(message);
    }
}
