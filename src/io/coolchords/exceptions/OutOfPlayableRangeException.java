package io.coolchords.exceptions;

/**
 * Thrown when a valid MIDI note number maps to an octave outside 1 to 8
 */
public class OutOfPlayableRangeException extends RuntimeException {
    public OutOfPlayableRangeException(String message) {
        super(message);
    }
}
