package io.coolchords.exceptions;

/**
 * Thrown when a MIDI note number is outside 0 to 127
 */
public class InvalidMidiNumberException extends RuntimeException {
    public InvalidMidiNumberException(String message) {
        super(message);
    }
}
