package io.coolchords.exceptions;

/**
 * Thrown when a chord filter preset file is missing or cannot be parsed
 */
public class PresetParseException extends RuntimeException {
    public PresetParseException(String message) {
        super(message);
    }

    public PresetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
