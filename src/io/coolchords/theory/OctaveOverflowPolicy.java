package io.coolchords.theory;

/**
 * What to do when moving a note by an octave would leave the playable range (octaves 1 to 8).
 */
public enum OctaveOverflowPolicy {
    /** Leave the note where it is */
    CLAMP,
    /** Throw {@link io.coolchords.exceptions.OctaveOutOfRangeException} */
    REJECT
}
