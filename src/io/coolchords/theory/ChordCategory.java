package io.coolchords.theory;

/**
 * Groups of chord qualities as shown in a chord picker
 */
public enum ChordCategory {
    TRIADS("Triads"),
    SEVENTH_CHORDS("7th Chords"),
    EXTENDED_CHORDS("Extended Chords (9ths, 11ths, 13ths)"),
    SUSPENDED("Suspended Chords"),
    ADDED_TONES("Added Tone Chords");

    public final String displayName;

    ChordCategory(String displayName) {
        this.displayName = displayName;
    }
}
