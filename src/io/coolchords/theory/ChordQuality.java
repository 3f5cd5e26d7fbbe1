package io.coolchords.theory;

import io.coolchords.exceptions.InvalidQualityException;

import java.util.Arrays;
import java.util.List;

/**
 * All supported chord qualities and their interval formulas.
 * <p>
 * Formulas are semitones above the root, ascending. Extended chords reach past the octave:
 * 14 is the 9th (2 + 12), 17 the 11th (5 + 12) and 21 the 13th (9 + 12).
 * <p>
 * The declaration order is also the order in which {@link ChordRecognizer} tries qualities,
 * so a note set that fits more than one quality always resolves to the one declared first.
 */
public enum ChordQuality {
    MAJOR("major"),
    MINOR("minor"),
    DIMINISHED("diminished"),
    AUGMENTED("augmented"),

    MAJOR7("major7"),
    MINOR7("minor7"),
    DOMINANT7("dominant7"),
    DIMINISHED7("diminished7"),
    HALF_DIMINISHED7("halfDiminished7"),

    MAJOR9("major9"),
    MINOR9("minor9"),
    DOMINANT9("dominant9"),
    MAJOR11("major11"),
    MINOR11("minor11"),
    DOMINANT11("dominant11"),
    MAJOR13("major13"),
    DOMINANT13("dominant13"),

    SUS2("sus2"),
    SUS4("sus4"),

    ADD9("add9"),
    ADD11("add11");

    /** camelCase identifier used in preset files */
    public final String key;

    ChordQuality(String key) {
        this.key = key;
    }

    /** Semitones above the root, ascending, root included as 0 */
    public List<Integer> formula() {
        return switch (this) {
            case MAJOR -> List.of(0, 4, 7);
            case MINOR -> List.of(0, 3, 7);
            case DIMINISHED -> List.of(0, 3, 6);
            case AUGMENTED -> List.of(0, 4, 8);
            case MAJOR7 -> List.of(0, 4, 7, 11);
            case MINOR7 -> List.of(0, 3, 7, 10);
            case DOMINANT7 -> List.of(0, 4, 7, 10);
            case DIMINISHED7 -> List.of(0, 3, 6, 9);
            case HALF_DIMINISHED7 -> List.of(0, 3, 6, 10);
            case MAJOR9 -> List.of(0, 4, 7, 11, 14);
            case MINOR9 -> List.of(0, 3, 7, 10, 14);
            case DOMINANT9 -> List.of(0, 4, 7, 10, 14);
            case MAJOR11 -> List.of(0, 4, 7, 11, 14, 17);
            case MINOR11 -> List.of(0, 3, 7, 10, 14, 17);
            case DOMINANT11 -> List.of(0, 4, 7, 10, 14, 17);
            case MAJOR13 -> List.of(0, 4, 7, 11, 14, 17, 21);
            case DOMINANT13 -> List.of(0, 4, 7, 10, 14, 17, 21);
            case SUS2 -> List.of(0, 2, 7);
            case SUS4 -> List.of(0, 5, 7);
            case ADD9 -> List.of(0, 4, 7, 14);
            case ADD11 -> List.of(0, 4, 7, 17);
        };
    }

    /** The suffix appended to the root in a chord name, e.g. "m7" in "F#m7". Major has none. */
    public String suffix() {
        return switch (this) {
            case MAJOR -> "";
            case MINOR -> "m";
            case DIMINISHED -> "dim";
            case AUGMENTED -> "aug";
            case MAJOR7 -> "maj7";
            case MINOR7 -> "m7";
            case DOMINANT7 -> "7";
            case DIMINISHED7 -> "dim7";
            case HALF_DIMINISHED7 -> "m7♭5";
            case MAJOR9 -> "maj9";
            case MINOR9 -> "m9";
            case DOMINANT9 -> "9";
            case MAJOR11 -> "maj11";
            case MINOR11 -> "m11";
            case DOMINANT11 -> "11";
            case MAJOR13 -> "maj13";
            case DOMINANT13 -> "13";
            case SUS2 -> "sus2";
            case SUS4 -> "sus4";
            case ADD9 -> "add9";
            case ADD11 -> "add11";
        };
    }

    public String displayName() {
        return switch (this) {
            case MAJOR -> "Major";
            case MINOR -> "Minor";
            case DIMINISHED -> "Diminished";
            case AUGMENTED -> "Augmented";
            case MAJOR7 -> "Major 7th";
            case MINOR7 -> "Minor 7th";
            case DOMINANT7 -> "Dominant 7th";
            case DIMINISHED7 -> "Diminished 7th";
            case HALF_DIMINISHED7 -> "Half Diminished 7th";
            case MAJOR9 -> "Major 9th";
            case MINOR9 -> "Minor 9th";
            case DOMINANT9 -> "Dominant 9th";
            case MAJOR11 -> "Major 11th";
            case MINOR11 -> "Minor 11th";
            case DOMINANT11 -> "Dominant 11th";
            case MAJOR13 -> "Major 13th";
            case DOMINANT13 -> "Dominant 13th";
            case SUS2 -> "Sus2";
            case SUS4 -> "Sus4";
            case ADD9 -> "Add9";
            case ADD11 -> "Add11";
        };
    }

    public ChordCategory category() {
        return switch (this) {
            case MAJOR, MINOR, DIMINISHED, AUGMENTED -> ChordCategory.TRIADS;
            case MAJOR7, MINOR7, DOMINANT7, DIMINISHED7, HALF_DIMINISHED7 -> ChordCategory.SEVENTH_CHORDS;
            case MAJOR9, MINOR9, DOMINANT9, MAJOR11, MINOR11, DOMINANT11, MAJOR13, DOMINANT13 -> ChordCategory.EXTENDED_CHORDS;
            case SUS2, SUS4 -> ChordCategory.SUSPENDED;
            case ADD9, ADD11 -> ChordCategory.ADDED_TONES;
        };
    }

    /** Number of notes in the chord */
    public int noteCount() {
        return formula().size();
    }

    public static List<ChordQuality> inCategory(ChordCategory category) {
        return Arrays.stream(values()).filter(q -> q.category() == category).toList();
    }

    /**
     * @param key The camelCase identifier, e.g. "halfDiminished7"
     * @throws InvalidQualityException When no quality has that key
     */
    public static ChordQuality fromKey(String key) {
        for (var quality : values()) {
            if (quality.key.equals(key))
                return quality;
        }
        throw new InvalidQualityException("Unknown chord quality: " + key);
    }
}
