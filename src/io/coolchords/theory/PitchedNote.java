package io.coolchords.theory;

import io.coolchords.exceptions.OctaveOutOfRangeException;

import java.util.Comparator;

/**
 * A pitch class in a playable octave, e.g. C#4.
 * Ordered by octave first, then by position in the chromatic scale.
 */
public record PitchedNote(PitchClass pitchClass, int octave) implements Comparable<PitchedNote> {
    public static final int MIN_OCTAVE = 1;
    public static final int MAX_OCTAVE = 8;

    private static final Comparator<PitchedNote> PITCH_ORDER = Comparator
            .comparingInt(PitchedNote::octave)
            .thenComparingInt(n -> n.pitchClass().index());

    public PitchedNote {
        if (pitchClass == null)
            throw new IllegalArgumentException("A note needs a pitch class");
        if (!isValidOctave(octave))
            throw new OctaveOutOfRangeException("Octave must be between " + MIN_OCTAVE + " and " + MAX_OCTAVE + ", got " + octave);
    }

    public static PitchedNote of(PitchClass pitchClass, int octave) {
        return new PitchedNote(pitchClass, octave);
    }

    public static boolean isValidOctave(int octave) {
        return octave >= MIN_OCTAVE && octave <= MAX_OCTAVE;
    }

    /** Absolute semitone position, octave * 12 + pitch class index */
    public int semitone() {
        return octave * PitchClass.COUNT + pitchClass.index();
    }

    /**
     * Parses the {@link #toString()} form: a canonical pitch class followed by the octave, e.g. "C#4".
     * @throws IllegalArgumentException When the text is not in that form
     */
    public static PitchedNote parse(String text) {
        if (text == null || text.length() < 2)
            throw new IllegalArgumentException("Not a note: " + text);
        String trimmed = text.trim();
        int split = trimmed.length() - 1;
        while (split > 0 && Character.isDigit(trimmed.charAt(split - 1)))
            split--;
        if (split == 0 || split == trimmed.length())
            throw new IllegalArgumentException("Not a note: " + text);

        var pitchClass = PitchClass.fromDisplayName(trimmed.substring(0, split).toUpperCase());
        return new PitchedNote(pitchClass, Integer.parseInt(trimmed.substring(split)));
    }

    @Override
    public int compareTo(PitchedNote other) {
        return PITCH_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return pitchClass.displayName() + octave;
    }
}
