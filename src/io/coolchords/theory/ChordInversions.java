package io.coolchords.theory;

import io.coolchords.exceptions.OctaveOutOfRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates chord inversions from a root position voicing.
 * <p>
 * One inversion step takes the lowest note, moves it up an octave and re-sorts the notes:
 * <pre>
 * C4 E4 G4  ->  E4 G4 C5  ->  G4 C5 E5
 * </pre>
 */
public final class ChordInversions {
    private ChordInversions() {}

    /** The most inversions a voicing can have: one less than its size, never negative */
    public static int maxInversions(List<PitchedNote> notes) {
        return Math.max(0, notes.size() - 1);
    }

    /**
     * Generates the root position followed by up to {@code maxInversions} inversions.
     * Notes already at octave 8 stay there ({@link OctaveOverflowPolicy#CLAMP}).
     */
    public static List<List<PitchedNote>> generateInversions(List<PitchedNote> rootPosition, int maxInversions) {
        return generateInversions(rootPosition, maxInversions, OctaveOverflowPolicy.CLAMP);
    }

    /**
     * Generates the root position followed by up to {@code maxInversions} inversions.
     *
     * @param rootPosition  The root position voicing, in any order
     * @param maxInversions How many inversions to generate. Capped at size - 1, negative means none.
     * @param policy        What to do with a note that cannot be raised above octave 8
     * @return The voicings, root position first, each sorted ascending. Empty for an empty chord.
     */
    public static List<List<PitchedNote>> generateInversions(List<PitchedNote> rootPosition, int maxInversions,
                                                             OctaveOverflowPolicy policy) {
        if (rootPosition.isEmpty()) {
            return List.of();
        }

        int count = Math.max(0, Math.min(maxInversions, maxInversions(rootPosition)));
        var result = new ArrayList<List<PitchedNote>>(count + 1);
        List<PitchedNote> current = sorted(rootPosition);
        result.add(current);
        for (int i = 0; i < count; i++) {
            current = invertOnce(current, policy);
            result.add(current);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Moves the lowest note of a sorted voicing up an octave and re-sorts.
     * @return A new sorted, unmodifiable list
     */
    public static List<PitchedNote> invertOnce(List<PitchedNote> sortedNotes, OctaveOverflowPolicy policy) {
        var next = new ArrayList<>(sortedNotes.subList(1, sortedNotes.size()));
        next.add(raiseOctave(sortedNotes.get(0), policy));
        Collections.sort(next);
        return List.copyOf(next);
    }

    /**
     * @throws OctaveOutOfRangeException With {@link OctaveOverflowPolicy#REJECT}, when the note is at octave 8
     */
    public static PitchedNote raiseOctave(PitchedNote note, OctaveOverflowPolicy policy) {
        return shiftOctave(note, 1, policy);
    }

    /**
     * @throws OctaveOutOfRangeException With {@link OctaveOverflowPolicy#REJECT}, when the note is at octave 1
     */
    public static PitchedNote lowerOctave(PitchedNote note, OctaveOverflowPolicy policy) {
        return shiftOctave(note, -1, policy);
    }

    private static PitchedNote shiftOctave(PitchedNote note, int delta, OctaveOverflowPolicy policy) {
        int octave = note.octave() + delta;
        if (PitchedNote.isValidOctave(octave)) {
            return new PitchedNote(note.pitchClass(), octave);
        }
        return switch (policy) {
            case CLAMP -> note;
            case REJECT -> throw new OctaveOutOfRangeException(
                    "Moving " + note + " by " + delta + " octave(s) leaves octaves " + PitchedNote.MIN_OCTAVE
                            + " to " + PitchedNote.MAX_OCTAVE);
        };
    }

    static List<PitchedNote> sorted(List<PitchedNote> notes) {
        var copy = new ArrayList<>(notes);
        Collections.sort(copy);
        return List.copyOf(copy);
    }
}
