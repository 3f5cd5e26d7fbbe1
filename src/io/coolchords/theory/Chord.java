package io.coolchords.theory;

import java.util.List;

/**
 * A concrete chord voicing.
 *
 * @param root      The chord's root, which is not necessarily the lowest note
 * @param quality   The chord quality
 * @param notes     All notes, ascending by pitch
 * @param inversion 0 for root position, n when the n lowest formula notes were moved up an octave
 * @param name      The chord name, e.g. "C", "F#m7" or "G7/B"
 */
public record Chord(PitchClass root, ChordQuality quality, List<PitchedNote> notes, int inversion, String name) {
    public Chord {
        notes = List.copyOf(notes);
    }

    /** The lowest note */
    public PitchedNote bass() {
        return notes.get(0);
    }

    public boolean isInverted() {
        return inversion > 0;
    }

    @Override
    public String toString() {
        return name + " " + notes;
    }
}
