package io.coolchords.theory;

import io.coolchords.exceptions.InvalidInversionException;
import io.coolchords.exceptions.InvalidQualityException;
import io.coolchords.exceptions.OctaveOutOfRangeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds concrete chords from a root, a quality, an octave and an inversion.
 * <p>
 * Notes are always spelled with sharps (an augmented C is C E G#, never C E Ab) and never leave octaves 1 to 8:
 * a chord that would is rejected rather than folded back into range.
 */
public final class ChordBuilder {
    private ChordBuilder() {}

    public static Chord build(PitchClass root, ChordQuality quality, int octave) {
        return build(root, quality, octave, 0);
    }

    /**
     * Builds a chord.
     *
     * @param root      The root note
     * @param quality   The chord quality
     * @param octave    The octave of the root in root position, 1 to 8
     * @param inversion 0 for root position, up to the number of notes minus one
     * @return The chord, notes ascending
     * @throws OctaveOutOfRangeException When the octave is invalid, or a note of the chord (after inversion) would leave octaves 1 to 8
     * @throws InvalidInversionException When the inversion is not valid for the quality
     * @throws InvalidQualityException   When no quality is given
     */
    public static Chord build(PitchClass root, ChordQuality quality, int octave, int inversion) {
        if (quality == null)
            throw new InvalidQualityException("A chord needs a quality");
        if (root == null)
            throw new IllegalArgumentException("A chord needs a root");
        if (!PitchedNote.isValidOctave(octave))
            throw new OctaveOutOfRangeException("Octave must be between " + PitchedNote.MIN_OCTAVE + " and "
                    + PitchedNote.MAX_OCTAVE + ", got " + octave);

        List<Integer> formula = quality.formula();
        if (inversion < 0 || inversion >= formula.size())
            throw new InvalidInversionException("Inversion must be between 0 and " + (formula.size() - 1)
                    + " for a " + quality.displayName() + " chord, got " + inversion);

        var notes = new ArrayList<PitchedNote>(formula.size());
        for (int interval : formula) {
            int steps = root.index() + interval;
            int noteOctave = octave + steps / PitchClass.COUNT;
            if (!PitchedNote.isValidOctave(noteOctave))
                throw new OctaveOutOfRangeException(root.displayName() + quality.suffix() + " at octave " + octave
                        + " would contain notes outside octaves " + PitchedNote.MIN_OCTAVE + " to " + PitchedNote.MAX_OCTAVE);
            notes.add(new PitchedNote(PitchClass.fromIndex(steps), noteOctave));
        }

        List<PitchedNote> voicing = List.copyOf(notes);
        for (int i = 0; i < inversion; i++) {
            voicing = ChordInversions.invertOnce(voicing, OctaveOverflowPolicy.REJECT);
        }

        return new Chord(root, quality, voicing, inversion, chordName(root, quality, inversion, voicing));
    }

    /**
     * Formats a chord name: the root, the quality suffix and, for inversions, "/" and the bass note.
     * <p>
     * {@code chordName(C, MAJOR, 1, [E4, G4, C5])} is "C/E".
     */
    public static String chordName(PitchClass root, ChordQuality quality, int inversion, List<PitchedNote> notes) {
        String name = root.displayName() + quality.suffix();
        if (inversion > 0 && !notes.isEmpty()) {
            name += "/" + notes.get(0).pitchClass().displayName();
        }
        return name;
    }

    /**
     * Checks a chord against the invariants every built chord satisfies: the note count matches the quality,
     * the notes are strictly ascending, the root is one of the notes and the inversion is in range.
     */
    public static boolean isWellFormed(Chord chord) {
        if (chord == null || chord.quality() == null || chord.root() == null || chord.notes().isEmpty())
            return false;

        int size = chord.quality().noteCount();
        if (chord.notes().size() != size)
            return false;
        if (chord.inversion() < 0 || chord.inversion() >= size)
            return false;

        for (int i = 1; i < chord.notes().size(); i++) {
            if (chord.notes().get(i - 1).compareTo(chord.notes().get(i)) >= 0)
                return false;
        }

        return chord.notes().stream().anyMatch(n -> n.pitchClass() == chord.root());
    }
}
