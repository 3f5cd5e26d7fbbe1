package io.coolchords.midi;

import io.coolchords.exceptions.InvalidMidiNumberException;
import io.coolchords.exceptions.OutOfPlayableRangeException;
import io.coolchords.theory.PitchClass;
import io.coolchords.theory.PitchedNote;

/**
 * Converts between pitched notes and MIDI note numbers.
 * <p>
 * Octaves are numbered so that MIDI note 12 is C1:
 * <pre>
 * C1 = 12   C4 = 48   C5 (middle C) = 60   A5 (A440) = 69   C8 = 96   B8 = 107
 * </pre>
 * MIDI numbers 0 to 127 are valid, but only 12 to 107 (octaves 1 to 8) are playable.
 */
public final class MidiNoteCodec {
    public static final int MIN_MIDI_NOTE = 0;
    public static final int MAX_MIDI_NOTE = 127;
    public static final int MIN_PLAYABLE_NOTE = PitchedNote.MIN_OCTAVE * PitchClass.COUNT;
    public static final int MAX_PLAYABLE_NOTE = (PitchedNote.MAX_OCTAVE + 1) * PitchClass.COUNT - 1;

    private MidiNoteCodec() {}

    /**
     * @return octave * 12 + pitch class index
     * @throws InvalidMidiNumberException When the result is not a valid MIDI note number
     */
    public static int toMidi(PitchedNote note) {
        int midiNote = note.octave() * PitchClass.COUNT + note.pitchClass().index();
        if (!isValidMidiNote(midiNote))
            throw new InvalidMidiNumberException(note + " maps to MIDI note " + midiNote + ", which is outside "
                    + MIN_MIDI_NOTE + " to " + MAX_MIDI_NOTE);
        return midiNote;
    }

    /**
     * @throws InvalidMidiNumberException  When the number is outside 0 to 127
     * @throws OutOfPlayableRangeException When the number is valid MIDI but its octave is outside 1 to 8
     */
    public static PitchedNote fromMidi(int midiNote) {
        if (!isValidMidiNote(midiNote))
            throw new InvalidMidiNumberException("MIDI note number must be between " + MIN_MIDI_NOTE + " and "
                    + MAX_MIDI_NOTE + ", got " + midiNote);

        int octave = midiNote / PitchClass.COUNT;
        if (!PitchedNote.isValidOctave(octave))
            throw new OutOfPlayableRangeException("MIDI note " + midiNote + " maps to octave " + octave
                    + ", which is outside the playable range (" + PitchedNote.MIN_OCTAVE + "-" + PitchedNote.MAX_OCTAVE + ")");

        return new PitchedNote(PitchClass.fromIndex(midiNote), octave);
    }

    public static boolean isValidMidiNote(int midiNote) {
        return midiNote >= MIN_MIDI_NOTE && midiNote <= MAX_MIDI_NOTE;
    }

    public static boolean isPlayableMidiNote(int midiNote) {
        return midiNote >= MIN_PLAYABLE_NOTE && midiNote <= MAX_PLAYABLE_NOTE;
    }
}
