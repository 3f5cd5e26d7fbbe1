package io.coolchords.midi;

import io.coolchords.theory.PitchedNote;

/**
 * A decoded note on or note off.
 *
 * @param note      The pitched note
 * @param midiNote  Its MIDI note number, 12 to 107
 * @param velocity  0 to 127, 0 for a note off sent as a note on without velocity
 * @param timestamp Device timestamp in microseconds, -1 when the device gives none
 */
public record MidiNoteEvent(PitchedNote note, int midiNote, int velocity, long timestamp) {
}
