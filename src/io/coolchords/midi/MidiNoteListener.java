package io.coolchords.midi;

/** Receives the notes decoded by a {@link MidiInputDecoder} */
public interface MidiNoteListener {
    void noteOn(MidiNoteEvent event);

    void noteOff(MidiNoteEvent event);
}
