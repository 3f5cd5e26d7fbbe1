package io.coolchords.midi;

import io.coolchords.theory.Chord;
import io.coolchords.theory.ChordRecognizer;
import io.coolchords.theory.PitchedNote;

import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * The notes currently held down on a MIDI input.
 * <p>
 * Thread-safe: the MIDI system delivers events on its own thread while the UI reads the snapshot.
 */
public class HeldNotes implements MidiNoteListener {
    private final TreeSet<PitchedNote> held = new TreeSet<>();

    @Override
    public synchronized void noteOn(MidiNoteEvent event) {
        held.add(event.note());
    }

    @Override
    public synchronized void noteOff(MidiNoteEvent event) {
        held.remove(event.note());
    }

    /** @return The held notes, lowest first */
    public synchronized List<PitchedNote> snapshot() {
        return List.copyOf(held);
    }

    /** The chord formed by the held notes, empty when they form none */
    public Optional<Chord> currentChord() {
        return ChordRecognizer.identify(snapshot());
    }

    public synchronized void clear() {
        held.clear();
    }
}
