package io.coolchords.midi;

import io.coolchords.theory.PitchedNote;

import javax.sound.midi.Receiver;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Receiver} that turns the note on and note off messages of a MIDI input into {@link MidiNoteEvent}s.
 * <p>
 * Connect it to a transmitter, e.g. {@code MidiSystem.getTransmitter().setReceiver(decoder)}.
 * Other message types are ignored. Notes outside octaves 1 to 8 are dropped.
 */
public class MidiInputDecoder implements Receiver {
    private static final Logger LOGGER = Logger.getLogger(MidiInputDecoder.class.getName());

    private final MidiNoteListener listener;
    private volatile boolean open = true;

    public MidiInputDecoder(MidiNoteListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("A decoder needs a listener to dispatch to");
        this.listener = listener;
    }

    @Override
    public void send(javax.sound.midi.MidiMessage message, long timeStamp) {
        if (!open || message == null)
            return;

        byte[] bytes = message.getMessage();
        if (bytes == null || bytes.length < 2 || bytes.length > 3)
            return;

        decode(MidiMessage.fromBytes(bytes), timeStamp);
    }

    /** Dispatches one already parsed message */
    public void decode(MidiMessage message, long timeStamp) {
        if (!open)
            return;

        boolean noteOn = message.isNoteOn();
        boolean noteOff = message.isNoteOff();
        if (!noteOn && !noteOff)
            return;

        OptionalInt noteNumber = message.noteNumber();
        if (noteNumber.isEmpty())
            return;

        int midiNote = noteNumber.getAsInt();
        if (!MidiNoteCodec.isPlayableMidiNote(midiNote)) {
            LOGGER.log(Level.WARNING, "Dropping MIDI note {0}, outside the playable range {1}-{2}",
                    new Object[]{midiNote, MidiNoteCodec.MIN_PLAYABLE_NOTE, MidiNoteCodec.MAX_PLAYABLE_NOTE});
            return;
        }

        PitchedNote note = MidiNoteCodec.fromMidi(midiNote);
        var event = new MidiNoteEvent(note, midiNote, message.velocity().orElse(0), timeStamp);
        LOGGER.log(Level.FINE, "Decoded {0}: {1}", new Object[]{message, event});
        if (noteOn) {
            listener.noteOn(event);
        } else {
            listener.noteOff(event);
        }
    }

    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
