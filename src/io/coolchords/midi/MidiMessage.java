package io.coolchords.midi;

import java.util.OptionalInt;

/**
 * A raw channel message as delivered by a MIDI input: a status byte and one or two data bytes.
 * <p>
 * Only note on and note off are interpreted. A note on with velocity 0 is a note off, as most keyboards send
 * it that way. Everything else (controllers, program changes, system messages) is neither.
 *
 * @param status The status byte, 0 to 255: message type in the upper nibble, channel in the lower
 * @param data1  First data byte, the note number for note messages
 * @param data2  Second data byte, the velocity for note messages, or {@link #NO_DATA} when absent
 */
public record MidiMessage(int status, int data1, int data2) {
    public static final int NO_DATA = -1;

    private static final int TYPE_MASK = 0xF0;
    private static final int NOTE_OFF = 0x80;
    private static final int NOTE_ON = 0x90;

    public static MidiMessage of(int status, int data1, int data2) {
        return new MidiMessage(status, data1, data2);
    }

    public static MidiMessage of(int status, int data1) {
        return new MidiMessage(status, data1, NO_DATA);
    }

    /**
     * @param bytes 2 or 3 bytes: status, data1 and optionally data2
     * @throws IllegalArgumentException For any other length
     */
    public static MidiMessage fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length < 2 || bytes.length > 3)
            throw new IllegalArgumentException("A channel message has 2 or 3 bytes, got "
                    + (bytes == null ? "null" : ByteFns.toHex(bytes)));
        int data2 = bytes.length == 3 ? ByteFns.toUnsignedInt(bytes[2]) : NO_DATA;
        return new MidiMessage(ByteFns.toUnsignedInt(bytes[0]), ByteFns.toUnsignedInt(bytes[1]), data2);
    }

    public boolean isNoteOn() {
        return (status & TYPE_MASK) == NOTE_ON && velocityOrZero() > 0;
    }

    public boolean isNoteOff() {
        int type = status & TYPE_MASK;
        return type == NOTE_OFF || (type == NOTE_ON && velocityOrZero() == 0);
    }

    public MidiStatus subType() {
        return MidiStatus.fromStatusByte(status);
    }

    /** MIDI channel, 1 to 16 */
    public int channel() {
        return ByteFns.lowerNibble(status) + 1;
    }

    /** The note number, empty when data1 is not a valid MIDI note number */
    public OptionalInt noteNumber() {
        return MidiNoteCodec.isValidMidiNote(data1) ? OptionalInt.of(data1) : OptionalInt.empty();
    }

    /** The velocity, empty when data2 is absent or not 0 to 127 */
    public OptionalInt velocity() {
        return data2 >= 0 && data2 <= 127 ? OptionalInt.of(data2) : OptionalInt.empty();
    }

    private int velocityOrZero() {
        return velocity().orElse(0);
    }

    public String toHex() {
        byte[] bytes = data2 == NO_DATA
                ? new byte[]{(byte) status, (byte) data1}
                : new byte[]{(byte) status, (byte) data1, (byte) data2};
        return ByteFns.toHex(bytes);
    }

    @Override
    public String toString() {
        return "MidiMessage{" + subType() + ", channel=" + channel() + ", bytes=" + toHex() + '}';
    }
}
