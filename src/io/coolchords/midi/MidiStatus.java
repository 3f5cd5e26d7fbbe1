package io.coolchords.midi;

import java.util.List;

/** The channel voice message types, identified by the upper nibble of the status byte */
public enum MidiStatus {
    NOTE_OFF(0x8),
    NOTE_ON(0x9),
    POLYPHONIC_PRESSURE(0xA),
    CONTROLLER(0xB),
    PROGRAM_CHANGE(0xC),
    CHANNEL_PRESSURE(0xD),
    PITCH_BEND(0xE),

    /** System messages (0xF_) and anything below 0x80 */
    UNKNOWN(-1);

    public final int nibble;

    MidiStatus(int nibble) {
        this.nibble = nibble;
    }

    private static final List<MidiStatus> NOTE_TYPES = List.of(NOTE_ON, NOTE_OFF);

    /**
     * @param status The whole status byte, channel included
     * @return The message type
     */
    public static MidiStatus fromStatusByte(int status) {
        int type = ByteFns.upperNibble(status);
        for (var subType : values()) {
            if (subType.nibble == type)
                return subType;
        }
        return UNKNOWN;
    }

    /** Status bytes of these types carry a note number as their first data byte */
    public boolean isNoteType() {
        return NOTE_TYPES.contains(this);
    }
}
