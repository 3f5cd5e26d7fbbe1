package io.coolchords.midi;

/**
 * Static functions for working with MIDI message bytes
 */
public class ByteFns {
    private ByteFns() {}

    /**
     * Converts a byte array into 2-digit hexadecimal representation.
     * For example, {0x90, 0x3C, 0x64} => 903C64
     *
     * @param buf the buffer to convert
     * @return an upper-case hexadecimal representation of the buffer
     */
    public static String toHex(byte[] buf) {
        var sb = new StringBuilder();
        for (byte b : buf) {
            sb.append(String.format("%02X", b));
        }
        return sb.toString();
    }

    /**
     * Parses the output of {@link #toHex(byte[])}, case-insensitive.
     * @throws IllegalArgumentException When the string has an odd length or a non-hex digit
     */
    public static byte[] fromHex(String hexString) {
        if (hexString.length() % 2 != 0) {
            throw new IllegalArgumentException("Hexstring must be a valid hexadecimal number (it's length must be even). " + hexString);
        }

        byte[] buf = new byte[hexString.length() / 2];
        int bp = 0;
        for (int i = 0; i <= hexString.length() - 2; i += 2) {
            buf[bp++] = (byte) Integer.parseUnsignedInt(hexString.substring(i, i + 2), 16);
        }
        return buf;
    }

    /** The byte as an int from 0 to 255 */
    public static int toUnsignedInt(byte b) {
        return b & 0xFF;
    }

    /** Upper nibble of a status byte: the message type, e.g. 0x9 for note on */
    public static int upperNibble(int status) {
        return (status >> 4) & 0xF;
    }

    /** Lower nibble of a status byte: the channel, 0 to 15 */
    public static int lowerNibble(int status) {
        return status & 0xF;
    }
}
