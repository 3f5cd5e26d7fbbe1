package io.coolchords.theory;

import java.util.List;

/**
 * The 12 chromatic pitch classes, always spelled with sharps.
 * Flat spellings only exist at the text boundary (see {@link io.coolchords.text.ChordNameNormalizer}).
 */
public enum PitchClass {
    C("C"),
    C_SHARP("C#"),
    D("D"),
    D_SHARP("D#"),
    E("E"),
    F("F"),
    F_SHARP("F#"),
    G("G"),
    G_SHARP("G#"),
    A("A"),
    A_SHARP("A#"),
    B("B");

    public static final int COUNT = 12;

    private static final PitchClass[] BY_INDEX = values();

    /** The white keys of a piano keyboard */
    public static final List<PitchClass> NATURALS = List.of(C, D, E, F, G, A, B);

    private final String displayName;

    PitchClass(String displayName) {
        this.displayName = displayName;
    }

    /** Position in the chromatic scale starting from C, 0 to 11 */
    public int index() {
        return ordinal();
    }

    public String displayName() {
        return displayName;
    }

    public boolean isNatural() {
        return displayName.length() == 1;
    }

    /**
     * @param index Any integer, wrapped around the 12-cycle (negative values included)
     */
    public static PitchClass fromIndex(int index) {
        return BY_INDEX[Math.floorMod(index, COUNT)];
    }

    /** The pitch class {@code semitones} above (or below, when negative) this one */
    public PitchClass transpose(int semitones) {
        return fromIndex(index() + semitones);
    }

    /**
     * Looks up a canonical sharp spelling ("C", "F#").
     * @throws IllegalArgumentException When the name is not one of the 12 canonical spellings
     */
    public static PitchClass fromDisplayName(String name) {
        for (var pc : BY_INDEX) {
            if (pc.displayName.equals(name))
                return pc;
        }
        throw new IllegalArgumentException("Not a canonical pitch class name: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
