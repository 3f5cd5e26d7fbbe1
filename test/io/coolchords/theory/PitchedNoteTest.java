package io.coolchords.theory;

import io.coolchords.exceptions.OctaveOutOfRangeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PitchedNoteTest {
    @Test
    void pitchClassIndexAndTransposeWork() {
        assertEquals(0, PitchClass.C.index());
        assertEquals(11, PitchClass.B.index());
        assertEquals(PitchClass.C, PitchClass.fromIndex(12));
        assertEquals(PitchClass.B, PitchClass.fromIndex(-1));
        assertEquals(PitchClass.D_SHARP, PitchClass.C.transpose(3));
        assertEquals(PitchClass.A_SHARP, PitchClass.C.transpose(-2));
        assertEquals("F#", PitchClass.F_SHARP.toString());
        assertEquals(7, PitchClass.NATURALS.size());
        assertTrue(PitchClass.NATURALS.stream().allMatch(PitchClass::isNatural));
        assertFalse(PitchClass.G_SHARP.isNatural());
    }

    @Test
    void fromDisplayNameOnlyAcceptsSharps() {
        assertEquals(PitchClass.C_SHARP, PitchClass.fromDisplayName("C#"));
        assertThrows(IllegalArgumentException.class, () -> PitchClass.fromDisplayName("Db"));
        assertThrows(IllegalArgumentException.class, () -> PitchClass.fromDisplayName("H"));
    }

    @Test
    void whenOctaveOutOfRange_thenThrowsException() {
        assertThrows(OctaveOutOfRangeException.class, () -> new PitchedNote(PitchClass.C, 0));
        assertThrows(OctaveOutOfRangeException.class, () -> new PitchedNote(PitchClass.C, 9));
        assertThrows(IllegalArgumentException.class, () -> new PitchedNote(null, 4));
        assertDoesNotThrow(() -> new PitchedNote(PitchClass.B, 8));
    }

    @Test
    void orderingIsOctaveThenPitchClass() {
        var notes = new ArrayList<>(List.of(
                PitchedNote.of(PitchClass.C, 5),
                PitchedNote.of(PitchClass.B, 4),
                PitchedNote.of(PitchClass.E, 4)));
        Collections.sort(notes);
        assertEquals("[E4, B4, C5]", notes.toString());
        assertTrue(PitchedNote.of(PitchClass.B, 4).semitone() < PitchedNote.of(PitchClass.C, 5).semitone());
    }

    @Test
    void parseWorks() {
        assertEquals(PitchedNote.of(PitchClass.C_SHARP, 4), PitchedNote.parse("C#4"));
        assertEquals(PitchedNote.of(PitchClass.A, 8), PitchedNote.parse("a8"));
        assertThrows(IllegalArgumentException.class, () -> PitchedNote.parse("C"));
        assertThrows(IllegalArgumentException.class, () -> PitchedNote.parse("44"));
        assertThrows(OctaveOutOfRangeException.class, () -> PitchedNote.parse("C0"));
    }
}
