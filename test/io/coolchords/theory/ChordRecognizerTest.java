package io.coolchords.theory;

import io.coolchords.exceptions.OctaveOutOfRangeException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ChordRecognizerTest {
    private static List<PitchedNote> notes(String... names) {
        return Arrays.stream(names).map(PitchedNote::parse).toList();
    }

    @Test
    void identifyFirstInversionWorks() {
        Chord chord = ChordRecognizer.identify(notes("E4", "G4", "C5")).orElseThrow();
        assertEquals(PitchClass.C, chord.root());
        assertEquals(ChordQuality.MAJOR, chord.quality());
        assertEquals(1, chord.inversion());
        assertEquals("C/E", chord.name());
    }

    @Test
    void identifyAcceptsImmutableCollections() {
        var e4 = PitchedNote.of(PitchClass.E, 4);
        var g4 = PitchedNote.of(PitchClass.G, 4);
        var c5 = PitchedNote.of(PitchClass.C, 5);

        assertEquals("C/E", ChordRecognizer.identify(List.of(e4, g4, c5)).orElseThrow().name());
        assertEquals("C/E", ChordRecognizer.identify(List.copyOf(List.of(c5, e4, g4))).orElseThrow().name());
        assertEquals("C/E", ChordRecognizer.identify(Set.of(g4, c5, e4)).orElseThrow().name());

        Chord built = ChordBuilder.build(PitchClass.C, ChordQuality.MAJOR, 4);
        assertEquals(Optional.of(built), ChordRecognizer.identify(built.notes()));
        assertTrue(ChordRecognizer.identify(List.of(e4)).isEmpty());
    }

    @Test
    void inputOrderDoesNotMatter() {
        Chord chord = ChordRecognizer.identify(notes("F4", "G3", "D4", "B3")).orElseThrow();
        assertEquals("G7", chord.name());
        assertEquals(notes("G3", "B3", "D4", "F4"), chord.notes());
    }

    @Test
    void identifyRootPositionReturnsTheBuiltChord() {
        for (var quality : ChordQuality.values()) {
            if (quality == ChordQuality.SUS4 || quality == ChordQuality.DOMINANT13)
                continue;
            for (var root : PitchClass.values()) {
                for (int octave = PitchedNote.MIN_OCTAVE; octave <= PitchedNote.MAX_OCTAVE; octave++) {
                    Chord built;
                    try {
                        built = ChordBuilder.build(root, quality, octave);
                    } catch (OctaveOutOfRangeException e) {
                        continue;
                    }
                    assertEquals(Optional.of(built), ChordRecognizer.identify(built.notes()), built.toString());
                }
            }
        }
    }

    @Test
    void sus4IsReadAsSus2OnItsFourth() {
        Chord gsus4 = ChordBuilder.build(PitchClass.G, ChordQuality.SUS4, 4);
        assertEquals(notes("G4", "C5", "D5"), gsus4.notes());

        Chord chord = ChordRecognizer.identify(gsus4.notes()).orElseThrow();
        assertEquals(ChordQuality.SUS2, chord.quality());
        assertEquals(PitchClass.C, chord.root());
        assertEquals(2, chord.inversion());
        assertEquals("Csus2/G", chord.name());

        assertEquals("Fsus2/C", ChordRecognizer.identify(ChordBuilder.build(PitchClass.C, ChordQuality.SUS4, 4).notes())
                .orElseThrow().name());
    }

    @Test
    void dominant13IsReadAsMajor13OnItsFourth() {
        Chord c13 = ChordBuilder.build(PitchClass.C, ChordQuality.DOMINANT13, 4);
        Chord chord = ChordRecognizer.identify(c13.notes()).orElseThrow();
        assertEquals(ChordQuality.MAJOR13, chord.quality());
        assertEquals(PitchClass.F, chord.root());
        assertEquals(2, chord.inversion());
        assertEquals("Fmaj13/C", chord.name());
    }

    @Test
    void whenNotesFormNoChord_thenReturnsEmpty() {
        assertTrue(ChordRecognizer.identify(List.of()).isEmpty());
        assertTrue(ChordRecognizer.identify(notes("C4", "C#4", "D4")).isEmpty());
        assertTrue(ChordRecognizer.identify(notes("C4")).isEmpty());
        assertTrue(ChordRecognizer.identify(notes("C4", "G4")).isEmpty());
    }

    @Test
    void whenGivenNull_thenThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ChordRecognizer.identify(null));
        var withNull = new ArrayList<PitchedNote>();
        withNull.add(PitchedNote.parse("C4"));
        withNull.add(null);
        assertThrows(IllegalArgumentException.class, () -> ChordRecognizer.identify(withNull));
    }
}
