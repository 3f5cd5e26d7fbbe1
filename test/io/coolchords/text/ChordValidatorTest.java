package io.coolchords.text;

import io.coolchords.theory.Chord;
import io.coolchords.theory.ChordBuilder;
import io.coolchords.theory.ChordQuality;
import io.coolchords.theory.PitchClass;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChordValidatorTest {
    private static final Chord C_SHARP_MAJ7 = ChordBuilder.build(PitchClass.C_SHARP, ChordQuality.MAJOR7, 4);
    private static final Chord C_MAJOR = ChordBuilder.build(PitchClass.C, ChordQuality.MAJOR, 4);

    @Test
    void flatSpellingIsCorrectAndEnharmonic() {
        ChordValidationResult result = ChordValidator.validate("Db maj7", C_SHARP_MAJ7);
        assertTrue(result.isCorrect());
        assertTrue(result.isEnharmonic());
        assertEquals("C#maj7", result.normalizedGuess());
        assertEquals("C#maj7", result.normalizedAnswer());
        assertEquals("Db maj7", result.originalGuess());
        assertTrue(result.feedbackMessage().isEmpty());

        assertTrue(ChordValidator.validate("D♭M7", C_SHARP_MAJ7).isEnharmonic());
    }

    @Test
    void sharpSpellingIsNotEnharmonic() {
        ChordValidationResult result = ChordValidator.validate("C#maj7", C_SHARP_MAJ7);
        assertTrue(result.isCorrect());
        assertFalse(result.isEnharmonic());
    }

    @Test
    void alternativeSpellingsAreCorrect() {
        for (var guess : new String[]{"C", "C Major", "Cmaj", "cM", "  c major  "}) {
            ChordValidationResult result = ChordValidator.validate(guess, C_MAJOR);
            assertTrue(result.isCorrect(), guess);
            assertFalse(result.isEnharmonic(), guess);
        }
    }

    @Test
    void wrongGuessGetsFeedback() {
        ChordValidationResult result = ChordValidator.validate("Cm", C_MAJOR);
        assertFalse(result.isCorrect());
        assertEquals("Incorrect. The correct answer is C.", result.feedback());
        assertEquals("Incorrect. The correct answer is C#maj7.",
                ChordValidator.validate("C#7", C_SHARP_MAJ7).feedbackMessage().orElseThrow());
    }

    @Test
    void whenGuessEmpty_thenIncorrect() {
        assertFalse(ChordValidator.validate("", C_MAJOR).isCorrect());
        assertFalse(ChordValidator.validate("   ", C_MAJOR).isCorrect());
        ChordValidationResult result = ChordValidator.validate(null, C_MAJOR);
        assertFalse(result.isCorrect());
        assertEquals("", result.originalGuess());
        assertEquals("", result.normalizedGuess());
    }

    @Test
    void inversionsNeedTheBassNote() {
        Chord firstInversion = ChordBuilder.build(PitchClass.C, ChordQuality.MAJOR, 4, 1);
        assertTrue(ChordValidator.validate("C/E", firstInversion).isCorrect());
        assertTrue(ChordValidator.validate("C major / e", firstInversion).isCorrect());
        assertFalse(ChordValidator.validate("C", firstInversion).isCorrect());
        assertEquals("Incorrect. The correct answer is C/E.", ChordValidator.validate("C", firstInversion).feedback());

        Chord g7 = ChordBuilder.build(PitchClass.G, ChordQuality.DOMINANT7, 3, 1);
        assertTrue(ChordValidator.validate("G7/B", g7).isCorrect());
    }

    @Test
    void flatBassNoteIsEnharmonic() {
        Chord gSharpFirstInversion = ChordBuilder.build(PitchClass.G_SHARP, ChordQuality.MAJOR, 3, 1);
        assertEquals("G#/C", gSharpFirstInversion.name());
        ChordValidationResult result = ChordValidator.validate("Ab/C", gSharpFirstInversion);
        assertTrue(result.isCorrect());
        assertTrue(result.isEnharmonic());
    }

    @Test
    void whenTargetNull_thenThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ChordValidator.validate("C", null));
    }
}
