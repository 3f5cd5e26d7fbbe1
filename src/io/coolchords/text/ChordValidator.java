package io.coolchords.text;

import io.coolchords.theory.Chord;
import io.coolchords.theory.ChordBuilder;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Judges a typed chord name against the chord that was played.
 * <p>
 * Accepts alternative suffix spellings ("C Major", "Cmaj", "C"), flat or sharp roots ("Dbm7" for C#m7) and
 * slash chords for inversions ("C/E").
 */
public final class ChordValidator {
    private static final Pattern FLAT_AFTER_LETTER = Pattern.compile("[A-G][b♭]");

    private ChordValidator() {}

    /**
     * @param guess  The user's guess, may be null or empty (always incorrect)
     * @param target The chord to guess
     * @throws IllegalArgumentException When target is null
     */
    public static ChordValidationResult validate(String guess, Chord target) {
        if (target == null)
            throw new IllegalArgumentException("Cannot validate a guess without a target chord");

        String originalGuess = guess == null ? "" : guess.trim();
        String answerName = ChordBuilder.chordName(target.root(), target.quality(), target.inversion(), target.notes());

        String normalizedGuess = ChordNameNormalizer.normalize(originalGuess);
        String normalizedAnswer = ChordNameNormalizer.normalize(answerName);

        if (!normalizedGuess.isEmpty() && normalizedGuess.equals(normalizedAnswer)) {
            boolean isEnharmonic = FLAT_AFTER_LETTER.matcher(originalGuess).find() && answerName.contains("#");
            return new ChordValidationResult(true, normalizedGuess, normalizedAnswer, isEnharmonic, originalGuess, null);
        }

        if (haveEnharmonicRootsAndSameSuffix(normalizedGuess, normalizedAnswer)) {
            return new ChordValidationResult(true, normalizedGuess, normalizedAnswer, true, originalGuess, null);
        }

        return new ChordValidationResult(false, normalizedGuess, normalizedAnswer, false, originalGuess,
                "Incorrect. The correct answer is " + answerName + ".");
    }

    private static boolean haveEnharmonicRootsAndSameSuffix(String normalizedGuess, String normalizedAnswer) {
        Optional<ChordNameNormalizer.ParsedChordName> guess = ChordNameNormalizer.parse(normalizedGuess);
        Optional<ChordNameNormalizer.ParsedChordName> answer = ChordNameNormalizer.parse(normalizedAnswer);
        if (guess.isEmpty() || answer.isEmpty())
            return false;

        List<String> guessSpellings = ChordNameNormalizer.enharmonicEquivalents(guess.get().root());
        List<String> answerSpellings = ChordNameNormalizer.enharmonicEquivalents(answer.get().root());
        boolean enharmonicRoots = guessSpellings.stream().anyMatch(answerSpellings::contains);
        return enharmonicRoots && guess.get().suffix().equals(answer.get().suffix());
    }
}
