package io.coolchords.text;

import java.util.Optional;

/**
 * The verdict on a chord name guess.
 *
 * @param isCorrect        Whether the guess names the chord
 * @param normalizedGuess  The guess after normalization, "" when it could not be parsed
 * @param normalizedAnswer The correct answer after normalization
 * @param isEnharmonic     Whether the guess was right but spelled with flats where the answer uses sharps
 * @param originalGuess    The guess as typed, trimmed
 * @param feedback         A message for incorrect guesses, null for correct ones
 */
public record ChordValidationResult(boolean isCorrect,
                                    String normalizedGuess,
                                    String normalizedAnswer,
                                    boolean isEnharmonic,
                                    String originalGuess,
                                    String feedback) {

    public Optional<String> feedbackMessage() {
        return Optional.ofNullable(feedback);
    }
}
