package io.coolchords.text;

import io.coolchords.theory.PitchClass;

import java.util.List;
import java.util.Optional;

/**
 * Turns free-text chord names into one canonical spelling.
 * <p>
 * Roots are spelled with sharps ("Db" becomes "C#", "Fb" becomes "E"), suffixes are mapped to their standard
 * form ("Minor" becomes "m", "ø7" becomes "m7♭5") and slash chords keep their bass note ("db/f" becomes "C#/F").
 * Unknown suffixes are kept as written.
 */
public final class ChordNameNormalizer {
    private ChordNameNormalizer() {}

    /** A chord name split into its canonical root and the (trimmed, not yet normalized) rest */
    public record ParsedChordName(PitchClass root, String suffix) {}

    /**
     * Normalizes a chord name.
     * <pre>
     * normalize("C Major")  -> "C"
     * normalize("f# minor") -> "F#m"
     * normalize("Db maj7")  -> "C#maj7"
     * normalize("C/E")      -> "C/E"
     * </pre>
     *
     * @return The canonical name, or "" when the text does not start with a note name
     */
    public static String normalize(String chordName) {
        if (chordName == null || chordName.isBlank())
            return "";

        int slash = chordName.indexOf('/');
        if (slash != -1) {
            String chordPart = normalize(chordName.substring(0, slash).trim());
            Optional<PitchClass> bass = normalizeNote(chordName.substring(slash + 1).trim());
            if (!chordPart.isEmpty() && bass.isPresent())
                return chordPart + "/" + bass.get().displayName();
            // not a slash chord after all, keep the slash as part of the suffix
        }

        Optional<ParsedChordName> parsed = parse(chordName);
        if (parsed.isEmpty())
            return "";

        PitchClass root = parsed.get().root();
        String suffix = parsed.get().suffix();
        String canonical = ChordNameAliases.canonicalSuffix(suffix);
        if (canonical != null)
            return root.displayName() + canonical;

        // an unknown suffix whose first letter would be read as part of the root next time ("C B7", "C b")
        if (ChordNameAliases.note(root.displayName() + suffix.charAt(0)) != null)
            return root.displayName() + " " + suffix;
        return root.displayName() + suffix;
    }

    /**
     * Splits a chord name into root and suffix, trying a two character root ("C#", "Db", "D♭") before a one
     * character root.
     *
     * @return The parts, or empty when the text does not start with a note name
     */
    public static Optional<ParsedChordName> parse(String chordName) {
        if (chordName == null)
            return Optional.empty();
        String trimmed = chordName.trim();
        if (trimmed.isEmpty())
            return Optional.empty();

        for (int rootLength : List.of(2, 1)) {
            if (trimmed.length() < rootLength)
                continue;
            PitchClass root = ChordNameAliases.note(trimmed.substring(0, rootLength));
            if (root != null)
                return Optional.of(new ParsedChordName(root, trimmed.substring(rootLength).trim()));
        }
        return Optional.empty();
    }

    /**
     * @param noteName A note name in any case with an optional accidental: "c", "DB", "E♭", "B#"
     * @return The pitch class, or empty when the text is not a note name
     */
    public static Optional<PitchClass> normalizeNote(String noteName) {
        if (noteName == null)
            return Optional.empty();
        return Optional.ofNullable(ChordNameAliases.note(noteName.trim()));
    }

    /**
     * The note itself plus its flat spelling for the five black keys: {@code C#} gives ["C#", "Db"], {@code C}
     * gives ["C"]. The theoretical spellings (B#, Cb, E#, Fb) are handled by {@link #normalizeNote(String)}.
     */
    public static List<String> enharmonicEquivalents(PitchClass note) {
        if (note.isNatural())
            return List.of(note.displayName());
        String flat = note.transpose(1).displayName() + "b";
        return List.of(note.displayName(), flat);
    }
}
