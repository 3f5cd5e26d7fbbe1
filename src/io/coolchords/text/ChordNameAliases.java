package io.coolchords.text;

import io.coolchords.theory.PitchClass;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lookup tables for the spellings of chord suffixes and note names.
 * <p>
 * Suffix aliases are grouped by the canonical suffix they stand for. A case-insensitive index is derived
 * from them when the tables are built, leaving out the upper-case shorthands ("M", "M7", ...) whose lower-case
 * forms mean minor.
 */
final class ChordNameAliases {
    private ChordNameAliases() {}

    private static final Set<String> CASE_SENSITIVE = Set.of("M", "M7", "M9", "M11", "M13");

    /** canonical suffix -> its other spellings */
    private static final Map<String, List<String>> SUFFIX_GROUPS = new LinkedHashMap<>();

    static {
        group("", "major", "maj", "M");
        group("m", "minor", "min", "-");
        group("dim", "diminished", "dimin", "o", "°");
        group("aug", "augmented", "+");

        group("maj7", "major7", "major 7", "M7");
        group("m7", "min7", "minor7", "minor 7", "-7");
        group("7", "dom7", "dominant7", "dominant 7");
        group("dim7", "diminished7", "diminished 7", "o7", "°7");
        group("m7♭5", "m7b5", "min7b5", "min7♭5", "-7b5", "halfdiminished7", "half diminished 7", "half-diminished", "ø7", "ø");

        group("maj9", "major9", "major 9", "M9");
        group("m9", "min9", "minor9", "minor 9", "-9");
        group("9", "dom9", "dominant9", "dominant 9");

        group("maj11", "major11", "major 11", "M11");
        group("m11", "min11", "minor11", "minor 11", "-11");
        group("11", "dom11", "dominant11", "dominant 11");

        group("maj13", "major13", "major 13", "M13");
        group("m13", "min13", "minor13", "minor 13", "-13");
        group("13", "dom13", "dominant13", "dominant 13");

        group("sus2", "suspended2", "suspended 2");
        group("sus4", "suspended4", "suspended 4", "sus");

        group("add9", "add 9");
        group("add11", "add 11");
        group("madd9", "minoradd9", "minor add9", "minor add 9");
    }

    private static void group(String canonical, String... aliases) {
        SUFFIX_GROUPS.put(canonical, List.of(aliases));
    }

    private static final Map<String, String> SUFFIXES = new HashMap<>();
    private static final Map<String, String> SUFFIXES_IGNORE_CASE = new HashMap<>();

    static {
        for (var entry : SUFFIX_GROUPS.entrySet()) {
            String canonical = entry.getKey();
            SUFFIXES.put(canonical, canonical);
            SUFFIXES_IGNORE_CASE.putIfAbsent(canonical.toLowerCase(Locale.ROOT), canonical);
            for (var alias : entry.getValue()) {
                SUFFIXES.put(alias, canonical);
                if (!CASE_SENSITIVE.contains(alias))
                    SUFFIXES_IGNORE_CASE.putIfAbsent(alias.toLowerCase(Locale.ROOT), canonical);
            }
        }
    }

    /** spelling ("Db", "D♭", "B#") -> pitch class, keys with an upper-case letter and lower-case accidental */
    private static final Map<String, PitchClass> NOTES;

    static {
        var notes = new HashMap<String, PitchClass>();
        for (var natural : PitchClass.NATURALS) {
            String letter = natural.displayName();
            notes.put(letter, natural);
            for (var sharp : List.of("#", "♯"))
                notes.put(letter + sharp, natural.transpose(1));
            for (var flat : List.of("b", "♭"))
                notes.put(letter + flat, natural.transpose(-1));
        }
        NOTES = Collections.unmodifiableMap(notes);
    }

    /** The canonical spelling of a suffix, or null when it is not a known alias */
    static String canonicalSuffix(String suffix) {
        String canonical = SUFFIXES.get(suffix);
        if (canonical == null)
            canonical = SUFFIXES_IGNORE_CASE.get(suffix.toLowerCase(Locale.ROOT));
        return canonical;
    }

    /**
     * @param spelling A note name in any case, e.g. "db", "C#", "E♭"
     * @return The pitch class, or null
     */
    static PitchClass note(String spelling) {
        if (spelling.isEmpty())
            return null;
        String normalized = spelling.substring(0, 1).toUpperCase(Locale.ROOT) + spelling.substring(1).toLowerCase(Locale.ROOT);
        return NOTES.get(normalized);
    }
}
