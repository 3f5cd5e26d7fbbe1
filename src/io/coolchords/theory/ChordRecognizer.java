package io.coolchords.theory;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Names the chord formed by an unordered set of notes.
 * <p>
 * Every quality (in declaration order) and every note as a candidate root is tried; the first pair whose
 * pitch-class intervals equal the quality's formula (both reduced mod 12 and sorted) wins. Because the search
 * order is fixed, a note set that fits several chords always gets the same name. Two consequences worth
 * knowing:
 * <ul>
 *     <li>a sus4 chord is also a sus2 chord on its fourth: C F G is named Fsus2/C</li>
 *     <li>a dominant 13th is also a major 13th on its fourth: C13 is named Fmaj13/C</li>
 * </ul>
 */
public final class ChordRecognizer {
    private static final Map<ChordQuality, int[]> REDUCED_FORMULAS = new EnumMap<>(ChordQuality.class);

    static {
        for (var quality : ChordQuality.values()) {
            REDUCED_FORMULAS.put(quality, quality.formula().stream()
                    .mapToInt(i -> i % PitchClass.COUNT)
                    .sorted()
                    .toArray());
        }
    }

    private ChordRecognizer() {}

    /**
     * @param notes The notes, in any order
     * @return The chord, with its notes sorted ascending, or empty when the notes do not form a known chord
     * @throws IllegalArgumentException When notes or one of its elements is null
     */
    public static Optional<Chord> identify(Collection<PitchedNote> notes) {
        if (notes == null || notes.stream().anyMatch(Objects::isNull))
            throw new IllegalArgumentException("Cannot identify a chord from null notes");
        if (notes.isEmpty())
            return Optional.empty();

        List<PitchedNote> sorted = ChordInversions.sorted(List.copyOf(notes));
        for (var entry : REDUCED_FORMULAS.entrySet()) {
            int[] formula = entry.getValue();
            if (formula.length != sorted.size())
                continue;

            for (int rootPosition = 0; rootPosition < sorted.size(); rootPosition++) {
                if (Arrays.equals(formula, reducedIntervals(sorted, rootPosition))) {
                    ChordQuality quality = entry.getKey();
                    PitchClass root = sorted.get(rootPosition).pitchClass();
                    int inversion = rootPosition == 0 ? 0 : sorted.size() - rootPosition;
                    return Optional.of(new Chord(root, quality, sorted, inversion,
                            ChordBuilder.chordName(root, quality, inversion, sorted)));
                }
            }
        }

        return Optional.empty();
    }

    /**
     * Semitone distance of every note from the note at {@code rootPosition}, reduced to 0..11 and sorted.
     */
    static int[] reducedIntervals(List<PitchedNote> sortedNotes, int rootPosition) {
        int rootSemitone = sortedNotes.get(rootPosition).semitone();
        int[] intervals = new int[sortedNotes.size()];
        for (int i = 0; i < intervals.length; i++) {
            PitchedNote note = sortedNotes.get((rootPosition + i) % intervals.length);
            intervals[i] = Math.floorMod(note.semitone() - rootSemitone, PitchClass.COUNT);
        }
        Arrays.sort(intervals);
        return intervals;
    }
}
