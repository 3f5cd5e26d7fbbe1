package io.coolchords.theory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Constraints on the chords a {@link ChordSampler} may pick.
 *
 * @param qualities         Allowed qualities, at least one
 * @param rootNotes         Allowed roots, or null for all 12
 * @param octaves           Allowed root-position octaves, at least one, each 1 to 8
 * @param includeInversions Whether inverted voicings may be picked
 * @param keyFilter         When set, only chords whose every tone is in this key, otherwise null
 */
public record ChordFilter(List<ChordQuality> qualities,
                          List<PitchClass> rootNotes,
                          List<Integer> octaves,
                          boolean includeInversions,
                          KeyFilter keyFilter) {

    /**
     * Identifies filters that enumerate the same chords regardless of the order (or repetition) of their lists.
     * A null root list (all roots) is a different key than an explicit list of all 12.
     */
    public record CacheKey(List<ChordQuality> qualities,
                           List<PitchClass> rootNotes,
                           List<Integer> octaves,
                           boolean includeInversions,
                           KeyFilter keyFilter) {}

    public ChordFilter {
        if (qualities == null || qualities.isEmpty())
            throw new IllegalArgumentException("A chord filter needs at least one chord quality");
        if (octaves == null || octaves.isEmpty())
            throw new IllegalArgumentException("A chord filter needs at least one octave");
        for (var octave : octaves) {
            if (octave == null || !PitchedNote.isValidOctave(octave))
                throw new IllegalArgumentException("Filter octaves must be between " + PitchedNote.MIN_OCTAVE
                        + " and " + PitchedNote.MAX_OCTAVE + ": " + octaves);
        }
        if (qualities.stream().anyMatch(Objects::isNull))
            throw new IllegalArgumentException("Filter qualities cannot contain null: " + qualities);
        if (rootNotes != null && rootNotes.stream().anyMatch(Objects::isNull))
            throw new IllegalArgumentException("Filter root notes cannot contain null: " + rootNotes);
        if (rootNotes != null && rootNotes.isEmpty())
            throw new IllegalArgumentException("An explicit root list needs at least one root, use null for all roots");

        qualities = List.copyOf(qualities);
        rootNotes = rootNotes == null ? null : List.copyOf(rootNotes);
        octaves = List.copyOf(octaves);
    }

    /** A filter over all roots, without inversions or key */
    public static ChordFilter of(Collection<ChordQuality> qualities, Collection<Integer> octaves) {
        return new ChordFilter(new ArrayList<>(qualities), null, new ArrayList<>(octaves), false, null);
    }

    public ChordFilter withRootNotes(Collection<PitchClass> roots) {
        return new ChordFilter(qualities, roots == null ? null : new ArrayList<>(roots), octaves, includeInversions, keyFilter);
    }

    public ChordFilter withInversions(boolean include) {
        return new ChordFilter(qualities, rootNotes, octaves, include, keyFilter);
    }

    public ChordFilter withKeyFilter(KeyFilter key) {
        return new ChordFilter(qualities, rootNotes, octaves, includeInversions, key);
    }

    public boolean allowsAllRoots() {
        return rootNotes == null;
    }

    /** The allowed roots in chromatic order, all 12 when unrestricted */
    public List<PitchClass> effectiveRootNotes() {
        return allowsAllRoots() ? List.of(PitchClass.values()) : rootNotes.stream().distinct().sorted().toList();
    }

    public CacheKey cacheKey() {
        return new CacheKey(
                qualities.stream().distinct().sorted().toList(),
                allowsAllRoots() ? null : effectiveRootNotes(),
                octaves.stream().distinct().sorted().toList(),
                includeInversions,
                keyFilter);
    }

    @Override
    public String toString() {
        return "ChordFilter{" +
                "qualities=" + qualities +
                ", rootNotes=" + (allowsAllRoots() ? "all" : rootNotes) +
                ", octaves=" + octaves +
                ", includeInversions=" + includeInversions +
                ", keyFilter=" + (keyFilter == null ? "none" : keyFilter) +
                '}';
    }
}
