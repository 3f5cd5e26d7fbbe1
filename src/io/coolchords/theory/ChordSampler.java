package io.coolchords.theory;

import io.coolchords.exceptions.InvalidInversionException;
import io.coolchords.exceptions.NoValidChordsException;
import io.coolchords.exceptions.OctaveOutOfRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Picks random chords that satisfy a {@link ChordFilter}.
 * <p>
 * The candidates of each distinct filter are enumerated once and cached until {@link #clearCache()}.
 * Every candidate is equally likely to be picked. Safe for concurrent use: a filter's candidates are
 * computed at most once, and readers never see a partially filled list.
 */
public class ChordSampler {
    private static final Logger LOGGER = Logger.getLogger(ChordSampler.class.getName());

    private final Map<ChordFilter.CacheKey, List<Chord>> cache = new ConcurrentHashMap<>();
    private final Random random;

    public ChordSampler() {
        this(new Random());
    }

    /** @param random The source of randomness, seeded for reproducible picks */
    public ChordSampler(Random random) {
        this.random = random;
    }

    /**
     * Picks one chord uniformly at random among all chords allowed by the filter.
     * @throws NoValidChordsException When the filter allows no chord at all
     */
    public Chord sampleRandom(ChordFilter filter) {
        List<Chord> candidates = candidates(filter);
        return candidates.get(random.nextInt(candidates.size()));
    }

    /**
     * All chords allowed by the filter, in quality, root, octave, inversion order.
     * @return An unmodifiable, non-empty list
     * @throws NoValidChordsException When the filter allows no chord at all
     */
    public List<Chord> candidates(ChordFilter filter) {
        // computeIfAbsent records nothing when enumerate throws
        return cache.computeIfAbsent(filter.cacheKey(), ChordSampler::enumerate);
    }

    public void clearCache() {
        LOGGER.log(Level.FINE, "Clearing {0} cached chord filter(s)", cache.size());
        cache.clear();
    }

    public int cachedFilterCount() {
        return cache.size();
    }

    private static List<Chord> enumerate(ChordFilter.CacheKey key) {
        List<PitchClass> roots = key.rootNotes() == null ? List.of(PitchClass.values()) : key.rootNotes();
        var chords = new ArrayList<Chord>();
        for (var quality : key.qualities()) {
            int inversions = key.includeInversions() ? quality.noteCount() : 1;
            for (var root : roots) {
                if (key.keyFilter() != null && !key.keyFilter().admits(root, quality)) {
                    continue;
                }
                for (int octave : key.octaves()) {
                    for (int inversion = 0; inversion < inversions; inversion++) {
                        buildOrSkip(root, quality, octave, inversion, chords);
                    }
                }
            }
        }

        if (chords.isEmpty()) {
            throw new NoValidChordsException("No chords match the filter, adjust your filters: " + key);
        }
        LOGGER.log(Level.FINE, "Enumerated {0} chords for {1}", new Object[]{chords.size(), key});
        return Collections.unmodifiableList(chords);
    }

    /** Chords that would leave octaves 1 to 8 are not candidates */
    private static void buildOrSkip(PitchClass root, ChordQuality quality, int octave, int inversion, List<Chord> out) {
        try {
            out.add(ChordBuilder.build(root, quality, octave, inversion));
        } catch (OctaveOutOfRangeException | InvalidInversionException e) {
            LOGGER.log(Level.FINEST, "Skipping {0}{1} at octave {2}, inversion {3}: {4}",
                    new Object[]{root, quality.suffix(), octave, inversion, e.getMessage()});
        }
    }
}
