package io.coolchords.theory;

import io.coolchords.exceptions.NoValidChordsException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ChordSamplerTest {
    private static final ChordFilter TRIADS = ChordFilter.of(List.of(ChordQuality.MAJOR, ChordQuality.MINOR), List.of(3, 4));

    @Test
    void candidatesCoverEveryCombination() {
        var sampler = new ChordSampler();
        // 2 qualities x 12 roots x 2 octaves
        assertEquals(48, sampler.candidates(TRIADS).size());
        assertEquals(144, sampler.candidates(TRIADS.withInversions(true)).size());
    }

    @Test
    void sampledChordsSatisfyTheFilter() {
        var filter = new ChordFilter(List.of(ChordQuality.DOMINANT7, ChordQuality.SUS2),
                List.of(PitchClass.D, PitchClass.A), List.of(2, 5), true, null);
        var sampler = new ChordSampler(new Random(42));
        for (int i = 0; i < 200; i++) {
            Chord chord = sampler.sampleRandom(filter);
            assertTrue(filter.qualities().contains(chord.quality()));
            assertTrue(filter.rootNotes().contains(chord.root()));
            assertTrue(filter.octaves().stream().anyMatch(o ->
                    ChordBuilder.build(chord.root(), chord.quality(), o, chord.inversion()).equals(chord)), chord.toString());
        }
    }

    @Test
    void withoutInversionsOnlyRootPositionsAreSampled() {
        var sampler = new ChordSampler(new Random(7));
        for (int i = 0; i < 100; i++) {
            assertEquals(0, sampler.sampleRandom(TRIADS).inversion());
        }
    }

    @Test
    void keyFilterKeepsDiatonicChords() {
        var filter = TRIADS.withKeyFilter(new KeyFilter(PitchClass.C, ScaleMode.MAJOR)).withRootNotes(null);
        var candidates = new ChordSampler().candidates(filter.withInversions(false));
        var names = candidates.stream().map(Chord::name).distinct().toList();
        assertEquals(List.of("C", "F", "G", "Dm", "Em", "Am"), names);

        var minorKey = ChordFilter.of(List.of(ChordQuality.DIMINISHED), List.of(4))
                .withKeyFilter(new KeyFilter(PitchClass.A, ScaleMode.MINOR));
        assertEquals(List.of("Bdim"), new ChordSampler().candidates(minorKey).stream().map(Chord::name).toList());
    }

    @Test
    void unbuildableCombinationsAreSkipped() {
        var filter = ChordFilter.of(List.of(ChordQuality.MAJOR), List.of(8)).withInversions(true);
        var candidates = new ChordSampler().candidates(filter);
        assertTrue(candidates.stream().allMatch(ChordBuilder::isWellFormed));
        // C8 E8 G8 fits, its first inversion does not
        assertTrue(candidates.contains(ChordBuilder.build(PitchClass.C, ChordQuality.MAJOR, 8)));
        assertTrue(candidates.stream().noneMatch(c -> c.root() == PitchClass.C && c.inversion() > 0));
    }

    @Test
    void whenNothingMatches_thenThrowsAndCachesNothing() {
        var sampler = new ChordSampler();
        var tooHigh = ChordFilter.of(List.of(ChordQuality.MAJOR13), List.of(8));
        assertThrows(NoValidChordsException.class, () -> sampler.sampleRandom(tooHigh));

        var notInKey = ChordFilter.of(List.of(ChordQuality.AUGMENTED), List.of(4))
                .withKeyFilter(new KeyFilter(PitchClass.C, ScaleMode.MAJOR));
        assertThrows(NoValidChordsException.class, () -> sampler.candidates(notInKey));
        assertEquals(0, sampler.cachedFilterCount());
    }

    @Test
    void cacheIgnoresListOrderAndDuplicates() {
        var sampler = new ChordSampler();
        var a = new ChordFilter(List.of(ChordQuality.MINOR, ChordQuality.MAJOR), List.of(PitchClass.G, PitchClass.C),
                List.of(4, 3), false, null);
        var b = new ChordFilter(List.of(ChordQuality.MAJOR, ChordQuality.MINOR, ChordQuality.MAJOR),
                List.of(PitchClass.C, PitchClass.G), List.of(3, 4, 4), false, null);
        assertEquals(a.cacheKey(), b.cacheKey());
        assertSame(sampler.candidates(a), sampler.candidates(b));
        assertEquals(1, sampler.cachedFilterCount());
    }

    @Test
    void allRootsAndExplicitTwelveRootsAreDifferentKeys() {
        var sampler = new ChordSampler();
        var explicit = TRIADS.withRootNotes(List.of(PitchClass.values()));
        assertNotEquals(TRIADS.cacheKey(), explicit.cacheKey());
        assertEquals(sampler.candidates(TRIADS), sampler.candidates(explicit));
        assertEquals(2, sampler.cachedFilterCount());
    }

    @Test
    void clearCacheWorks() {
        var sampler = new ChordSampler();
        List<Chord> first = sampler.candidates(TRIADS);
        assertEquals(1, sampler.cachedFilterCount());
        sampler.clearCache();
        assertEquals(0, sampler.cachedFilterCount());
        List<Chord> second = sampler.candidates(TRIADS);
        assertNotSame(first, second);
        assertEquals(first, second);
    }

    @Test
    void sameSeedGivesSameChords() {
        var a = new ChordSampler(new Random(1234));
        var b = new ChordSampler(new Random(1234));
        for (int i = 0; i < 20; i++) {
            assertEquals(a.sampleRandom(TRIADS), b.sampleRandom(TRIADS));
        }
    }

    @Test
    void concurrentCallersShareOneEnumeration() throws Exception {
        var sampler = new ChordSampler();
        var filter = TRIADS.withInversions(true);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<List<Chord>>>();
            for (int i = 0; i < 32; i++) {
                tasks.add(() -> {
                    sampler.sampleRandom(filter);
                    return sampler.candidates(filter);
                });
            }
            List<Future<List<Chord>>> results = executor.invokeAll(tasks);
            List<Chord> first = results.get(0).get();
            for (var result : results) {
                assertSame(first, result.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, sampler.cachedFilterCount());
    }

    @Test
    void whenFilterInvalid_thenThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ChordFilter.of(List.of(), List.of(4)));
        assertThrows(IllegalArgumentException.class, () -> ChordFilter.of(List.of(ChordQuality.MAJOR), List.of()));
        assertThrows(IllegalArgumentException.class, () -> ChordFilter.of(List.of(ChordQuality.MAJOR), List.of(9)));
        assertThrows(IllegalArgumentException.class, () -> TRIADS.withRootNotes(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new KeyFilter(null, ScaleMode.MAJOR));
    }

    @Test
    void whenFilterListsContainNull_thenThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChordFilter(Arrays.asList(ChordQuality.MAJOR, null), null, List.of(4), false, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ChordFilter(List.of(ChordQuality.MAJOR), Arrays.asList(PitchClass.C, null), List.of(4), false, null));
        assertThrows(IllegalArgumentException.class,
                () -> new ChordFilter(List.of(ChordQuality.MAJOR), null, Arrays.asList(4, null), false, null));
        assertThrows(IllegalArgumentException.class,
                () -> ChordFilter.of(Arrays.asList(ChordQuality.MINOR, null), List.of(4)));
        assertThrows(IllegalArgumentException.class, () -> TRIADS.withRootNotes(Arrays.asList(PitchClass.D, null)));
    }

    @Test
    void keyFilterScaleWorks() {
        assertEquals(Set.of(PitchClass.A, PitchClass.B, PitchClass.C, PitchClass.D, PitchClass.E, PitchClass.F, PitchClass.G),
                new KeyFilter(PitchClass.A, ScaleMode.MINOR).scale());
        assertEquals(ScaleMode.MINOR, ScaleMode.fromKey("Minor"));
        assertThrows(IllegalArgumentException.class, () -> ScaleMode.fromKey("dorian"));
    }
}
