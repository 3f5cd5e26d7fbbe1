package io.coolchords.theory;

import java.util.Set;

/**
 * Restricts chords to those diatonic to a key: every chord tone must belong to the scale.
 */
public record KeyFilter(PitchClass tonic, ScaleMode mode) {
    public KeyFilter {
        if (tonic == null || mode == null)
            throw new IllegalArgumentException("A key filter needs a tonic and a scale");
    }

    public Set<PitchClass> scale() {
        return mode.pitchClasses(tonic);
    }

    /** Whether every tone of {@code quality} built on {@code root} lies in the scale */
    public boolean admits(PitchClass root, ChordQuality quality) {
        Set<PitchClass> scale = scale();
        return quality.formula().stream().allMatch(interval -> scale.contains(root.transpose(interval)));
    }

    @Override
    public String toString() {
        return tonic.displayName() + " " + mode.key;
    }
}
