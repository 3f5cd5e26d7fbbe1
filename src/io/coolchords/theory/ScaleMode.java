package io.coolchords.theory;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Diatonic scales a chord filter can be restricted to
 */
public enum ScaleMode {
    MAJOR("major", 0, 2, 4, 5, 7, 9, 11),
    /** Natural minor */
    MINOR("minor", 0, 2, 3, 5, 7, 8, 10);

    /** Identifier used in preset files */
    public final String key;
    /** Semitones above the tonic */
    private final List<Integer> steps;

    ScaleMode(String key, int... steps) {
        this.key = key;
        this.steps = Arrays.stream(steps).boxed().toList();
    }

    /** The pitch classes of this scale starting on {@code tonic} */
    public Set<PitchClass> pitchClasses(PitchClass tonic) {
        var result = EnumSet.noneOf(PitchClass.class);
        for (int step : steps) {
            result.add(tonic.transpose(step));
        }
        return result;
    }

    public static ScaleMode fromKey(String key) {
        for (var mode : values()) {
            if (mode.key.equalsIgnoreCase(key))
                return mode;
        }
        throw new IllegalArgumentException("Unknown scale: " + key + ", expected major or minor");
    }
}
