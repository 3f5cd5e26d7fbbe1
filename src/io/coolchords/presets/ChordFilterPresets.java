package io.coolchords.presets;

import com.google.gson.reflect.TypeToken;
import io.coolchords.exceptions.InvalidQualityException;
import io.coolchords.exceptions.PresetParseException;
import io.coolchords.text.ChordNameNormalizer;
import io.coolchords.theory.ChordFilter;
import io.coolchords.theory.ChordQuality;
import io.coolchords.theory.KeyFilter;
import io.coolchords.theory.PitchClass;
import io.coolchords.theory.ScaleMode;
import io.coolchords.util.JsonIo;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chord filter presets read from JSON.
 * <p>
 * The bundled presets live in the {@value #BUNDLED_PRESETS_JSON} resource. A user file has the same shape:
 * <pre>
 * { "BASIC_TRIADS": { "name": "Basic Triads", "description": "...",
 *     "filter": { "allowedChordTypes": ["major", "minor"], "allowedRootNotes": ["C", "D"],
 *                 "allowedOctaves": [4], "includeInversions": false,
 *                 "keyFilter": { "key": "C", "scale": "major" } } } }
 * </pre>
 * A missing or null {@code allowedRootNotes} allows every root; {@code keyFilter} is optional.
 */
public class ChordFilterPresets {
    private static final Logger LOGGER = Logger.getLogger(ChordFilterPresets.class.getName());
    public static final String BUNDLED_PRESETS_JSON = "chord_filter_presets.json";

    private record KeyFilterJson(String key, String scale) {}

    private record FilterJson(List<String> allowedChordTypes, List<String> allowedRootNotes,
                              List<Integer> allowedOctaves, Boolean includeInversions, KeyFilterJson keyFilter) {}

    private record PresetJson(String name, String description, FilterJson filter) {}

    private static final TypeToken<LinkedHashMap<String, PresetJson>> PRESETS_TYPE = new TypeToken<LinkedHashMap<String, PresetJson>>() {};

    private final Map<String, ChordFilterPreset> presets;

    private ChordFilterPresets(Map<String, ChordFilterPreset> presets) {
        this.presets = Collections.unmodifiableMap(presets);
    }

    /** The presets bundled with the library */
    public static ChordFilterPresets load() {
        return fromJson(JsonIo.readResource(BUNDLED_PRESETS_JSON, PRESETS_TYPE), BUNDLED_PRESETS_JSON);
    }

    /**
     * @throws PresetParseException When the file is missing, malformed, or describes an invalid filter
     */
    public static ChordFilterPresets load(File file) {
        if (!file.exists()) {
            LOGGER.log(Level.WARNING, "Preset file not found: {0}", file.getAbsolutePath());
            throw new PresetParseException("Preset file not found: " + file.getAbsolutePath());
        }
        return fromJson(JsonIo.readFile(file, PRESETS_TYPE), file.getAbsolutePath());
    }

    private static ChordFilterPresets fromJson(Map<String, PresetJson> json, String source) {
        var presets = new LinkedHashMap<String, ChordFilterPreset>();
        for (var entry : json.entrySet()) {
            try {
                presets.put(entry.getKey(), toPreset(entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException | InvalidQualityException e) {
                throw new PresetParseException("Invalid preset " + entry.getKey() + " in " + source + ": " + e.getMessage(), e);
            }
        }
        LOGGER.log(Level.FINE, "Loaded {0} chord filter presets from {1}", new Object[]{presets.size(), source});
        return new ChordFilterPresets(presets);
    }

    private static ChordFilterPreset toPreset(String key, PresetJson json) {
        if (json == null || json.filter() == null)
            throw new IllegalArgumentException("missing filter");
        FilterJson f = json.filter();
        if (f.allowedChordTypes() == null || f.allowedOctaves() == null)
            throw new IllegalArgumentException("allowedChordTypes and allowedOctaves are required");

        List<ChordQuality> qualities = f.allowedChordTypes().stream().map(ChordQuality::fromKey).toList();
        List<PitchClass> roots = f.allowedRootNotes() == null ? null
                : f.allowedRootNotes().stream().map(ChordFilterPresets::pitchClass).toList();
        KeyFilter keyFilter = f.keyFilter() == null ? null
                : new KeyFilter(pitchClass(f.keyFilter().key()), ScaleMode.fromKey(f.keyFilter().scale()));
        boolean inversions = f.includeInversions() != null && f.includeInversions();

        var filter = new ChordFilter(qualities, roots, f.allowedOctaves(), inversions, keyFilter);
        String name = json.name() == null ? key : json.name();
        return new ChordFilterPreset(key, name, json.description() == null ? "" : json.description(), filter);
    }

    /** Any spelling the chord-name normalizer accepts: "C#", "Db", "d♭" */
    private static PitchClass pitchClass(String noteName) {
        return ChordNameNormalizer.normalizeNote(noteName)
                .orElseThrow(() -> new IllegalArgumentException("Not a note name: " + noteName));
    }

    public Optional<ChordFilterPreset> get(String key) {
        return Optional.ofNullable(presets.get(key));
    }

    public Optional<ChordFilterPreset> getByName(String name) {
        return presets.values().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** Preset keys in file order */
    public List<String> keys() {
        return new ArrayList<>(presets.keySet());
    }

    public List<ChordFilterPreset> all() {
        return new ArrayList<>(presets.values());
    }

    /**
     * Overlays a preset onto the current filter. The preset's settings win; the current key filter is kept
     * when the preset has none.
     *
     * @param current The filter in use, or null to take the preset as is
     */
    public static ChordFilter apply(ChordFilterPreset preset, ChordFilter current) {
        ChordFilter filter = preset.filter();
        if (current == null || filter.keyFilter() != null) {
            return filter;
        }
        return filter.withKeyFilter(current.keyFilter());
    }
}
