package io.coolchords.presets;

import io.coolchords.theory.ChordFilter;

/**
 * A named chord filter for a common training scenario
 *
 * @param key         Identifier, e.g. "BASIC_TRIADS"
 * @param name        Display name, e.g. "Basic Triads"
 * @param description One sentence for a preset picker
 * @param filter      The filter itself
 */
public record ChordFilterPreset(String key, String name, String description, ChordFilter filter) {
}
