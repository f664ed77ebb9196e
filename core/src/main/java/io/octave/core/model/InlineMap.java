package io.octave.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered key to value pairs written inline, e.g. {@code [name::x,size::2]}. Keys are unique per
 * instance; insertion order is the emission order.
 */
public record InlineMap(Map<String, Value> entries) implements Value {

    public InlineMap {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /** A map holding exactly one pair, the shape the parser builds for each {@code k::v} list item. */
    public static InlineMap of(String key, Value value) {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put(key, value);
        return new InlineMap(entries);
    }

    public Value get(String key) {
        return entries.get(key);
    }

    @Override
    public String typeName() {
        return "MAP";
    }
}
