package io.octave.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code KEY::value}. An empty key marks a literal zone written directly in a body.
 *
 * @param trailingComment comment on the same line after the value, or {@code null}
 */
public record Assignment(String key, Value value, int line, List<String> leadingComments, String trailingComment)
        implements Node {

    public Assignment {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        leadingComments = leadingComments == null ? List.of() : List.copyOf(leadingComments);
    }

    public Assignment(String key, Value value, int line) {
        this(key, value, line, List.of(), null);
    }

    public Assignment(String key, Value value) {
        this(key, value, 0);
    }

    /** Same assignment with a different value; position and comments are kept. */
    public Assignment withValue(Value newValue) {
        return new Assignment(key, newValue, line, leadingComments, trailingComment);
    }
}
