package io.octave.core.model;

import java.util.Objects;

/** A text value, bare or quoted in the source. */
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    @Override
    public String typeName() {
        return "STRING";
    }
}
