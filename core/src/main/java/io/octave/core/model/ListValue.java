package io.octave.core.model;

import java.util.List;
import java.util.Objects;

/** An ordered list of values. */
public record ListValue(List<Value> items) implements Value {

    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
        Objects.requireNonNull(items, "items must not be null");
        items = List.copyOf(items);
    }

    public static ListValue of(Value... items) {
        return new ListValue(List.of(items));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    @Override
    public String typeName() {
        return "LIST";
    }
}
