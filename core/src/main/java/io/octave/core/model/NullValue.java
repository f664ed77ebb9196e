package io.octave.core.model;

/** An explicitly empty value, written as {@code null}. */
public enum NullValue implements Value {
    INSTANCE;

    @Override
    public String typeName() {
        return "NULL";
    }
}
