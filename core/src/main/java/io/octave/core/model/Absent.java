package io.octave.core.model;

/**
 * Sentinel for a value that was never supplied. Filtered out of assignments, lists, inline maps
 * and META on emission; handing it to the emitter directly is a programming error.
 */
public enum Absent implements Value {
    INSTANCE;

    @Override
    public String typeName() {
        return "ABSENT";
    }
}
