package io.octave.core.model;

/**
 * A value in the OCTAVE AST.
 *
 * <p>The hierarchy is sealed: the set of variants is closed, and code that dispatches on a value
 * handles each of them. {@link Absent} and {@link NullValue} are deliberately different variants:
 * Absent means "never supplied" and is dropped on emission, Null means "explicitly empty" and is
 * written as the {@code null} literal.
 *
 * <p>All variants are immutable and thread-safe.
 */
public sealed interface Value
        permits StringValue,
                NumberValue,
                BooleanValue,
                NullValue,
                Absent,
                ListValue,
                InlineMap,
                LiteralZone,
                HolographicValue {

    /** Short type name used in diagnostics, e.g. {@code STRING} or {@code LIST}. */
    String typeName();

    /** Returns {@code true} for the {@link Absent} sentinel. */
    default boolean isAbsent() {
        return this == Absent.INSTANCE;
    }
}
