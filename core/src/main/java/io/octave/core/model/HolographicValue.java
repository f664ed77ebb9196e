package io.octave.core.model;

import java.util.Objects;

/**
 * A field specification written as one bracketed annotation: example value, constraint chain and
 * optional routing target, e.g. {@code ["draft"∧REQ∧ENUM[draft,final]→§INDEXER]}.
 *
 * <p>The parser only recognizes the shape; the constraint text is compiled later by
 * {@link io.octave.core.schema.HolographicPatternParser}.
 *
 * @param example     the example value (first list item)
 * @param constraints canonical constraint chain text, e.g. {@code REQ∧ENUM[A,B]}
 * @param target      target text after {@code →}, including any {@code §}, or {@code null}
 * @param raw         canonical rendering of the whole pattern, used verbatim on emission
 */
public record HolographicValue(Value example, String constraints, String target, String raw) implements Value {

    public HolographicValue {
        Objects.requireNonNull(example, "example must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
    }

    @Override
    public String typeName() {
        return "HOLOGRAPHIC";
    }
}
