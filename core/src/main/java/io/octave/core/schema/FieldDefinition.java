package io.octave.core.schema;

import java.util.Objects;

/**
 * One entry of a schema's {@code FIELDS} block.
 *
 * @param name    field key, possibly dotted ({@code RISKS.CRITICAL})
 * @param pattern the compiled holographic pattern, or {@code null} when the value was not one
 * @param raw     canonical text of the declared value, kept for diagnostics
 */
public record FieldDefinition(String name, HolographicPattern pattern, String raw) {

    public FieldDefinition {
        Objects.requireNonNull(name, "name must not be null");
    }

    public FieldDefinition(String name, HolographicPattern pattern) {
        this(name, pattern, pattern == null ? null : pattern.render());
    }

    /** True when the pattern's chain contains {@code REQ}. */
    public boolean required() {
        return pattern != null && pattern.constraints().isRequired();
    }

    /** Explicit target of the pattern, or {@code null}. */
    public String target() {
        return pattern == null ? null : pattern.target();
    }
}
