package io.octave.core.schema;

import io.octave.core.constraint.ConstraintChain;
import io.octave.core.emit.Emitter;
import io.octave.core.model.Value;
import java.util.Objects;

/**
 * A compiled holographic pattern: example value, constraint chain and optional routing target.
 *
 * @param example     the example value
 * @param constraints the compiled chain
 * @param target      target name without {@code §} (alternatives joined by {@code ∨}), or {@code null}
 */
public record HolographicPattern(Value example, ConstraintChain constraints, String target) {

    public HolographicPattern {
        Objects.requireNonNull(example, "example must not be null");
        constraints = constraints == null ? ConstraintChain.EMPTY : constraints;
    }

    /** Canonical form, e.g. {@code ["ACTIVE"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]}. */
    public String render() {
        StringBuilder out = new StringBuilder("[").append(Emitter.emitValue(example));
        if (!constraints.isEmpty()) {
            out.append('∧').append(constraints.render());
        }
        if (target != null) {
            out.append("→§").append(target.replace("∨", "∨§"));
        }
        return out.append(']').toString();
    }
}
