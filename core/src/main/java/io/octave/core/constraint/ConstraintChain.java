package io.octave.core.constraint;

import io.octave.core.model.Value;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of independent constraints. Evaluation runs every term and aggregates their errors,
 * so one pass reports every problem with a value.
 *
 * <p>Immutable; a chain built once may be evaluated concurrently.
 */
public record ConstraintChain(List<Constraint> constraints) {

    public static final ConstraintChain EMPTY = new ConstraintChain(List.of());

    public ConstraintChain {
        constraints = List.copyOf(constraints);
    }

    public static ConstraintChain of(Constraint... constraints) {
        return new ConstraintChain(List.of(constraints));
    }

    /** Shortcut for {@link ConstraintChainParser#parse(String)}. */
    public static ConstraintChain parse(String text) {
        return ConstraintChainParser.parse(text);
    }

    /**
     * Evaluates all constraints against the value.
     *
     * @param value the field value, {@code null} or Absent when missing
     * @param path  dotted field path for error reporting
     */
    public ConstraintResult evaluate(Value value, String path) {
        ConstraintResult result = ConstraintResult.ok();
        for (Constraint constraint : constraints) {
            result = result.and(constraint.evaluate(value, path));
        }
        return result;
    }

    /** True when the chain contains {@code REQ}. */
    public boolean isRequired() {
        return constraints.stream().anyMatch(Constraint.Required.class::isInstance);
    }

    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    /** Terms sorted by grammar compilation priority; ties keep source order. */
    public List<Constraint> compilationOrder() {
        return constraints.stream()
                .sorted(Comparator.comparingInt(Constraint::priority))
                .toList();
    }

    /** Canonical text: terms joined by {@code ∧}. */
    public String render() {
        return constraints.stream().map(Constraint::render).collect(Collectors.joining("∧"));
    }

    @Override
    public String toString() {
        return render();
    }
}
