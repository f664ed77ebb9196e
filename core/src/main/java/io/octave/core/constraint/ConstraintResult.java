package io.octave.core.constraint;

import java.util.ArrayList;
import java.util.List;

/** Outcome of evaluating one constraint or a chain. Valid exactly when there are no errors. */
public record ConstraintResult(boolean valid, List<ConstraintError> errors) {

    private static final ConstraintResult OK = new ConstraintResult(true, List.of());

    public ConstraintResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when errors is empty");
        }
    }

    public static ConstraintResult ok() {
        return OK;
    }

    public static ConstraintResult failure(ConstraintError error) {
        return new ConstraintResult(false, List.of(error));
    }

    public static ConstraintResult of(List<ConstraintError> errors) {
        return errors.isEmpty() ? OK : new ConstraintResult(false, errors);
    }

    /** Both results' errors, this one's first. */
    public ConstraintResult and(ConstraintResult other) {
        if (other.valid) {
            return this;
        }
        if (valid) {
            return other;
        }
        List<ConstraintError> all = new ArrayList<>(errors);
        all.addAll(other.errors);
        return new ConstraintResult(false, all);
    }
}
