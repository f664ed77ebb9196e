package io.octave.core.validate;

import io.octave.core.constraint.ConstraintError;
import java.util.Objects;

/**
 * A problem found while validating a document against a schema. Validation aggregates these
 * rather than stopping at the first one.
 *
 * @param code      stable code, e.g. {@code E003} or {@code E009}
 * @param message   human-readable description
 * @param fieldPath dotted path of the field concerned
 * @param line      1-based source line of the field, or 0 when it is missing
 */
public record ValidationError(String code, String message, String fieldPath, int line) {

    public static final String REQUIRED_MISSING = ConstraintError.REQUIRED_MISSING;
    public static final String INVALID_TARGET = "E009";
    public static final String UNKNOWN_FIELD = "E_UNKNOWN_FIELD";

    public ValidationError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
    }

    static ValidationError from(ConstraintError error, int line) {
        return new ValidationError(error.code(), error.message(), error.path(), line);
    }
}
