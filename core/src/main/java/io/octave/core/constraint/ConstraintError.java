package io.octave.core.constraint;

import java.util.Objects;

/**
 * One failed constraint. Structured data, never thrown.
 *
 * @param code       {@code E003} required missing, {@code E005} enum/const/regex mismatch,
 *                   {@code E006} length or range violation, {@code E007} type, literal, language
 *                   or date violation
 * @param message    human-readable description
 * @param constraint canonical text of the failing constraint, e.g. {@code ENUM[A,B]}
 * @param expected   what the constraint wanted
 * @param actual     what the value was
 * @param path       dotted field path
 */
public record ConstraintError(
        String code, String message, String constraint, String expected, String actual, String path) {

    public static final String REQUIRED_MISSING = "E003";
    public static final String VALUE_MISMATCH = "E005";
    public static final String BOUNDS_VIOLATION = "E006";
    public static final String TYPE_VIOLATION = "E007";

    public ConstraintError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
    }
}
