package io.octave.core.schema;

import java.util.Locale;

/** What validation does with an assignment that the schema does not declare. */
public enum UnknownFieldPolicy {
    /** Report {@code E_UNKNOWN_FIELD} (strict mode only). */
    REJECT,
    /** Skip silently. */
    IGNORE,
    /** Log a warning, record no error. */
    WARN;

    /**
     * Parses a policy name, case-insensitively.
     *
     * @throws IllegalArgumentException for anything other than REJECT, IGNORE or WARN
     */
    public static UnknownFieldPolicy fromString(String text) {
        try {
            return valueOf(text.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("Unknown field policy '%s', expected REJECT, IGNORE or WARN", text), e);
        }
    }
}
