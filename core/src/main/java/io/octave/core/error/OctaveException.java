package io.octave.core.error;

/**
 * Abstract base for all OCTAVE hard errors. Never thrown directly: use the concrete subclasses.
 *
 * <p>Every hard error carries a stable short {@link #code()} that collaborators match on, and a
 * source position when the error is positional. Warnings and constraint failures are never
 * exceptions; they travel as records next to the result.
 */
public abstract class OctaveException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        LEX,
        PARSE,
        EMIT,
        SCHEMA,
        ROUTE
    }

    private final String code;
    private final int line;
    private final int column;
    private final Phase phase;

    protected OctaveException(String code, String message, int line, int column, Phase phase) {
        super(format(code, message, line, column));
        this.code = code;
        this.line = line;
        this.column = column;
        this.phase = phase;
    }

    protected OctaveException(String code, String message, Throwable cause, Phase phase) {
        super(format(code, message, 0, 0), cause);
        this.code = code;
        this.line = 0;
        this.column = 0;
        this.phase = phase;
    }

    private static String format(String code, String message, int line, int column) {
        if (line > 0) {
            return String.format("%s at line %d, column %d: %s", code, line, column, message);
        }
        return code + ": " + message;
    }

    /** Stable error code, e.g. {@code E005} or {@code E_MAX_NESTING_EXCEEDED}. */
    public String code() {
        return code;
    }

    /** 1-based source line, or 0 when the error is not tied to a position. */
    public int line() {
        return line;
    }

    /** 1-based source column, or 0 when the error is not tied to a position. */
    public int column() {
        return column;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
