package io.octave.core.error;

/** Thrown when input text cannot be scanned into tokens. */
public final class LexerException extends OctaveException {

    private static final long serialVersionUID = 1L;

    /** Forbidden control character or a character no token can start with. */
    public static final String FORBIDDEN_CHARACTER = "E005";

    /** Literal zone opened but never closed. */
    public static final String UNTERMINATED_FENCE = "E006";

    /** Fence of equal or greater length inside an open literal zone that does not cleanly close it. */
    public static final String NESTED_FENCE = "E007";

    /** String literal still open at end of input. */
    public static final String UNTERMINATED_STRING = "E_UNTERMINATED_STRING";

    public static final String UNBALANCED_BRACKET = "E_UNBALANCED_BRACKET";

    public static final String INVALID_ENVELOPE_ID = "E_INVALID_ENVELOPE_ID";

    public LexerException(String code, String message, int line, int column) {
        super(code, message, line, column, Phase.LEX);
    }
}
