package io.octave.core.error;

/** Thrown when a token stream cannot be assembled into a document. */
public final class ParserException extends OctaveException {

    private static final long serialVersionUID = 1L;

    /** {@code KEY:value} on one line: ambiguous between block and assignment. */
    public static final String AMBIGUOUS_SINGLE_COLON = "E001";

    /** {@code KEY::} with nothing after it. */
    public static final String MISSING_VALUE = "E_MISSING_VALUE";

    /** Bracket nesting deeper than {@link io.octave.core.parser.ParserOptions#MAX_NESTING_DEPTH}. */
    public static final String MAX_NESTING_EXCEEDED = "E_MAX_NESTING_EXCEEDED";

    /** Structurally broken construct, e.g. a section marker without an id. */
    public static final String MALFORMED = "E_MALFORMED";

    public ParserException(String code, String message, int line, int column) {
        super(code, message, line, column, Phase.PARSE);
    }
}
