package io.octave.core.lexer;

/** Kinds of tokens produced by the {@link Lexer}. Operator kinds carry their canonical symbol. */
public enum TokenType {
    GRAMMAR_SENTINEL,
    ENVELOPE_START,
    ENVELOPE_END,
    SEPARATOR,

    ASSIGN("::"),
    BLOCK(":"),
    LIST_START("["),
    LIST_END("]"),
    COMMA(","),

    FLOW("→"),
    TENSION("⇌"),
    SYNTHESIS("⊕"),
    CONCAT("⧺"),
    ALTERNATIVE("∨"),
    CONSTRAINT("∧"),
    AT("@"),
    SECTION("§"),

    STRING,
    NUMBER,
    VERSION,
    BOOLEAN,
    NULL,
    IDENTIFIER,
    VARIABLE,

    COMMENT,
    NEWLINE,
    INDENT,
    FENCE_OPEN,
    LITERAL_CONTENT,
    FENCE_CLOSE,
    EOF;

    private final String symbol;

    TokenType() {
        this(null);
    }

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** Canonical text of a punctuation or operator token, {@code null} for everything else. */
    public String symbol() {
        return symbol;
    }

    /** Expression operators that join atoms into one value ({@code A→B}, {@code X∨Y}). */
    public boolean isExpressionOperator() {
        return switch (this) {
            case FLOW, TENSION, SYNTHESIS, CONCAT, ALTERNATIVE, CONSTRAINT, AT -> true;
            default -> false;
        };
    }

    /** Literal and identifier kinds that can stand alone as a value. */
    public boolean isAtom() {
        return switch (this) {
            case STRING, NUMBER, VERSION, BOOLEAN, NULL, IDENTIFIER, VARIABLE -> true;
            default -> false;
        };
    }

    /** Tokens that carry layout only. */
    public boolean isLayout() {
        return this == NEWLINE || this == INDENT || this == COMMENT;
    }
}
