package io.octave.core.lexer;

import java.util.Objects;

/**
 * A lexical token. Immutable; lives only as long as the token list of one tokenize call.
 *
 * @param type   token kind
 * @param value  decoded value: identifier text, unescaped string content, canonical operator
 *               symbol, comment text, fence marker or literal content
 * @param lexeme exact source text the token was read from (raw numeric and version literals,
 *               ASCII aliases before canonicalization)
 * @param line   1-based line of the first character
 * @param column 1-based column (in code points) of the first character
 */
public record Token(TokenType type, String value, String lexeme, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(lexeme, "lexeme must not be null");
    }

    /** Column just past the token, for adjacency checks on single-line tokens. */
    public int endColumn() {
        return column + lexeme.codePointCount(0, lexeme.length());
    }

    /** Whether {@code next} starts exactly where this token ends, with no space between. */
    public boolean isAdjacentTo(Token next) {
        return next.line == line && next.column == endColumn();
    }

    /** Info tag of a {@link TokenType#FENCE_OPEN} token, or {@code null}. */
    public String infoTag() {
        if (type != TokenType.FENCE_OPEN) {
            return null;
        }
        String tag = lexeme.strip().substring(value.length()).strip();
        return tag.isEmpty() ? null : tag;
    }

    /** Number of spaces of an {@link TokenType#INDENT} token. */
    public int width() {
        return type == TokenType.INDENT ? lexeme.length() : 0;
    }

    public boolean is(TokenType candidate) {
        return type == candidate;
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line + ":" + column;
    }
}
