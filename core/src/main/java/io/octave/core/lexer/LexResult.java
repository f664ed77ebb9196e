package io.octave.core.lexer;

import java.util.List;
import java.util.Objects;

/** Tokens of one tokenize call plus the repairs applied on the way. */
public record LexResult(List<Token> tokens, List<Repair> repairs) {

    public LexResult {
        Objects.requireNonNull(tokens, "tokens must not be null");
        Objects.requireNonNull(repairs, "repairs must not be null");
        tokens = List.copyOf(tokens);
        repairs = List.copyOf(repairs);
    }
}
