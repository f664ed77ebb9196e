package io.octave.core.parser;

import io.octave.core.lexer.Repair;
import io.octave.core.model.Document;
import java.util.List;
import java.util.Objects;

/** A parsed document with the warnings of the parser and the repairs of the lexer. */
public record ParseResult(Document document, List<ParseWarning> warnings, List<Repair> repairs) {

    public ParseResult {
        Objects.requireNonNull(document, "document must not be null");
        warnings = List.copyOf(warnings);
        repairs = List.copyOf(repairs);
    }

    /** Warnings with the given code, in emission order. */
    public List<ParseWarning> warnings(String code) {
        return warnings.stream().filter(w -> w.code().equals(code)).toList();
    }
}
