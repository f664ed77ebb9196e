package io.octave.core;

import io.octave.core.config.OctaveConfig;
import io.octave.core.emit.Emitter;
import io.octave.core.emit.FormatOptions;
import io.octave.core.lexer.LexResult;
import io.octave.core.lexer.Lexer;
import io.octave.core.model.Document;
import io.octave.core.parser.ParseResult;
import io.octave.core.parser.Parser;
import io.octave.core.schema.SchemaDefinition;
import io.octave.core.schema.SchemaExtractor;
import io.octave.core.validate.ValidationReport;
import io.octave.core.validate.Validator;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point to the OCTAVE core: tokenize, parse, emit, extract schemas and validate.
 *
 * <p>All operations are pure over their inputs and safe to call from many threads.
 */
public final class Octave {

    private static final Validator VALIDATOR = new Validator();

    private Octave() {}

    public static LexResult tokenize(String text) {
        return Lexer.tokenize(text);
    }

    /**
     * Parses a document.
     *
     * @throws io.octave.core.error.OctaveException on any hard lexer or parser error
     */
    public static Document parse(String text) {
        return Parser.parse(text);
    }

    /** Parses a document, returning warnings and lexer repairs alongside it. */
    public static ParseResult parseWithWarnings(String text) {
        return Parser.parseWithWarnings(text);
    }

    /** Parses with the parser settings of {@code config}. */
    public static ParseResult parseWithWarnings(String text, OctaveConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return Parser.parseWithWarnings(text, config.parserOptions());
    }

    /** Canonical text of a document. */
    public static String emit(Document document) {
        return Emitter.emit(document);
    }

    public static String emit(Document document, FormatOptions options) {
        return Emitter.emit(document, options);
    }

    /** Parses then emits: the canonical form of any parseable text. */
    public static String normalize(String text) {
        return Emitter.emit(Parser.parse(text));
    }

    public static SchemaDefinition extractSchema(Document schemaDocument) {
        return SchemaExtractor.extract(schemaDocument);
    }

    /** Validates against a top-level schema, non-strict. */
    public static ValidationReport validate(Document document, SchemaDefinition schema) {
        return VALIDATOR.validate(document, schema);
    }

    /** Validates against a top-level schema, strict when {@code validation.strict} is set. */
    public static ValidationReport validate(Document document, SchemaDefinition schema, OctaveConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return VALIDATOR.validate(document, schema, config.strict(), Map.of());
    }

    public static ValidationReport validate(
            Document document, SchemaDefinition schema, boolean strict, Map<String, SchemaDefinition> sectionSchemas) {
        return VALIDATOR.validate(document, schema, strict, sectionSchemas);
    }
}
