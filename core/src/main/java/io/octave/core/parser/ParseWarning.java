package io.octave.core.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A lenient correction made by the parser. The source text it replaced is kept in
 * {@link #original()}, so no input disappears without a record.
 *
 * @param code      stable code, e.g. {@code W_MULTI_WORD}
 * @param type      category: {@code lenient_parse}, {@code normalization} or {@code structure}
 * @param subtype   stable subtype, e.g. {@code multi_word_coalesce}
 * @param message   human-readable description
 * @param line      1-based source line
 * @param column    1-based source column
 * @param original  source lexemes that were replaced or dropped
 * @param corrected what the document carries instead, or {@code null} when input was dropped
 * @param details   code-specific extras (e.g. {@code duplicate_lines} for duplicate keys)
 */
public record ParseWarning(
        String code,
        String type,
        String subtype,
        String message,
        int line,
        int column,
        List<String> original,
        String corrected,
        Map<String, Object> details) {

    public static final String MULTI_WORD = "W_MULTI_WORD";
    public static final String LIST_INFERRED = "W_LIST_INFERRED";
    public static final String DUPLICATE_KEY = "W_DUPLICATE_KEY";
    public static final String DEEP_NESTING = "W_DEEP_NESTING";
    public static final String ENVELOPE_INFERRED = "W_ENVELOPE_INFERRED";
    public static final String MISSING_END = "W_MISSING_END";
    public static final String TRAILING_CONTENT = "W_TRAILING_CONTENT";
    public static final String BARE_LINE = "W_BARE_LINE";
    public static final String TRAILING_TOKENS = "W_TRAILING_TOKENS";
    public static final String CONSTRUCTOR_MISUSE = "W_CONSTRUCTOR_MISUSE";
    public static final String AUTO_QUOTED = "W_AUTO_QUOTED";
    public static final String META_COMMENT_DROPPED = "W_META_COMMENT_DROPPED";

    private static final ObjectMapper JSON = new ObjectMapper();

    public ParseWarning {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subtype, "subtype must not be null");
        original = original == null ? List.of() : List.copyOf(original);
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        node.put("code", code);
        node.put("type", type);
        node.put("subtype", subtype);
        node.put("message", message);
        node.put("line", line);
        node.put("column", column);
        original.forEach(node.putArray("original")::add);
        node.put("corrected", corrected);
        node.set("details", JSON.valueToTree(details));
        return node;
    }
}
