package io.octave.core.lexer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * One entry of the lexer's repair log: an edit (or a flagged irregularity) applied while turning
 * text into tokens. {@link #before()} is the exact source span and {@link #after()} what the
 * token stream carries instead.
 *
 * @param ruleId           stable identifier, e.g. {@code ASCII_ALIAS} or {@code W_WRONG_CASE}
 * @param tier             how invasive the edit is
 * @param before           original text
 * @param after            replacement text (equal to {@code before} for advisories)
 * @param line             1-based line, 0 for whole-document edits
 * @param column           1-based column, 0 for whole-document edits
 * @param message          human-readable description
 * @param semanticsChanged whether the edit can change meaning
 */
public record Repair(
        String ruleId,
        Tier tier,
        String before,
        String after,
        int line,
        int column,
        String message,
        boolean semanticsChanged) {

    private static final ObjectMapper JSON = new ObjectMapper();

    /** Severity of an edit. */
    public enum Tier {
        /** Spelling change with identical meaning (operator aliases, NFC, line endings). */
        NORMALIZATION,
        /** Guessed correction of malformed input. */
        REPAIR,
        /** Nothing rewritten; the input is flagged only. */
        ADVISORY
    }

    public Repair {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
    }

    static Repair normalization(String ruleId, String before, String after, int line, int column) {
        String message = String.format("%s: '%s' normalized to '%s'", ruleId, before, after);
        return new Repair(ruleId, Tier.NORMALIZATION, before, after, line, column, message, false);
    }

    /** Safe edits are those that never change meaning. */
    public boolean safe() {
        return !semanticsChanged;
    }

    public ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        node.put("rule_id", ruleId);
        node.put("tier", tier.name());
        node.put("before", before);
        node.put("after", after);
        node.put("line", line);
        node.put("column", column);
        node.put("message", message);
        node.put("safe", safe());
        node.put("semantics_changed", semanticsChanged);
        return node;
    }
}
