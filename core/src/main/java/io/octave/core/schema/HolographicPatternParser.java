package io.octave.core.schema;

import io.octave.core.constraint.ConstraintChain;
import io.octave.core.constraint.ConstraintChainParser;
import io.octave.core.error.HolographicPatternException;
import io.octave.core.error.OctaveException;
import io.octave.core.model.HolographicValue;
import io.octave.core.model.Value;
import io.octave.core.parser.Parser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles holographic pattern text {@code [example∧CONSTRAINTS→§TARGET]} into a
 * {@link HolographicPattern}.
 *
 * <p>The text is cut at the first top-level {@code ∧} and the last top-level {@code →}, ignoring
 * anything inside quotes or nested brackets, so constraint arguments such as
 * {@code REGEX[^[a-z-]+$]} survive intact. The example is parsed with the regular value grammar.
 *
 * <p>Thread-safe and stateless.
 */
public final class HolographicPatternParser {

    private HolographicPatternParser() {}

    /**
     * Parses pattern text.
     *
     * @throws HolographicPatternException if the text is not bracketed, has no example, no
     *                                     constraint, or an invalid example or chain
     */
    public static HolographicPattern parse(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        String text = raw.strip();
        if (text.length() < 2 || text.charAt(0) != '[' || text.charAt(text.length() - 1) != ']') {
            throw new HolographicPatternException("Holographic pattern must be enclosed in brackets: " + raw);
        }
        String inner = text.substring(1, text.length() - 1).strip();
        if (inner.isEmpty()) {
            throw new HolographicPatternException("Empty holographic pattern");
        }

        int constraintAt = topLevelIndexOf(inner, "∧", false);
        if (constraintAt < 0) {
            constraintAt = topLevelIndexOf(inner, "&", false);
        }
        if (constraintAt < 0) {
            throw new HolographicPatternException("Holographic pattern has no constraint: " + raw);
        }
        String exampleText = inner.substring(0, constraintAt).strip();
        if (exampleText.isEmpty()) {
            throw new HolographicPatternException("Holographic pattern has no example value: " + raw);
        }

        String rest = inner.substring(constraintAt + 1);
        String targetText = null;
        int arrow = topLevelIndexOf(rest, "→", true);
        int arrowWidth = 1;
        if (arrow < 0) {
            arrow = topLevelIndexOf(rest, "->", true);
            arrowWidth = 2;
        }
        if (arrow >= 0) {
            targetText = rest.substring(arrow + arrowWidth).strip();
            rest = rest.substring(0, arrow);
        }

        ConstraintChain chain = ConstraintChainParser.parse(rest);
        if (chain.isEmpty()) {
            throw new HolographicPatternException("Holographic pattern has an empty constraint chain: " + raw);
        }
        return new HolographicPattern(parseExample(exampleText), chain, normalizeTarget(targetText));
    }

    /** Compiles a value the parser already recognized as holographic. */
    public static HolographicPattern from(HolographicValue value) {
        Objects.requireNonNull(value, "value must not be null");
        ConstraintChain chain = ConstraintChainParser.parse(value.constraints());
        return new HolographicPattern(value.example(), chain, normalizeTarget(value.target()));
    }

    /**
     * Strips {@code §} from each {@code ∨}-separated alternative; {@code null} or blank gives
     * {@code null}.
     */
    static String normalizeTarget(String target) {
        if (target == null || target.isBlank()) {
            return null;
        }
        List<String> names = new ArrayList<>();
        for (String alternative : target.split("∨|\\|")) {
            String name = alternative.strip();
            if (name.startsWith("§")) {
                name = name.substring(1);
            } else if (name.startsWith("#")) {
                name = name.substring(1);
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            throw new HolographicPatternException("Empty routing target: " + target);
        }
        return String.join("∨", names);
    }

    private static Value parseExample(String exampleText) {
        String document = "===HOLOGRAPHIC_EXAMPLE===\nEXAMPLE::" + exampleText + "\n===END===\n";
        try {
            return Parser.parse(document)
                    .valueAt("EXAMPLE")
                    .orElseThrow(() -> new HolographicPatternException("Invalid example value: " + exampleText));
        } catch (HolographicPatternException e) {
            throw e;
        } catch (OctaveException e) {
            throw new HolographicPatternException("Invalid example value '" + exampleText + "': " + e.getMessage(), e);
        }
    }

    /** Index of the first (or last) occurrence of {@code needle} outside quotes and brackets, or -1. */
    private static int topLevelIndexOf(String text, String needle, boolean last) {
        int found = -1;
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            if (c == '"') {
                quoted = true;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if (c == ']' || c == ')') {
                depth--;
            } else if (depth == 0 && text.startsWith(needle, i)) {
                if (!last) {
                    return i;
                }
                found = i;
            }
        }
        return found;
    }
}
