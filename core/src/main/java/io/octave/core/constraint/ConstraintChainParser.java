package io.octave.core.constraint;

import io.octave.core.error.HolographicPatternException;
import io.octave.core.model.BooleanValue;
import io.octave.core.model.NullValue;
import io.octave.core.model.NumberValue;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Parses constraint chain text such as {@code REQ∧ENUM[ACTIVE,DRAFT]} into a {@link ConstraintChain}.
 *
 * <p>Terms are separated by {@code ∧}, its ASCII alias {@code &}, or whitespace, at bracket depth
 * zero and outside double quotes. Arguments may be written in square or round brackets; a quoted
 * argument is unescaped. Keywords are case-insensitive.
 *
 * <p>Thread-safe and stateless.
 */
public final class ConstraintChainParser {

    private static final Pattern TERM = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*(?:([\\[(])(.*)([])]))?$", Pattern.DOTALL);

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private ConstraintChainParser() {}

    /**
     * Parses a chain.
     *
     * @throws HolographicPatternException on an unknown keyword, a missing or malformed argument,
     *                                     or unbalanced brackets
     */
    public static ConstraintChain parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Constraint> constraints = new ArrayList<>();
        for (String term : split(text)) {
            constraints.add(parseTerm(term));
        }
        return new ConstraintChain(constraints);
    }

    // ── Splitting ──

    static List<String> split(String text) {
        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                current.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
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
                if (--depth < 0) {
                    throw new HolographicPatternException("Unbalanced '" + c + "' in constraint chain: " + text);
                }
            } else if (depth == 0 && (c == '∧' || c == '&' || Character.isWhitespace(c))) {
                flush(current, terms);
                continue;
            }
            current.append(c);
        }
        if (quoted) {
            throw new HolographicPatternException("Unterminated string in constraint chain: " + text);
        }
        if (depth != 0) {
            throw new HolographicPatternException("Unclosed bracket in constraint chain: " + text);
        }
        flush(current, terms);
        return terms;
    }

    private static void flush(StringBuilder current, List<String> terms) {
        if (current.length() > 0) {
            terms.add(current.toString());
            current.setLength(0);
        }
    }

    // ── Terms ──

    private static Constraint parseTerm(String term) {
        Matcher m = TERM.matcher(term);
        if (!m.matches()) {
            throw new HolographicPatternException("Malformed constraint '" + term + "'");
        }
        String keyword = m.group(1).toUpperCase(Locale.ROOT);
        String open = m.group(2);
        String arg = m.group(3);
        if (open != null && (open.equals("[") != m.group(4).equals("]"))) {
            throw new HolographicPatternException("Mismatched brackets in constraint '" + term + "'");
        }

        switch (keyword) {
            case "REQ", "REQUIRED" -> {
                noArgument(keyword, arg);
                return new Constraint.Required();
            }
            case "OPT", "OPTIONAL" -> {
                noArgument(keyword, arg);
                return new Constraint.Optional();
            }
            case "DATE" -> {
                noArgument(keyword, arg);
                return new Constraint.Date();
            }
            case "ISO8601" -> {
                noArgument(keyword, arg);
                return new Constraint.Iso8601();
            }
            case "DIR" -> {
                noArgument(keyword, arg);
                return new Constraint.Dir();
            }
            case "APPEND_ONLY" -> {
                noArgument(keyword, arg);
                return new Constraint.AppendOnly();
            }
            case "TYPE" -> {
                String type = unquote(required(keyword, arg)).toUpperCase(Locale.ROOT);
                if (!Constraint.TypeOf.TYPES.contains(type)) {
                    throw new HolographicPatternException(String.format(
                            "Unknown type '%s' in TYPE, expected one of STRING, NUMBER, BOOLEAN, LIST, LITERAL", type));
                }
                return new Constraint.TypeOf(type);
            }
            case "ENUM" -> {
                List<String> values = arguments(required(keyword, arg)).stream()
                        .map(ConstraintChainParser::unquote)
                        .toList();
                if (values.stream().anyMatch(String::isEmpty)) {
                    throw new HolographicPatternException("ENUM values must not be empty: " + term);
                }
                return new Constraint.Enum(values);
            }
            case "CONST" -> {
                return new Constraint.Const(constant(required(keyword, arg)));
            }
            case "REGEX" -> {
                String source = unquote(required(keyword, arg));
                try {
                    return new Constraint.Regex(Pattern.compile(source));
                } catch (PatternSyntaxException e) {
                    throw new HolographicPatternException("Invalid REGEX '" + source + "': " + e.getDescription(), e);
                }
            }
            case "RANGE" -> {
                List<String> bounds = arguments(required(keyword, arg));
                if (bounds.size() != 2) {
                    throw new HolographicPatternException("RANGE needs exactly two bounds: " + term);
                }
                BigDecimal min = decimal(keyword, bounds.get(0));
                BigDecimal max = decimal(keyword, bounds.get(1));
                if (min.compareTo(max) > 0) {
                    throw new HolographicPatternException("RANGE minimum exceeds maximum: " + term);
                }
                return new Constraint.Range(min, max);
            }
            case "MIN_LENGTH" -> {
                return new Constraint.MinLength(length(keyword, required(keyword, arg)));
            }
            case "MAX_LENGTH" -> {
                return new Constraint.MaxLength(length(keyword, required(keyword, arg)));
            }
            case "LANG" -> {
                return new Constraint.Lang(unquote(required(keyword, arg)));
            }
            default -> throw new HolographicPatternException("Unknown constraint '" + keyword + "'");
        }
    }

    private static void noArgument(String keyword, String arg) {
        if (arg != null) {
            throw new HolographicPatternException(keyword + " takes no argument");
        }
    }

    private static String required(String keyword, String arg) {
        if (arg == null || arg.isBlank()) {
            throw new HolographicPatternException(keyword + " requires an argument, e.g. " + keyword + "[...]");
        }
        return arg.strip();
    }

    /** Splits at top-level commas outside quotes. */
    private static List<String> arguments(String arg) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean quoted = false;
        for (int i = 0; i < arg.length(); i++) {
            char c = arg.charAt(i);
            if (quoted) {
                current.append(c);
                if (c == '\\' && i + 1 < arg.length()) {
                    current.append(arg.charAt(++i));
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
            } else if (c == ',' && depth == 0) {
                parts.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString().strip());
        return parts;
    }

    /** A {@code CONST} argument keeps its type: quoted text is a string, bare literals decode. */
    private static Value constant(String arg) {
        if (arg.length() >= 2 && arg.startsWith("\"") && arg.endsWith("\"")) {
            return new StringValue(unquote(arg));
        }
        if (NUMBER.matcher(arg).matches()) {
            return NumberValue.parse(arg);
        }
        return switch (arg) {
            case "true" -> BooleanValue.TRUE;
            case "false" -> BooleanValue.FALSE;
            case "null" -> NullValue.INSTANCE;
            default -> new StringValue(arg);
        };
    }

    private static BigDecimal decimal(String keyword, String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new HolographicPatternException(keyword + " bound '" + text + "' is not a number", e);
        }
    }

    private static int length(String keyword, String text) {
        try {
            int n = Integer.parseInt(text);
            if (n < 0) {
                throw new HolographicPatternException(keyword + " must not be negative: " + n);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new HolographicPatternException(keyword + " expects an integer, got '" + text + "'", e);
        }
    }

    /** Removes surrounding double quotes and decodes {@code \" \\ \n \t}. Unquoted text is returned stripped. */
    static String unquote(String text) {
        String s = text.strip();
        if (s.length() < 2 || !s.startsWith("\"") || !s.endsWith("\"")) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 1; i < s.length() - 1; i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length() - 1) {
                char next = s.charAt(++i);
                switch (next) {
                    case 'n' -> out.append('\n');
                    case 't' -> out.append('\t');
                    case '"', '\\' -> out.append(next);
                    default -> out.append('\\').append(next);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
