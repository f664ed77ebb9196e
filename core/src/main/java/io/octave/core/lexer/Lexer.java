package io.octave.core.lexer;

import io.octave.core.error.LexerException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns OCTAVE text into tokens, canonicalizing operator aliases and recording every edit in a
 * repair log.
 *
 * <p>Raises {@link LexerException} only for input that cannot be scanned: a forbidden control
 * character, an unterminated or illegally nested literal zone, an unbalanced bracket, a malformed
 * envelope marker, or a character no token can start with.
 *
 * <p>Thread-safe: every call works on its own private state.
 */
public final class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Pattern GRAMMAR_SENTINEL = Pattern.compile("OCTAVE::(\\d+(?:\\.\\d+)*(?:-[A-Za-z0-9.-]+)?)");

    /** Three or more dotted parts, or two parts with a prerelease or build suffix. Plain {@code 3.14} is a number. */
    private static final Pattern VERSION = Pattern.compile("\\d+\\.\\d+\\.\\d+(?:\\.\\d+)*(?:-[A-Za-z0-9.-]+)?(?:\\+[A-Za-z0-9.]+)?"
            + "|\\d+\\.\\d+-[A-Za-z0-9.-]+(?:\\+[A-Za-z0-9.]+)?"
            + "|\\d+\\.\\d+\\+[A-Za-z0-9.]+");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*(?:[eE][+-]?\\d+)?");
    private static final Pattern ENVELOPE_START = Pattern.compile("===([A-Za-z_][A-Za-z0-9_]*)===");
    private static final Pattern ENVELOPE_ANY = Pattern.compile("===([^=\\n]*)===");
    private static final Pattern VARIABLE = Pattern.compile("\\$[A-Za-z0-9_:]+");

    private static final String ENVELOPE_END = "===END===";

    /** Wrong-case spellings of the reserved literals. Kept as identifiers, flagged as advisories. */
    private static final Map<String, String> WRONG_CASE = Map.of(
            "True", "true", "TRUE", "true", "False", "false", "FALSE", "false", "Null", "null", "NULL", "null");

    private static final String[] KEYWORDS = {"true", "false", "null", "vs"};

    /** Operator spellings, longest first so that {@code <->} wins over {@code ->}. */
    private static final String[][] OPERATORS = {
        {"<->", "TENSION"},
        {"->", "FLOW"},
        {"→", "FLOW"},
        {"⇌", "TENSION"},
        {"⊕", "SYNTHESIS"},
        {"+", "SYNTHESIS"},
        {"⧺", "CONCAT"},
        {"~", "CONCAT"},
        {"∨", "ALTERNATIVE"},
        {"|", "ALTERNATIVE"},
        {"∧", "CONSTRAINT"},
        {"&", "CONSTRAINT"},
        {"§", "SECTION"},
        {"#", "SECTION"},
        {"@", "AT"},
    };

    private final String text;
    private final boolean lenient;
    private final Map<Integer, FenceScanner.Span> spans = new HashMap<>();
    private final List<Token> tokens = new ArrayList<>();
    private final List<Repair> repairs;
    private final Deque<Token> brackets = new ArrayDeque<>();
    private int pos;
    private int line;
    private int column = 1;

    private Lexer(String text, boolean lenient, int firstLine, List<Repair> repairs, List<FenceScanner.Span> zones) {
        this.text = text;
        this.lenient = lenient;
        this.line = firstLine;
        this.repairs = repairs;
        for (FenceScanner.Span span : zones) {
            spans.put(span.openLine(), span);
        }
    }

    /** Tokenizes in lenient mode (curly-brace annotations are repaired). */
    public static LexResult tokenize(String text) {
        return tokenize(text, true, 1);
    }

    public static LexResult tokenize(String text, boolean lenient) {
        return tokenize(text, lenient, 1);
    }

    /**
     * Tokenizes text whose first line is line {@code firstLine} of the original source.
     *
     * @param text      OCTAVE text
     * @param lenient   whether to repair {@code NAME{q}} to {@code NAME<q>} instead of failing
     * @param firstLine line number reported for the first line
     * @return tokens ending with {@link TokenType#EOF}, and the repair log
     * @throws LexerException on unscannable input
     */
    public static LexResult tokenize(String text, boolean lenient, int firstLine) {
        if (text == null) {
            throw new NullPointerException("text must not be null");
        }
        List<Repair> repairs = new ArrayList<>();
        String unified = unifyLineEndings(text, repairs);
        FenceScanner.Prepared prepared = FenceScanner.prepare(unified, firstLine, repairs);
        Lexer lexer = new Lexer(String.join("\n", prepared.lines()), lenient, firstLine, repairs, prepared.spans());
        lexer.run();
        LOG.debug("Tokenized {} lines into {} tokens with {} repairs",
                prepared.lines().size(), lexer.tokens.size(), repairs.size());
        return new LexResult(lexer.tokens, repairs);
    }

    private static String unifyLineEndings(String text, List<Repair> repairs) {
        if (text.indexOf('\r') < 0) {
            return text;
        }
        repairs.add(new Repair(
                "LINE_ENDINGS", Repair.Tier.NORMALIZATION, "\\r\\n", "\\n", 0, 0, "Line endings unified to LF", false));
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private void run() {
        while (pos < text.length()) {
            if (column == 1 && spans.containsKey(line)) {
                scanLiteralZone(spans.get(line));
                continue;
            }
            char c = text.charAt(pos);
            if (c == ' ') {
                scanSpaces();
            } else if (c == '\n') {
                emit(TokenType.NEWLINE, "\n", "\n");
            } else if (!scanStructural() && !scanOperator() && !scanLiteral()) {
                scanWordLike();
            }
        }
        if (!brackets.isEmpty()) {
            Token open = brackets.peekLast();
            throw new LexerException(
                    LexerException.UNBALANCED_BRACKET,
                    String.format("opening '[' at line %d, column %d has no matching ']'", open.line(), open.column()),
                    open.line(),
                    open.column());
        }
        tokens.add(new Token(TokenType.EOF, "", "", line, column));
    }

    // ── Layout ──

    private void scanSpaces() {
        int end = pos;
        while (end < text.length() && text.charAt(end) == ' ') {
            end++;
        }
        String spaces = text.substring(pos, end);
        boolean lineStart = column == 1;
        boolean blankRest = end >= text.length() || text.charAt(end) == '\n';
        if (lineStart && !blankRest) {
            emit(TokenType.INDENT, spaces, spaces);
        } else {
            advance(spaces);
        }
    }

    private void scanLiteralZone(FenceScanner.Span span) {
        int openEnd = lineEnd(pos);
        String openText = text.substring(pos, openEnd);
        if (span.indent() > 0) {
            String spaces = openText.substring(0, span.indent());
            emit(TokenType.INDENT, spaces, spaces);
        }
        String fence = openText.substring(span.indent());
        emit(TokenType.FENCE_OPEN, span.marker(), fence);
        advance("\n");

        tokens.add(new Token(TokenType.LITERAL_CONTENT, span.content(), span.content(), line, 1));
        advance(span.content());

        String closeText = text.substring(pos, lineEnd(pos));
        advance(closeText.substring(0, span.closeIndent()));
        emit(TokenType.FENCE_CLOSE, span.marker(), closeText.substring(span.closeIndent()));
    }

    private int lineEnd(int from) {
        int end = text.indexOf('\n', from);
        return end < 0 ? text.length() : end;
    }

    // ── Structure: sentinel, envelope, separator, comments, colons, brackets ──

    private boolean scanStructural() {
        if (text.startsWith("OCTAVE::", pos) && onlyLayoutSoFar()) {
            Matcher m = match(GRAMMAR_SENTINEL);
            if (m != null) {
                emit(TokenType.GRAMMAR_SENTINEL, m.group(1), m.group());
                return true;
            }
        }
        if (text.startsWith("===", pos)) {
            return scanEnvelope();
        }
        if (text.startsWith("---", pos)) {
            emit(TokenType.SEPARATOR, "---", "---");
            return true;
        }
        if (text.startsWith("//", pos)) {
            String comment = text.substring(pos, lineEnd(pos));
            emit(TokenType.COMMENT, comment.substring(2).strip(), comment);
            return true;
        }
        if (text.startsWith("::", pos)) {
            emit(TokenType.ASSIGN, "::", "::");
            return true;
        }
        char c = text.charAt(pos);
        if (c == ':') {
            emit(TokenType.BLOCK, ":", ":");
            return true;
        }
        if (c == '[') {
            Token open = new Token(TokenType.LIST_START, "[", "[", line, column);
            brackets.push(open);
            emit(TokenType.LIST_START, "[", "[");
            return true;
        }
        if (c == ']') {
            if (brackets.isEmpty()) {
                throw new LexerException(
                        LexerException.UNBALANCED_BRACKET,
                        String.format("closing ']' at line %d, column %d has no matching '['", line, column),
                        line,
                        column);
            }
            brackets.pop();
            emit(TokenType.LIST_END, "]", "]");
            return true;
        }
        if (c == ',') {
            emit(TokenType.COMMA, ",", ",");
            return true;
        }
        return false;
    }

    private boolean scanEnvelope() {
        if (text.startsWith(ENVELOPE_END, pos)) {
            emit(TokenType.ENVELOPE_END, "END", ENVELOPE_END);
            return true;
        }
        Matcher valid = match(ENVELOPE_START);
        if (valid != null) {
            emit(TokenType.ENVELOPE_START, valid.group(1), valid.group());
            return true;
        }
        Matcher any = match(ENVELOPE_ANY);
        if (any != null) {
            throw invalidEnvelope(any.group(1));
        }
        return false;
    }

    private LexerException invalidEnvelope(String identifier) {
        String message;
        if (identifier.isEmpty()) {
            message = "Envelope identifier is empty. Use a valid name like ===MY_DOC=== or ===MyDoc===.";
        } else if (CharClass.isDigit(identifier.charAt(0))) {
            message = String.format(
                    "Envelope identifier '%s' cannot start with a digit. Use a letter or underscore as the first"
                            + " character.",
                    identifier);
        } else {
            String bad = "?";
            for (int i = 0; i < identifier.length(); i++) {
                char ch = identifier.charAt(i);
                boolean ok = ch == '_' || (ch < 0x80 && Character.isLetter(ch)) || (i > 0 && CharClass.isDigit(ch));
                if (!ok) {
                    bad = ch == '-' ? "hyphen '-'" : ch == ' ' ? "space" : "'" + ch + "'";
                    break;
                }
            }
            message = String.format(
                    "Envelope identifier '%s' contains invalid character %s. Use underscores or CamelCase instead"
                            + " (e.g., my_document or MyDocument).",
                    identifier, bad);
        }
        return new LexerException(LexerException.INVALID_ENVELOPE_ID, message, line, column);
    }

    private boolean onlyLayoutSoFar() {
        for (Token token : tokens) {
            if (token.type() != TokenType.NEWLINE && token.type() != TokenType.INDENT) {
                return false;
            }
        }
        return true;
    }

    // ── Operators ──

    private boolean scanOperator() {
        for (String[] operator : OPERATORS) {
            if (text.startsWith(operator[0], pos)) {
                TokenType type = TokenType.valueOf(operator[1]);
                emitOperator(type, operator[0]);
                return true;
            }
        }
        if (startsWithKeyword("vs")) {
            emitOperator(TokenType.TENSION, "vs");
            return true;
        }
        return false;
    }

    private void emitOperator(TokenType type, String lexeme) {
        if (!lexeme.equals(type.symbol())) {
            repairs.add(Repair.normalization("ASCII_ALIAS", lexeme, type.symbol(), line, column));
        }
        emit(type, type.symbol(), lexeme);
    }

    // ── Literals ──

    private boolean scanLiteral() {
        char c = text.charAt(pos);
        if (c == '"') {
            scanString();
            return true;
        }
        if (CharClass.isDigit(c) || (c == '-' && pos + 1 < text.length() && CharClass.isDigit(text.charAt(pos + 1)))) {
            Matcher version = CharClass.isDigit(c) ? match(VERSION) : null;
            if (version != null) {
                emit(TokenType.VERSION, version.group(), version.group());
                return true;
            }
            Matcher number = match(NUMBER);
            if (number != null) {
                emit(TokenType.NUMBER, number.group(), number.group());
                return true;
            }
        }
        for (String keyword : KEYWORDS) {
            if (!"vs".equals(keyword) && startsWithKeyword(keyword)) {
                TokenType type = "null".equals(keyword) ? TokenType.NULL : TokenType.BOOLEAN;
                emit(type, keyword, keyword);
                return true;
            }
        }
        if (c == '$') {
            Matcher variable = match(VARIABLE);
            if (variable != null) {
                emit(TokenType.VARIABLE, variable.group(), variable.group());
                return true;
            }
        }
        return false;
    }

    private boolean startsWithKeyword(String keyword) {
        if (!text.startsWith(keyword, pos)) {
            return false;
        }
        if (pos > 0 && CharClass.isWordChar(text.codePointBefore(pos))) {
            return false;
        }
        int after = pos + keyword.length();
        return after >= text.length() || !CharClass.isWordChar(text.codePointAt(after));
    }

    private void scanString() {
        boolean triple = text.startsWith("\"\"\"", pos);
        int quoteLength = triple ? 3 : 1;
        int i = pos + quoteLength;
        StringBuilder decoded = new StringBuilder();
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case '"' -> decoded.append('"');
                    case '\\' -> decoded.append('\\');
                    case 'n' -> decoded.append('\n');
                    case 't' -> decoded.append('\t');
                    default -> decoded.append(ch).append(next);
                }
                i += 2;
                continue;
            }
            if (ch == '"' && (!triple || text.startsWith("\"\"\"", i))) {
                String lexeme = text.substring(pos, i + quoteLength);
                if (triple) {
                    repairs.add(Repair.normalization("TRIPLE_QUOTE", "\"\"\"", "\"", line, column));
                }
                emit(TokenType.STRING, decoded.toString(), lexeme);
                return;
            }
            decoded.append(ch);
            i++;
        }
        throw new LexerException(LexerException.UNTERMINATED_STRING, "Unterminated string literal", line, column);
    }

    // ── Identifiers and leftovers ──

    private void scanWordLike() {
        int cp = text.codePointAt(pos);
        if (CharClass.isIdentifierStart(cp)) {
            scanIdentifier();
            return;
        }
        Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        if (cp == '%' && mergesPercent(last)) {
            mergePercent(last);
            return;
        }
        if (cp == '{' && last != null && last.is(TokenType.IDENTIFIER) && last.isAdjacentTo(here())) {
            int[] qualifier = curlyQualifier(pos);
            if (qualifier != null) {
                String q = text.substring(qualifier[0], qualifier[1]);
                throw new LexerException(
                        LexerException.FORBIDDEN_CHARACTER,
                        String.format(
                                "Unexpected character: '{'. W_REPAIR_CANDIDATE::%s{%s} should be %s<%s>. Use angle"
                                        + " brackets <> for annotation qualifiers, not curly braces {}.",
                                last.value(), q, last.value(), q),
                        line,
                        column);
            }
        }
        throw new LexerException(
                LexerException.FORBIDDEN_CHARACTER,
                String.format("Unexpected character: '%s'", new String(Character.toChars(cp))),
                line,
                column);
    }

    private void scanIdentifier() {
        int end = pos + Character.charCount(text.codePointAt(pos));
        while (end < text.length() && CharClass.isIdentifierPart(text.codePointAt(end))) {
            end += Character.charCount(text.codePointAt(end));
        }
        while (end > pos + 1 && text.charAt(end - 1) == '-') {
            end--;
        }
        String name = text.substring(pos, end);

        int annotationEnd = angleQualifierEnd(end);
        if (annotationEnd > 0) {
            String annotated = text.substring(pos, annotationEnd);
            emitIdentifier(annotated, annotated);
            return;
        }
        int[] curly = curlyQualifier(end);
        if (curly != null && lenient) {
            String qualifier = text.substring(curly[0], curly[1]);
            String original = text.substring(pos, curly[1] + 1);
            String repaired = name + "<" + qualifier + ">";
            repairs.add(new Repair(
                    "W_REPAIR_CANDIDATE",
                    Repair.Tier.REPAIR,
                    original,
                    repaired,
                    line,
                    column,
                    String.format(
                            "W_REPAIR_CANDIDATE::%s repaired to %s. Use angle brackets <> for annotation qualifiers,"
                                    + " not curly braces {}.",
                            original, repaired),
                    false));
            emitIdentifier(repaired, original);
            return;
        }
        emitIdentifier(name, name);
    }

    private void emitIdentifier(String value, String lexeme) {
        String correct = WRONG_CASE.get(value);
        if (correct != null) {
            repairs.add(new Repair(
                    "W_WRONG_CASE",
                    Repair.Tier.ADVISORY,
                    value,
                    value,
                    line,
                    column,
                    String.format(
                            "W_WRONG_CASE::%s should be %s. Boolean and null literals are lowercase.", value, correct),
                    false));
        }
        int vs = value.toLowerCase(java.util.Locale.ROOT).indexOf("vs");
        if (vs > 0 && vs + 2 < value.length()) {
            repairs.add(new Repair(
                    "W_BOUNDARY_MISSING",
                    Repair.Tier.ADVISORY,
                    value,
                    value,
                    line,
                    column,
                    String.format(
                            "W_BOUNDARY_MISSING::'%s' contains 'vs' without word boundaries. Use 'Speed vs Quality'"
                                    + " (with spaces) or bracket syntax [Speed vs Quality].",
                            value),
                    false));
        }
        emit(TokenType.IDENTIFIER, value, lexeme);
    }

    /** End offset (exclusive) of a {@code <qualifier>} starting at {@code from}, or -1. */
    private int angleQualifierEnd(int from) {
        if (from >= text.length() || text.charAt(from) != '<') {
            return -1;
        }
        int start = from + 1;
        if (start < text.length() && text.charAt(start) == '>') {
            return start + 1;
        }
        if (start >= text.length() || !CharClass.isIdentifierStart(text.codePointAt(start))) {
            return -1;
        }
        int end = start + Character.charCount(text.codePointAt(start));
        while (end < text.length()
                && (CharClass.isIdentifierPart(text.codePointAt(end)) || text.charAt(end) == ',')) {
            end += Character.charCount(text.codePointAt(end));
        }
        while (end > start + 1 && text.charAt(end - 1) == '-') {
            end--;
        }
        return end < text.length() && text.charAt(end) == '>' ? end + 1 : -1;
    }

    /** Qualifier bounds {@code [start, end)} of a {@code {qualifier}} at {@code from}; end points at '}'. */
    private int[] curlyQualifier(int from) {
        if (from >= text.length() || text.charAt(from) != '{') {
            return null;
        }
        int start = from + 1;
        if (start >= text.length() || !CharClass.isIdentifierStart(text.codePointAt(start))) {
            return null;
        }
        int end = start + Character.charCount(text.codePointAt(start));
        while (end < text.length() && CharClass.isIdentifierPart(text.codePointAt(end))) {
            end += Character.charCount(text.codePointAt(end));
        }
        while (end > start + 1 && text.charAt(end - 1) == '-') {
            end--;
        }
        return end < text.length() && text.charAt(end) == '}' ? new int[] {start, end} : null;
    }

    /** {@code %} directly after an alphanumeric number or identifier belongs to it ({@code 60%}), except before {@code ::}. */
    private boolean mergesPercent(Token last) {
        if (last == null || !(last.is(TokenType.NUMBER) || last.is(TokenType.IDENTIFIER))) {
            return false;
        }
        if (!last.isAdjacentTo(here()) || text.startsWith("::", pos + 1)) {
            return false;
        }
        String lexeme = last.lexeme();
        return !lexeme.isEmpty() && Character.isLetterOrDigit(lexeme.codePointBefore(lexeme.length()));
    }

    private void mergePercent(Token last) {
        int end = pos + 1;
        while (end < text.length() && CharClass.isIdentifierPart(text.codePointAt(end))) {
            end += Character.charCount(text.codePointAt(end));
        }
        while (end > pos + 1 && text.charAt(end - 1) == '-') {
            end--;
        }
        String suffix = text.substring(pos, end);
        String merged = last.lexeme() + suffix;
        tokens.set(tokens.size() - 1, new Token(TokenType.IDENTIFIER, merged, merged, last.line(), last.column()));
        advance(suffix);
    }

    // ── Helpers ──

    private Token here() {
        return new Token(TokenType.EOF, "", "", line, column);
    }

    private Matcher match(Pattern pattern) {
        Matcher m = pattern.matcher(text);
        m.region(pos, text.length());
        return m.lookingAt() ? m : null;
    }

    private void emit(TokenType type, String value, String lexeme) {
        tokens.add(new Token(type, value, lexeme, line, column));
        advance(lexeme);
    }

    private void advance(String consumed) {
        pos += consumed.length();
        int lastNewline = consumed.lastIndexOf('\n');
        if (lastNewline < 0) {
            column += consumed.codePointCount(0, consumed.length());
            return;
        }
        for (int i = 0; i < consumed.length(); i++) {
            if (consumed.charAt(i) == '\n') {
                line++;
            }
        }
        column = 1 + consumed.codePointCount(lastNewline + 1, consumed.length());
    }
}
