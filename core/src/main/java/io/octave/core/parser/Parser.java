package io.octave.core.parser;

import io.octave.core.emit.Emitter;
import io.octave.core.error.ParserException;
import io.octave.core.lexer.LexResult;
import io.octave.core.lexer.Lexer;
import io.octave.core.lexer.Token;
import io.octave.core.lexer.TokenType;
import io.octave.core.model.Assignment;
import io.octave.core.model.Block;
import io.octave.core.model.BooleanValue;
import io.octave.core.model.Comment;
import io.octave.core.model.Container;
import io.octave.core.model.Document;
import io.octave.core.model.HolographicValue;
import io.octave.core.model.InlineMap;
import io.octave.core.model.ListValue;
import io.octave.core.model.LiteralZone;
import io.octave.core.model.Node;
import io.octave.core.model.NullValue;
import io.octave.core.model.NumberValue;
import io.octave.core.model.Section;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Document} from OCTAVE text.
 *
 * <p>Structure is indentation-driven. The parser keeps an explicit stack of open containers, each
 * with the indent of its header line. Before a line is placed, every container whose header is
 * indented at least as far as the line is closed. A sibling written at the parent's column
 * therefore ends the block even though no dedent token exists.
 *
 * <p>Every lenient correction is recorded as a {@link ParseWarning}; hard errors are thrown as
 * {@link ParserException} (or {@link io.octave.core.error.LexerException} from the lexer).
 * Each call works on private state, so the class is safe to use from many threads.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final String META_KEY = "META";

    /** List-item keys that are almost always a mistyped constructor ({@code REGEX[...]}). */
    private static final Set<String> CONSTRUCTOR_KEYS = Set.of("REGEX", "ENUM", "TYPE", "PATTERN", "NEVER", "ALWAYS");

    /** Keys whose string values are literal match targets; the emitter always quotes them. */
    private static final Set<String> ALWAYS_QUOTED_KEYS = Set.of("PATTERN", "REGEX");

    /** Words that may follow the first {@code ∧} of a holographic pattern. */
    private static final Set<String> CONSTRAINT_WORDS = Set.of(
            "REQ", "REQUIRED", "OPT", "OPTIONAL", "TYPE", "ENUM", "CONST", "REGEX", "RANGE", "MIN_LENGTH",
            "MAX_LENGTH", "DATE", "ISO8601", "LANG", "DIR", "APPEND_ONLY");

    private final List<Token> tokens;
    private final ParserOptions options;
    private final List<ParseWarning> warnings = new ArrayList<>();
    private final List<KeyIndex> keyIndexes = new ArrayList<>();
    private final List<PendingComment> pending = new ArrayList<>();
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final List<Node> topLevel = new ArrayList<>();
    private boolean separator;
    private boolean deepNestingReported;
    private int pos;

    private Parser(List<Token> tokens, ParserOptions options) {
        this.tokens = tokens;
        this.options = options;
    }

    // ── Entry points ──

    /**
     * Parses a document, discarding warnings.
     *
     * @throws ParserException                          on a structural hard error
     * @throws io.octave.core.error.LexerException if the text cannot be tokenized
     */
    public static Document parse(String text) {
        return parseWithWarnings(text, ParserOptions.DEFAULT).document();
    }

    public static Document parse(String text, ParserOptions options) {
        return parseWithWarnings(text, options).document();
    }

    public static ParseResult parseWithWarnings(String text) {
        return parseWithWarnings(text, ParserOptions.DEFAULT);
    }

    /**
     * Parses a document and returns it with every warning and lexer repair. Warnings never abort
     * the call; hard errors still do.
     */
    public static ParseResult parseWithWarnings(String text, ParserOptions options) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(options, "options must not be null");

        FrontMatter frontMatter = FrontMatter.split(text);
        LexResult lexed = Lexer.tokenize(frontMatter.body(), options.lenient(), frontMatter.firstLine());
        Parser parser = new Parser(lexed.tokens(), options);
        Document document = parser.parseDocument(frontMatter.text());

        LOG.debug("Parsed document '{}': {} top-level nodes, {} warnings, {} repairs",
                document.name(), document.nodes().size(), parser.warnings.size(), lexed.repairs().size());
        return new ParseResult(document, parser.warnings, lexed.repairs());
    }

    // ── Document ──

    private Document parseDocument(String frontMatter) {
        skipPreamble();
        String grammarVersion = null;
        if (current().is(TokenType.GRAMMAR_SENTINEL)) {
            grammarVersion = advance().value();
            skipPreamble();
        }

        String name;
        boolean explicitEnvelope = current().is(TokenType.ENVELOPE_START);
        if (explicitEnvelope) {
            name = advance().value();
        } else {
            name = Document.INFERRED_NAME;
            warn(ParseWarning.ENVELOPE_INFERRED, "structure", "envelope_inferred",
                    "W_ENVELOPE_INFERRED::No ===NAME=== envelope; document named " + Document.INFERRED_NAME,
                    current(), List.of(), Document.INFERRED_NAME, null);
        }

        stack.push(new Frame(-1, null, newKeyIndex()));
        parseBody();
        flushComments(0);
        List<String> trailingComments = new ArrayList<>();
        pending.forEach(c -> trailingComments.add(c.text()));
        pending.clear();

        if (current().is(TokenType.ENVELOPE_END)) {
            advance();
            dropTrailingContent();
        } else if (explicitEnvelope) {
            warn(ParseWarning.MISSING_END, "structure", "missing_end",
                    "W_MISSING_END::Document has no ===END=== marker", current(), List.of(), "===END===", null);
        }
        reportDuplicateKeys();

        Document.Builder builder = Document.builder(name)
                .frontMatter(frontMatter)
                .grammarVersion(grammarVersion)
                .separator(separator)
                .trailingComments(trailingComments);
        boolean metaTaken = false;
        for (Node node : topLevel) {
            if (!metaTaken && node instanceof Block block && META_KEY.equals(block.key())) {
                builder.meta(toMap(block));
                metaTaken = true;
            } else {
                builder.node(node);
            }
        }
        return builder.build();
    }

    private void dropTrailingContent() {
        List<String> dropped = new ArrayList<>();
        Token first = null;
        while (!current().is(TokenType.EOF)) {
            Token t = advance();
            if (t.is(TokenType.NEWLINE) || t.is(TokenType.INDENT)) {
                continue;
            }
            if (first == null) {
                first = t;
            }
            dropped.add(t.lexeme());
        }
        if (first != null) {
            warn(ParseWarning.TRAILING_CONTENT, "structure", "trailing_content",
                    "W_TRAILING_CONTENT::Content after ===END=== was dropped", first, dropped, null, null);
        }
    }

    /** META holds values only; every comment inside it is reported as dropped. */
    private Map<String, Value> toMap(Container container) {
        Map<String, Value> entries = new LinkedHashMap<>();
        dropMetaComments(container.leadingComments(), container.line());
        for (Node child : container.children()) {
            if (child instanceof Assignment assignment) {
                dropMetaComments(assignment.leadingComments(), assignment.line());
                if (assignment.trailingComment() != null) {
                    dropMetaComments(List.of(assignment.trailingComment()), assignment.line());
                }
                entries.put(assignment.key(), assignment.value());
            } else if (child instanceof Container nested) {
                entries.put(nested.key(), new InlineMap(toMap(nested)));
            } else if (child instanceof Comment comment) {
                dropMetaComments(List.of(comment.text()), comment.line());
            }
        }
        return entries;
    }

    private void dropMetaComments(List<String> comments, int line) {
        if (comments.isEmpty()) {
            return;
        }
        warnings.add(new ParseWarning(ParseWarning.META_COMMENT_DROPPED, "structure", "meta_comment_dropped",
                String.format("W_META_COMMENT_DROPPED::Comment in META at line %d was dropped", line),
                line, 1, comments, null, null));
    }

    // ── Body: one iteration per line ──

    private void parseBody() {
        while (true) {
            Token t = current();
            if (t.is(TokenType.EOF) || t.is(TokenType.ENVELOPE_END)) {
                return;
            }
            if (t.is(TokenType.NEWLINE)) {
                advance();
                continue;
            }
            int indent = 0;
            if (t.is(TokenType.INDENT)) {
                indent = advance().width();
                t = current();
            }
            if (t.is(TokenType.ENVELOPE_END) || t.is(TokenType.EOF)) {
                return;
            }
            if (t.is(TokenType.COMMENT)) {
                Token comment = advance();
                pending.add(new PendingComment(comment.value(), indent, comment.line()));
                continue;
            }

            flushComments(indent);
            while (stack.size() > 1 && stack.peek().indent() >= indent) {
                stack.pop();
            }
            List<String> leading = pending.stream().map(PendingComment::text).toList();
            pending.clear();

            Node node = parseLine(indent, leading);
            if (node != null) {
                place(node);
                if (node instanceof Container container) {
                    stack.push(new Frame(indent, container, newKeyIndex()));
                }
            }
        }
    }

    /** Comments indented deeper than the next line belong to a container that ends before it. */
    private void flushComments(int nextIndent) {
        List<PendingComment> keep = new ArrayList<>();
        for (PendingComment comment : pending) {
            if (comment.indent() <= nextIndent) {
                keep.add(comment);
                continue;
            }
            Frame owner = null;
            for (Frame frame : stack) {
                if (frame.indent() < comment.indent()) {
                    owner = frame;
                    break;
                }
            }
            Comment node = new Comment(comment.text(), comment.line());
            if (owner == null || owner.container() == null) {
                topLevel.add(node);
            } else {
                owner.container().add(node);
            }
        }
        pending.clear();
        pending.addAll(keep);
    }

    private void place(Node node) {
        Frame frame = stack.peek();
        if (frame.container() == null) {
            topLevel.add(node);
        } else {
            frame.container().add(node);
        }
        if (!(node instanceof Comment) && !node.key().isEmpty()) {
            frame.keys().record(node.key(), node.line());
        }
    }

    private Node parseLine(int indent, List<String> leading) {
        Token t = current();
        switch (t.type()) {
            case SECTION:
                return parseSection(indent, leading);
            case FENCE_OPEN:
                Token fence = t;
                return new Assignment("", parseLiteralZone(), fence.line(), leading, null);
            case IDENTIFIER:
                if (peek(1).is(TokenType.ASSIGN) || peek(1).is(TokenType.BLOCK)
                        || (peek(1).is(TokenType.LIST_START) && t.isAdjacentTo(peek(1)) && blockTargetAhead())) {
                    return parseKeyed(indent, leading);
                }
                break;
            case SEPARATOR:
                if (indent == 0 && !topLevel.isEmpty() && isMeta(topLevel.get(topLevel.size() - 1))) {
                    separator = true;
                    advance();
                    expectLineEnd();
                    return null;
                }
                break;
            default:
                break;
        }
        dropBareLine();
        return null;
    }

    private static boolean isMeta(Node node) {
        return node instanceof Block block && META_KEY.equals(block.key());
    }

    private void dropBareLine() {
        Token first = current();
        List<String> dropped = restOfLine();
        warn(ParseWarning.BARE_LINE, "lenient_parse", "bare_line",
                "W_BARE_LINE::Line is not an assignment, block or section and was dropped: " + String.join(" ", dropped),
                first, dropped, null, null);
    }

    // ── Assignments and blocks ──

    private Node parseKeyed(int indent, List<String> leading) {
        Token keyToken = advance();
        String key = keyToken.value();
        String target = null;
        if (current().is(TokenType.LIST_START)) {
            target = parseBlockTarget();
        }

        if (current().is(TokenType.BLOCK)) {
            Token colon = advance();
            if (!atLineEnd()) {
                Token next = current();
                throw new ParserException(
                        ParserException.AMBIGUOUS_SINGLE_COLON,
                        String.format(
                                "Single colon assignment detected: '%s: %s'. Use '%s::%s' (double colon) for"
                                        + " assignments. Single colon ':' is reserved for block definitions only.",
                                key, next.lexeme(), key, next.lexeme()),
                        colon.line(),
                        colon.column());
            }
            holdHeaderComment(indent);
            return new Block(key, target, keyToken.line(), leading);
        }

        if (!current().is(TokenType.ASSIGN) || target != null) {
            Token bad = current();
            throw new ParserException(
                    ParserException.MALFORMED,
                    String.format("Expected ':' after routed block header '%s', got '%s'", key, bad.lexeme()),
                    bad.line(),
                    bad.column());
        }
        Token assign = advance();
        Value value;
        if (atLineEnd()) {
            if (!fenceOnNextLine()) {
                throw new ParserException(
                        ParserException.MISSING_VALUE,
                        String.format("'%s::' requires a value", key),
                        assign.line(),
                        assign.column());
            }
            advance();
            if (current().is(TokenType.INDENT)) {
                advance();
            }
            value = parseLiteralZone();
        } else {
            Token valueStart = current();
            value = parseLineValue();
            if (ALWAYS_QUOTED_KEYS.contains(key) && value instanceof StringValue s && !valueStart.is(TokenType.STRING)) {
                warn(ParseWarning.AUTO_QUOTED, "normalization", "auto_quote",
                        String.format("W_AUTO_QUOTED::%s value '%s' is a literal match target and will be quoted",
                                key, s.value()),
                        valueStart, List.of(s.value()), Emitter.quote(s.value()), null);
            }
        }
        String trailing = current().is(TokenType.COMMENT) ? advance().value() : null;
        return new Assignment(key, value, keyToken.line(), leading, trailing);
    }

    /** A same-line comment after a block header is kept with the block's content. */
    private void holdHeaderComment(int indent) {
        if (current().is(TokenType.COMMENT)) {
            Token comment = advance();
            pending.add(new PendingComment(comment.value(), indent + 1, comment.line()));
        }
    }

    private boolean blockTargetAhead() {
        int depth = 0;
        for (int i = pos + 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(TokenType.LIST_START)) {
                depth++;
            } else if (t.is(TokenType.LIST_END)) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).is(TokenType.BLOCK);
                }
            } else if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF)) {
                return false;
            }
        }
        return false;
    }

    /** {@code [→§TARGET]} after a block key; returns the target name without arrow or section mark. */
    private String parseBlockTarget() {
        Token open = advance();
        if (current().is(TokenType.FLOW)) {
            advance();
        }
        if (current().is(TokenType.SECTION)) {
            advance();
        }
        StringBuilder target = new StringBuilder();
        while (!current().is(TokenType.LIST_END)) {
            Token t = advance();
            target.append(t.is(TokenType.SECTION) ? "§" : t.is(TokenType.IDENTIFIER) ? t.value() : t.lexeme());
        }
        advance();
        if (target.length() == 0) {
            throw new ParserException(
                    ParserException.MALFORMED, "Block target is empty", open.line(), open.column());
        }
        return target.toString();
    }

    private boolean fenceOnNextLine() {
        int i = pos;
        if (!tokens.get(i).is(TokenType.NEWLINE)) {
            return false;
        }
        i++;
        if (tokens.get(i).is(TokenType.INDENT)) {
            i++;
        }
        return tokens.get(i).is(TokenType.FENCE_OPEN);
    }

    private LiteralZone parseLiteralZone() {
        Token open = advance();
        String content = advance().value();
        advance();
        return new LiteralZone(content, open.infoTag(), open.value());
    }

    // ── Sections ──

    private Section parseSection(int indent, List<String> leading) {
        Token mark = advance();
        StringBuilder id = new StringBuilder();
        Token previous = mark;
        while ((current().is(TokenType.NUMBER) || current().is(TokenType.IDENTIFIER)
                        || current().is(TokenType.VERSION))
                && previous.isAdjacentTo(current())) {
            previous = advance();
            id.append(previous.is(TokenType.IDENTIFIER) ? previous.value() : previous.lexeme());
        }
        if (id.length() == 0 || !current().is(TokenType.ASSIGN)) {
            Token bad = current();
            throw new ParserException(
                    ParserException.MALFORMED,
                    String.format("Expected §ID::NAME section marker, got '%s'", bad.lexeme()),
                    bad.line(),
                    bad.column());
        }
        advance();

        String name = id.toString();
        if (current().is(TokenType.IDENTIFIER)) {
            name = advance().value();
        }
        String annotation = null;
        if (current().is(TokenType.LIST_START)) {
            annotation = bracketText();
        }
        if (!atLineEnd()) {
            dropTrailingTokens();
        }
        holdHeaderComment(indent);
        return new Section(id.toString(), name, annotation, mark.line(), leading);
    }

    // ── Values ──

    /** Everything after {@code ::} up to the end of the line (lists may span lines). */
    private Value parseLineValue() {
        deepNestingReported = false;
        Token start = current();
        List<Piece> pieces = new ArrayList<>();
        while (!atLineEnd()) {
            Piece piece = parseTerm(0);
            if (piece == null) {
                dropTrailingTokens();
                break;
            }
            pieces.add(piece);
        }
        return combine(pieces, start);
    }

    /**
     * Folds the terms of one value position into a single value. One term is itself. A run that
     * contains an annotation, constructor or list is a list of those terms; any other run is
     * joined with spaces into one string.
     */
    private Value combine(List<Piece> pieces, Token start) {
        if (pieces.size() == 1) {
            return pieces.get(0).value();
        }
        List<String> lexemes = pieces.stream().flatMap(p -> p.lexemes().stream()).toList();
        if (pieces.stream().anyMatch(Piece::structured)) {
            ListValue list = new ListValue(pieces.stream().map(Piece::value).toList());
            warn(ParseWarning.LIST_INFERRED, "lenient_parse", "list_inferred",
                    String.format("W_LIST_INFERRED::%d space-separated items read as a list", pieces.size()),
                    start, lexemes, Emitter.emitValue(list), null);
            return list;
        }
        String joined = pieces.stream().map(Piece::text).collect(Collectors.joining(" "));
        warn(ParseWarning.MULTI_WORD, "lenient_parse", "multi_word_coalesce",
                String.format("W_MULTI_WORD::Coalesced %d tokens into '%s'", pieces.size(), joined),
                start, lexemes, joined, null);
        return new StringValue(joined);
    }

    private Piece parseTerm(int depth) {
        Token t = current();
        if (t.is(TokenType.LIST_START)) {
            Value list = parseList(depth + 1);
            return new Piece(list, Emitter.emitValue(list), List.of(Emitter.emitValue(list)), true);
        }
        if (!t.type().isExpressionOperator() && !startsOperand(t)) {
            return null;
        }
        List<String> lexemes = new ArrayList<>();
        Piece first = t.type().isExpressionOperator() ? null : parseOperand(depth, lexemes);
        if (!current().type().isExpressionOperator()) {
            return first;
        }
        StringBuilder expression = new StringBuilder(first == null ? "" : first.text());
        while (current().type().isExpressionOperator()) {
            Token operator = advance();
            lexemes.add(operator.lexeme());
            expression.append(operator.value());
            if (startsOperand(current())) {
                expression.append(parseOperand(depth, lexemes).text());
            }
        }
        String text = expression.toString();
        return new Piece(new StringValue(text), text, lexemes, false);
    }

    private static boolean startsOperand(Token t) {
        return t.type().isAtom() || t.is(TokenType.SECTION);
    }

    private Piece parseOperand(int depth, List<String> lexemes) {
        Token t = advance();
        lexemes.add(t.lexeme());
        switch (t.type()) {
            case SECTION: {
                String text = "§";
                if (current().type().isAtom() && t.isAdjacentTo(current())) {
                    Token name = advance();
                    lexemes.add(name.lexeme());
                    text += name.is(TokenType.STRING) ? name.value() : name.lexeme();
                }
                return new Piece(new StringValue(text), text, lexemes, false);
            }
            case STRING:
                return new Piece(new StringValue(t.value()), t.value(), lexemes, false);
            case NUMBER:
                return new Piece(NumberValue.parse(t.lexeme()), t.lexeme(), lexemes, false);
            case BOOLEAN:
                return new Piece(BooleanValue.of("true".equals(t.value())), t.value(), lexemes, false);
            case NULL:
                return new Piece(NullValue.INSTANCE, "null", lexemes, false);
            case IDENTIFIER: {
                if (current().is(TokenType.LIST_START) && t.isAdjacentTo(current())) {
                    String constructor = t.value() + "<" + constructorArguments(depth + 1) + ">";
                    lexemes.set(lexemes.size() - 1, constructor);
                    return new Piece(new StringValue(constructor), constructor, lexemes, true);
                }
                StringBuilder text = new StringBuilder(t.value());
                Token previous = t;
                while (current().is(TokenType.BLOCK)
                        && previous.isAdjacentTo(current())
                        && (peek(1).is(TokenType.IDENTIFIER) || peek(1).is(TokenType.NUMBER))
                        && current().isAdjacentTo(peek(1))) {
                    advance();
                    previous = advance();
                    text.append(':').append(previous.is(TokenType.IDENTIFIER) ? previous.value() : previous.lexeme());
                    lexemes.add(":" + previous.lexeme());
                }
                boolean annotated = text.indexOf("<") > 0 && text.charAt(text.length() - 1) == '>';
                return new Piece(new StringValue(text.toString()), text.toString(), lexemes, annotated);
            }
            default:
                // VERSION and VARIABLE
                return new Piece(new StringValue(t.value()), t.value(), lexemes, false);
        }
    }

    /** Payload of {@code NAME[args]}, with comments and line breaks filtered out. */
    private String constructorArguments(int depth) {
        enterBrackets(depth, current());
        return bracketText();
    }

    /**
     * Consumes a bracketed run and renders its tokens as compact text. Layout and comments inside
     * the brackets are dropped.
     */
    private String bracketText() {
        advance();
        StringBuilder text = new StringBuilder();
        int depth = 1;
        Token previous = null;
        while (depth > 0) {
            Token t = advance();
            if (t.is(TokenType.EOF)) {
                throw new ParserException(ParserException.MALFORMED, "Unclosed '['", t.line(), t.column());
            }
            if (t.type().isLayout()) {
                continue;
            }
            if (t.is(TokenType.LIST_START)) {
                depth++;
            } else if (t.is(TokenType.LIST_END) && --depth == 0) {
                break;
            }
            if (previous != null && isWordLike(previous) && isWordLike(t) && !previous.isAdjacentTo(t)) {
                text.append(' ');
            }
            text.append(render(t));
            previous = t;
        }
        return text.toString();
    }

    private static boolean isWordLike(Token t) {
        return t.type().isAtom();
    }

    private static String render(Token t) {
        return switch (t.type()) {
            case STRING -> Emitter.quote(t.value());
            case IDENTIFIER, BOOLEAN, NULL, VARIABLE -> t.value();
            case NUMBER, VERSION -> t.lexeme();
            default -> t.type().symbol() != null ? t.type().symbol() : t.lexeme();
        };
    }

    // ── Lists ──

    private Value parseList(int depth) {
        Token open = current();
        enterBrackets(depth, open);
        advance();
        skipListLayout();
        if (holographicAhead()) {
            return parseHolographic(depth);
        }

        List<Value> items = new ArrayList<>();
        while (!current().is(TokenType.LIST_END)) {
            if (current().is(TokenType.EOF)) {
                throw new ParserException(ParserException.MALFORMED, "Unclosed '['", open.line(), open.column());
            }
            if (current().is(TokenType.IDENTIFIER) && peek(1).is(TokenType.ASSIGN)) {
                items.add(parseMapItem(depth));
            } else if (current().is(TokenType.COMMA)) {
                advance();
            } else {
                Token start = current();
                List<Piece> pieces = itemPieces(depth);
                if (pieces.isEmpty()) {
                    Token stray = advance();
                    warn(ParseWarning.TRAILING_TOKENS, "lenient_parse", "trailing_tokens",
                            "W_TRAILING_TOKENS::Dropped '" + stray.lexeme() + "' inside list",
                            stray, List.of(stray.lexeme()), null, null);
                } else if (pieces.size() > 1 && pieces.stream().anyMatch(Piece::structured)) {
                    combine(pieces, start);
                    pieces.forEach(p -> items.add(p.value()));
                } else {
                    items.add(combine(pieces, start));
                }
            }
            skipListLayout();
            if (current().is(TokenType.COMMA)) {
                advance();
                skipListLayout();
            }
        }
        advance();
        return new ListValue(items);
    }

    private List<Piece> itemPieces(int depth) {
        List<Piece> pieces = new ArrayList<>();
        skipListLayout();
        while (!current().is(TokenType.COMMA) && !current().is(TokenType.LIST_END)) {
            Piece piece = parseTerm(depth);
            if (piece == null) {
                break;
            }
            pieces.add(piece);
            skipListLayout();
        }
        return pieces;
    }

    private InlineMap parseMapItem(int depth) {
        Token key = advance();
        Token assign = advance();
        if (CONSTRUCTOR_KEYS.contains(key.value())) {
            warn(ParseWarning.CONSTRUCTOR_MISUSE, "structure", "constructor_misuse",
                    String.format("W_CONSTRUCTOR_MISUSE::'%s::' inside a list. Did you mean the constructor %s[...]?",
                            key.value(), key.value()),
                    key, List.of(key.lexeme(), assign.lexeme()), null, null);
        }
        Token start = current();
        List<Piece> pieces = itemPieces(depth);
        if (pieces.isEmpty()) {
            throw new ParserException(
                    ParserException.MISSING_VALUE,
                    String.format("'%s::' requires a value", key.value()),
                    assign.line(),
                    assign.column());
        }
        return InlineMap.of(key.value(), combine(pieces, start));
    }

    private void skipListLayout() {
        while (current().type().isLayout()) {
            advance();
        }
    }

    // ── Holographic patterns ──

    /** First item followed by {@code ∧} and a constraint keyword: {@code ["x"∧REQ→§T]}. */
    private boolean holographicAhead() {
        int i = pos;
        Token first = tokens.get(i);
        if (first.is(TokenType.LIST_START)) {
            int depth = 0;
            for (; i < tokens.size(); i++) {
                if (tokens.get(i).is(TokenType.LIST_START)) {
                    depth++;
                } else if (tokens.get(i).is(TokenType.LIST_END) && --depth == 0) {
                    break;
                }
            }
        } else if (!first.type().isAtom()) {
            return false;
        }
        i++;
        return i + 1 < tokens.size()
                && tokens.get(i).is(TokenType.CONSTRAINT)
                && tokens.get(i + 1).is(TokenType.IDENTIFIER)
                && CONSTRAINT_WORDS.contains(tokens.get(i + 1).value());
    }

    private HolographicValue parseHolographic(int depth) {
        Piece example = current().is(TokenType.LIST_START)
                ? parseTerm(depth)
                : parseOperand(depth, new ArrayList<>());
        advance();

        StringBuilder constraints = new StringBuilder();
        StringBuilder target = null;
        int nested = 0;
        while (true) {
            Token t = current();
            if (t.is(TokenType.EOF)) {
                throw new ParserException(ParserException.MALFORMED, "Unclosed holographic pattern", t.line(), t.column());
            }
            if (t.type().isLayout()) {
                advance();
                continue;
            }
            if (t.is(TokenType.LIST_END) && nested == 0) {
                advance();
                break;
            }
            if (t.is(TokenType.FLOW) && nested == 0 && target == null) {
                advance();
                target = new StringBuilder();
                continue;
            }
            if (t.is(TokenType.LIST_START)) {
                enterBrackets(depth + ++nested, t);
            } else if (t.is(TokenType.LIST_END)) {
                nested--;
            }
            advance();
            (target == null ? constraints : target).append(render(t));
        }

        String exampleText = Emitter.emitValue(example.value());
        String targetText = target == null || target.length() == 0 ? null : target.toString();
        String raw = "[" + exampleText + "∧" + constraints + (targetText == null ? "" : "→" + targetText) + "]";
        return new HolographicValue(example.value(), constraints.toString(), targetText, raw);
    }

    // ── Nesting ──

    private void enterBrackets(int depth, Token at) {
        if (depth >= ParserOptions.MAX_NESTING_DEPTH) {
            throw new ParserException(
                    ParserException.MAX_NESTING_EXCEEDED,
                    String.format(
                            "Nesting depth %d reaches the maximum of %d", depth, ParserOptions.MAX_NESTING_DEPTH),
                    at.line(),
                    at.column());
        }
        if (depth >= options.deepNestingThreshold() && !deepNestingReported) {
            deepNestingReported = true;
            warn(ParseWarning.DEEP_NESTING, "lenient_parse", "deep_nesting",
                    String.format("W_DEEP_NESTING::depth %d at line %d, consider flattening", depth, at.line()),
                    at, List.of(at.lexeme()), null, Map.of("depth", depth));
        }
    }

    // ── Duplicate keys ──

    private KeyIndex newKeyIndex() {
        KeyIndex index = new KeyIndex(new LinkedHashMap<>());
        keyIndexes.add(index);
        return index;
    }

    private void reportDuplicateKeys() {
        for (KeyIndex index : keyIndexes) {
            index.lines().forEach((key, lines) -> {
                if (lines.size() < 2) {
                    return;
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("key", key);
                details.put("first_line", lines.get(0));
                details.put("duplicate_lines", List.copyOf(lines.subList(1, lines.size())));
                details.put("count", lines.size());
                warnings.add(new ParseWarning(
                        ParseWarning.DUPLICATE_KEY,
                        "structure",
                        "duplicate_key",
                        String.format("W_DUPLICATE_KEY::'%s' defined %d times (lines %s); the last value wins",
                                key, lines.size(), lines),
                        lines.get(lines.size() - 1),
                        1,
                        List.of(key),
                        null,
                        details));
            });
        }
    }

    // ── Token helpers ──

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return t;
    }

    private boolean atLineEnd() {
        TokenType type = current().type();
        return type == TokenType.NEWLINE
                || type == TokenType.EOF
                || type == TokenType.COMMENT
                || type == TokenType.ENVELOPE_END;
    }

    /** Blank lines and comments before the envelope; the comments go to the first node. */
    private void skipPreamble() {
        while (current().type().isLayout()) {
            Token t = advance();
            if (t.is(TokenType.COMMENT)) {
                pending.add(new PendingComment(t.value(), 0, t.line()));
            }
        }
    }

    private void expectLineEnd() {
        if (!atLineEnd()) {
            dropTrailingTokens();
        }
    }

    private List<String> restOfLine() {
        List<String> lexemes = new ArrayList<>();
        int bracketDepth = 0;
        while (!current().is(TokenType.EOF)
                && (bracketDepth > 0 || !(current().is(TokenType.NEWLINE) || current().is(TokenType.ENVELOPE_END)))) {
            Token t = advance();
            if (t.is(TokenType.LIST_START)) {
                bracketDepth++;
            } else if (t.is(TokenType.LIST_END)) {
                bracketDepth--;
            }
            if (!t.type().isLayout() || t.is(TokenType.COMMENT)) {
                lexemes.add(t.lexeme());
            }
        }
        return lexemes;
    }

    private void dropTrailingTokens() {
        Token first = current();
        List<String> dropped = new ArrayList<>();
        while (!atLineEnd()) {
            dropped.addAll(restOfLineUntilComment());
        }
        warn(ParseWarning.TRAILING_TOKENS, "lenient_parse", "trailing_tokens",
                "W_TRAILING_TOKENS::Dropped unexpected tokens: " + String.join(" ", dropped),
                first, dropped, null, null);
    }

    private List<String> restOfLineUntilComment() {
        List<String> lexemes = new ArrayList<>();
        int bracketDepth = 0;
        while (!current().is(TokenType.EOF) && (bracketDepth > 0 || !atLineEnd())) {
            Token t = advance();
            if (t.is(TokenType.LIST_START)) {
                bracketDepth++;
            } else if (t.is(TokenType.LIST_END)) {
                bracketDepth--;
            }
            if (!t.type().isLayout()) {
                lexemes.add(t.lexeme());
            }
        }
        return lexemes;
    }

    private void warn(
            String code,
            String type,
            String subtype,
            String message,
            Token at,
            List<String> original,
            String corrected,
            Map<String, Object> details) {
        warnings.add(new ParseWarning(code, type, subtype, message, at.line(), at.column(), original, corrected, details));
    }

    // ── Internal types ──

    /** An open container and the indent of its header line; the root frame has indent -1. */
    private record Frame(int indent, Container container, KeyIndex keys) {}

    /** Lines on which each key of one scope was written, in first-seen order. */
    private record KeyIndex(Map<String, List<Integer>> lines) {
        void record(String key, int line) {
            lines.computeIfAbsent(key, k -> new ArrayList<>()).add(line);
        }
    }

    private record PendingComment(String text, int indent, int line) {}

    /**
     * One term of a value position.
     *
     * @param text       form used when terms are joined into one string
     * @param lexemes    source lexemes, for warnings
     * @param structured annotation, constructor or list; prevents string coalescing
     */
    private record Piece(Value value, String text, List<String> lexemes, boolean structured) {}

    /** Front matter cut from the text before lexing, so that it is never tokenized. */
    private record FrontMatter(String text, String body, int firstLine) {

        static FrontMatter split(String source) {
            String[] lines = source.split("\n", -1);
            if (lines.length < 2 || !"---".equals(lines[0].stripTrailing())) {
                return new FrontMatter(null, source, 1);
            }
            for (int i = 1; i < lines.length; i++) {
                if ("---".equals(lines[i].stripTrailing())) {
                    String text = String.join("\n", java.util.Arrays.asList(lines).subList(1, i));
                    String body = String.join("\n", java.util.Arrays.asList(lines).subList(i + 1, lines.length));
                    return new FrontMatter(text, body, i + 2);
                }
            }
            return new FrontMatter(null, source, 1);
        }
    }
}
