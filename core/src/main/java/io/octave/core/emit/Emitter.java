package io.octave.core.emit;

import io.octave.core.error.EmitException;
import io.octave.core.model.Assignment;
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
import io.octave.core.model.Block;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes a {@link Document} in canonical OCTAVE form.
 *
 * <p>Output is a pure function of the AST and the {@link FormatOptions}: explicit envelope,
 * Unicode operators, {@code ::} without surrounding spaces, two spaces per level and a final
 * newline. Parsing the output and emitting again yields the same text.
 *
 * <p>{@link io.octave.core.model.Absent} is never written. It is filtered from bodies, lists,
 * inline maps and META; reaching a value position anyway raises {@link EmitException}.
 */
public final class Emitter {

    private static final String IDENT = "[A-Za-z_][A-Za-z0-9_.\\-]*(?<!-)";
    private static final Pattern IDENTIFIER = Pattern.compile(IDENT);
    private static final Pattern ANNOTATION =
            Pattern.compile(IDENT + "<(?:[A-Za-z_](?:[A-Za-z0-9_,]*[A-Za-z0-9_])?)?>");
    private static final Pattern EXPRESSION = Pattern.compile(IDENT + "(?:[⊕⧺⇌∧∨→@]" + IDENT + ")+");
    private static final Pattern VARIABLE = Pattern.compile("\\$[A-Za-z0-9_:]+");
    private static final Pattern OPERATOR = Pattern.compile("[⊕⧺⇌∧∨→@]");

    /** Words the lexer reads as literals or operators when they stand alone. */
    private static final Set<String> RESERVED = Set.of("true", "false", "null", "vs");

    /** Keys whose string values are literal match targets and keep their quotes. */
    private static final Set<String> ALWAYS_QUOTED_KEYS = Set.of("PATTERN", "REGEX");

    private static final String INDENT = "  ";

    private final FormatOptions options;
    private final List<Line> lines = new ArrayList<>();

    private Emitter(FormatOptions options) {
        this.options = options;
    }

    public static String emit(Document document) {
        return emit(document, FormatOptions.DEFAULT);
    }

    /**
     * Emits a whole document.
     *
     * @throws EmitException if an {@link io.octave.core.model.Absent} reaches a value position
     */
    public static String emit(Document document, FormatOptions options) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Emitter emitter = new Emitter(options);
        emitter.document(document);
        return emitter.render();
    }

    /** Canonical text of a single value at the top indentation level. */
    public static String emitValue(Value value) {
        return new Emitter(FormatOptions.DEFAULT).value(value, 0);
    }

    /** Double-quoted form of a string, escaping backslash, quote, newline and tab. */
    public static String quote(String text) {
        String escaped = text.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
        return "\"" + escaped + "\"";
    }

    /** Whether a string can be written without quotes and read back as the same string. */
    public static boolean isBare(String text) {
        if (text.isEmpty()) {
            return false;
        }
        if (VARIABLE.matcher(text).matches()) {
            return true;
        }
        if (!IDENTIFIER.matcher(text).matches()
                && !ANNOTATION.matcher(text).matches()
                && !EXPRESSION.matcher(text).matches()) {
            return false;
        }
        for (String segment : OPERATOR.split(text)) {
            if (startsWithReserved(segment)) {
                return false;
            }
        }
        return true;
    }

    /** {@code true.x} or {@code vs-a} would lex as a literal or operator followed by more text. */
    private static boolean startsWithReserved(String segment) {
        for (String word : RESERVED) {
            if (segment.startsWith(word)) {
                if (segment.length() == word.length()) {
                    return true;
                }
                char next = segment.charAt(word.length());
                if (next != '_' && !Character.isLetterOrDigit(next)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ── Document ──

    private void document(Document document) {
        if (document.frontMatter() != null && !document.frontMatter().isBlank()) {
            add("---");
            lines.add(new Line(document.frontMatter(), true, false));
            add("---");
            add("");
        }
        if (document.grammarVersion() != null) {
            add("OCTAVE::" + document.grammarVersion());
        }
        add("===" + document.name() + "===");
        meta(document.meta());
        if (document.hasSeparator()) {
            add("---");
        }
        for (Node node : document.nodes()) {
            node(node, 0, true);
        }
        comments(document.trailingComments(), 0);
        add("===END===");
    }

    private void meta(Map<String, Value> meta) {
        List<Line> body = new ArrayList<>();
        mapAsBlock(meta, 1, body);
        if (!body.isEmpty()) {
            add("META:");
            lines.addAll(body);
        }
    }

    private void mapAsBlock(Map<String, Value> entries, int depth, List<Line> out) {
        List<String> keys = new ArrayList<>(entries.keySet());
        if (options.keySorting()) {
            keys.sort(Comparator.naturalOrder());
        }
        String pad = INDENT.repeat(depth);
        for (String key : keys) {
            Value v = entries.get(key);
            if (v.isAbsent()) {
                continue;
            }
            if (v instanceof InlineMap nested) {
                List<Line> children = new ArrayList<>();
                mapAsBlock(nested.entries(), depth + 1, children);
                out.add(new Line(pad + key + ":", false, false));
                out.addAll(children);
            } else if (v instanceof LiteralZone zone) {
                literalZone(key, zone, pad, out);
            } else {
                out.add(new Line(pad + key + "::" + value(v, depth), false, false));
            }
        }
    }

    // ── Nodes ──

    private void node(Node node, int depth, boolean topLevel) {
        if (node instanceof Assignment assignment) {
            assignment(assignment, depth);
        } else if (node instanceof Comment comment) {
            if (!options.stripComments()) {
                add(INDENT.repeat(depth) + "// " + comment.text());
            }
        } else if (node instanceof Container container) {
            container(container, depth, topLevel);
        }
    }

    private void assignment(Assignment assignment, int depth) {
        Value v = assignment.value();
        if (v.isAbsent()) {
            return;
        }
        String pad = INDENT.repeat(depth);
        comments(assignment.leadingComments(), depth);
        if (v instanceof LiteralZone zone) {
            literalZone(assignment.key(), zone, pad, lines);
            return;
        }
        String text = value(v, depth);
        if (ALWAYS_QUOTED_KEYS.contains(assignment.key()) && v instanceof StringValue s && !text.startsWith("\"")) {
            text = quote(s.value());
        }
        String trailing = assignment.trailingComment() == null || options.stripComments()
                ? ""
                : " // " + assignment.trailingComment();
        add(pad + assignment.key() + "::" + text + trailing);
    }

    /** {@code KEY::} on its own line, then the fences at the key's indent around verbatim content. */
    private static void literalZone(String key, LiteralZone zone, String pad, List<Line> out) {
        if (!key.isEmpty()) {
            out.add(new Line(pad + key + "::", false, false));
        }
        out.add(new Line(pad + zone.fenceMarker() + (zone.infoTag() == null ? "" : zone.infoTag()), false, false));
        if (!zone.content().isEmpty()) {
            String content = zone.content();
            out.add(new Line(content.endsWith("\n") ? content.substring(0, content.length() - 1) : content, true, false));
        }
        out.add(new Line(pad + zone.fenceMarker(), false, false));
    }

    private void container(Container container, int depth, boolean topLevel) {
        String pad = INDENT.repeat(depth);
        comments(container.leadingComments(), depth);
        if (container instanceof Section section) {
            String header = pad + "§" + section.id() + "::" + section.key()
                    + (section.annotation() == null ? "" : "[" + section.annotation() + "]");
            lines.add(new Line(header, false, topLevel));
        } else {
            Block block = (Block) container;
            add(pad + block.key() + (block.target() == null ? "" : "[→§" + block.target() + "]") + ":");
        }
        for (Node child : ordered(container.children())) {
            node(child, depth + 1, false);
        }
    }

    /** Children in emission order: source order, or sorted assignments first when key sorting is on. */
    private List<Node> ordered(List<Node> children) {
        if (!options.keySorting()) {
            return children;
        }
        List<Node> sorted = children.stream()
                .filter(Assignment.class::isInstance)
                .sorted(Comparator.comparing(Node::key))
                .collect(Collectors.toCollection(ArrayList::new));
        children.stream().filter(c -> !(c instanceof Assignment)).forEach(sorted::add);
        return sorted;
    }

    private void comments(List<String> comments, int depth) {
        if (options.stripComments()) {
            return;
        }
        for (String comment : comments) {
            add(INDENT.repeat(depth) + "// " + comment);
        }
    }

    // ── Values ──

    private String value(Value v, int depth) {
        if (v.isAbsent()) {
            throw new EmitException("Absent value reached a serialization position; filter it before emitting");
        }
        if (v instanceof StringValue s) {
            return isBare(s.value()) ? s.value() : quote(s.value());
        }
        if (v instanceof NumberValue n) {
            return n.lexeme();
        }
        if (v instanceof BooleanValue b) {
            return b.value() ? "true" : "false";
        }
        if (v instanceof NullValue) {
            return "null";
        }
        if (v instanceof ListValue list) {
            return list(list, depth);
        }
        if (v instanceof InlineMap map) {
            return "[" + pairs(map, depth) + "]";
        }
        if (v instanceof HolographicValue holographic) {
            return holographic.raw();
        }
        LiteralZone zone = (LiteralZone) v;
        String content = zone.content();
        return zone.fenceMarker() + (zone.infoTag() == null ? "" : zone.infoTag()) + "\n" + content
                + (content.isEmpty() || content.endsWith("\n") ? "" : "\n") + zone.fenceMarker();
    }

    private String pairs(InlineMap map, int depth) {
        return map.entries().entrySet().stream()
                .filter(e -> !e.getValue().isAbsent())
                .map(e -> e.getKey() + "::" + value(e.getValue(), depth))
                .collect(Collectors.joining(","));
    }

    private String list(ListValue list, int depth) {
        List<String> parts = new ArrayList<>();
        for (Value item : list.items()) {
            if (item.isAbsent()) {
                continue;
            }
            if (item instanceof InlineMap map) {
                String pairs = pairs(map, depth + 1);
                if (!pairs.isEmpty()) {
                    parts.add(pairs);
                }
            } else {
                parts.add(value(item, depth + 1));
            }
        }
        if (parts.isEmpty()) {
            return "[]";
        }
        if (!multiline(list)) {
            return "[" + String.join(",", parts) + "]";
        }
        String childPad = INDENT.repeat(depth + 1);
        StringBuilder out = new StringBuilder("[");
        for (int i = 0; i < parts.size(); i++) {
            out.append('\n').append(childPad).append(parts.get(i)).append(i < parts.size() - 1 ? "," : "");
        }
        return out.append('\n').append(INDENT.repeat(depth)).append(']').toString();
    }

    /** Maps, nested lists and annotations always go one per line; so do three or more plain items. */
    private static boolean multiline(ListValue list) {
        int plain = 0;
        for (Value item : list.items()) {
            if (item.isAbsent()) {
                continue;
            }
            if (item instanceof InlineMap map) {
                if (map.entries().values().stream().anyMatch(v -> !v.isAbsent())) {
                    return true;
                }
                continue;
            }
            if (item instanceof ListValue) {
                return true;
            }
            if (item instanceof StringValue s && ANNOTATION.matcher(s.value()).matches()) {
                return true;
            }
            plain++;
        }
        return plain >= 3;
    }

    // ── Output ──

    private void add(String text) {
        lines.add(new Line(text, false, false));
    }

    private String render() {
        List<Line> out = lines;
        if (options.blankLineNormalize()) {
            out = new ArrayList<>();
            boolean seenSection = false;
            for (Line line : lines) {
                if (line.topLevelSection()) {
                    if (seenSection && !out.isEmpty() && !out.get(out.size() - 1).text().isBlank()) {
                        out.add(new Line("", false, false));
                    }
                    seenSection = true;
                }
                out.add(line);
            }
        }
        StringBuilder text = new StringBuilder();
        for (Line line : out) {
            boolean strip = !line.verbatim() && options.trailingWhitespace() == FormatOptions.TrailingWhitespace.STRIP;
            text.append(strip ? stripTrailing(line.text()) : line.text()).append('\n');
        }
        return text.toString();
    }

    /** Strips trailing whitespace on every physical line of a logical line (multi-line lists). */
    private static String stripTrailing(String text) {
        if (text.indexOf('\n') < 0) {
            return text.stripTrailing();
        }
        return text.lines().map(String::stripTrailing).collect(Collectors.joining("\n"));
    }

    /**
     * One logical output line.
     *
     * @param verbatim        literal zone content or front matter; never touched
     * @param topLevelSection a top-level {@code §} header, for blank-line normalization
     */
    private record Line(String text, boolean verbatim, boolean topLevelSection) {}
}
