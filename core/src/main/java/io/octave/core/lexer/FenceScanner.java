package io.octave.core.lexer;

import io.octave.core.error.LexerException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented pre-pass of the lexer. Finds literal zones, applies NFC normalization and the
 * control character check to everything outside them, and leaves zone content untouched.
 *
 * <p>Inside an open zone, a backtick run at line start is resolved in this order:
 * <ol>
 * <li>same length as the opening run and nothing else on the line: closes the zone;
 * <li>same length or longer otherwise: {@code E007}, naming the opening line;
 * <li>shorter: ordinary content.
 * </ol>
 * The close check must come first: it is the only way to carry a shorter fence marker as data.
 */
final class FenceScanner {

    private static final Pattern FENCE_OPEN = Pattern.compile("^( *)(`{3,})([^`]*)$");
    private static final Pattern FENCE_CANDIDATE = Pattern.compile("^( *)(`{3,})(.*)$");

    /** Fence candidates inside a zone may be indented this far even when the zone was opened flush left. */
    private static final int MAX_FENCE_INDENT = 3;

    /**
     * A literal zone located in the prepared text.
     *
     * @param openLine    1-based line of the opening fence
     * @param closeLine   1-based line of the closing fence
     * @param indent      spaces before the opening fence
     * @param marker      backtick run that opened the zone
     * @param infoTag     text after the opening run, or {@code null}
     * @param content     lines between the fences, each terminated by a newline
     * @param closeIndent spaces before the closing fence
     */
    record Span(int openLine, int closeLine, int indent, String marker, String infoTag, String content, int closeIndent) {}

    /** Output of the pre-pass: the normalized text split in lines, and the zones found in it. */
    record Prepared(List<String> lines, List<Span> spans) {}

    private FenceScanner() {}

    /**
     * Runs the pre-pass.
     *
     * @param text      text with LF line endings
     * @param firstLine line number of the first line (greater than 1 when front matter was cut)
     * @param repairs   receives one NFC repair per changed line
     */
    static Prepared prepare(String text, int firstLine, List<Repair> repairs) {
        String[] raw = text.split("\n", -1);
        List<String> lines = new ArrayList<>(raw.length);
        List<Span> spans = new ArrayList<>();

        int i = 0;
        while (i < raw.length) {
            String line = raw[i];
            int lineNumber = firstLine + i;
            Matcher open = FENCE_OPEN.matcher(line);
            if (open.matches()) {
                int indent = open.group(1).length();
                String marker = open.group(2);
                String tag = open.group(3).strip();
                int close = findClose(raw, i, indent, marker, firstLine);
                StringBuilder content = new StringBuilder();
                for (int j = i + 1; j < close; j++) {
                    content.append(raw[j]).append('\n');
                }
                int closeIndent = raw[close].length() - raw[close].stripLeading().length();
                spans.add(new Span(
                        lineNumber,
                        firstLine + close,
                        indent,
                        marker,
                        tag.isEmpty() ? null : tag,
                        content.toString(),
                        closeIndent));
                for (int j = i; j <= close; j++) {
                    lines.add(raw[j]);
                }
                i = close + 1;
                continue;
            }

            String normalized = Normalizer.normalize(line, Normalizer.Form.NFC);
            if (!normalized.equals(line)) {
                repairs.add(new Repair(
                        "NFC",
                        Repair.Tier.NORMALIZATION,
                        line,
                        normalized,
                        lineNumber,
                        1,
                        "Line normalized to Unicode NFC",
                        false));
            }
            checkControlCharacters(normalized, lineNumber);
            lines.add(normalized);
            i++;
        }
        return new Prepared(lines, spans);
    }

    private static int findClose(String[] raw, int openIndex, int indent, String marker, int firstLine) {
        int allowedIndent = Math.max(MAX_FENCE_INDENT, indent);
        for (int j = openIndex + 1; j < raw.length; j++) {
            Matcher candidate = FENCE_CANDIDATE.matcher(raw[j]);
            if (!candidate.matches() || candidate.group(1).length() > allowedIndent) {
                continue;
            }
            String run = candidate.group(2);
            String trailing = candidate.group(3);
            if (run.length() == marker.length() && trailing.isBlank()) {
                return j;
            }
            if (run.length() >= marker.length()) {
                String longer = "`".repeat(marker.length() + 1);
                throw new LexerException(
                        LexerException.NESTED_FENCE,
                        String.format(
                                "E007_NESTED_FENCE: fence '%s' (length %d) inside literal zone opened with '%s'"
                                        + " (length %d) at line %d. Use a longer fence, e.g. %s, to wrap content"
                                        + " containing %s",
                                run,
                                run.length(),
                                marker,
                                marker.length(),
                                firstLine + openIndex,
                                longer,
                                marker),
                        firstLine + j,
                        candidate.group(1).length() + 1);
            }
        }
        throw new LexerException(
                LexerException.UNTERMINATED_FENCE,
                String.format(
                        "Unterminated literal zone: fence '%s' opened at line %d was never closed. Add a matching"
                                + " closing fence: %s",
                        marker, firstLine + openIndex, marker),
                firstLine + openIndex,
                indent + 1);
    }

    private static void checkControlCharacters(String line, int lineNumber) {
        int column = 1;
        for (int offset = 0; offset < line.length(); ) {
            int cp = line.codePointAt(offset);
            if (cp == '\t') {
                throw new LexerException(
                        LexerException.FORBIDDEN_CHARACTER,
                        "Tabs are not allowed. Use 2 spaces for indentation.",
                        lineNumber,
                        column);
            }
            if (cp < 0x20 || cp == 0x7F) {
                throw new LexerException(
                        LexerException.FORBIDDEN_CHARACTER,
                        String.format("Forbidden control character U+%04X", cp),
                        lineNumber,
                        column);
            }
            offset += Character.charCount(cp);
            column++;
        }
    }
}
