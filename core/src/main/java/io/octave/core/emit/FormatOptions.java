package io.octave.core.emit;

import java.util.Locale;
import java.util.Objects;

/**
 * Layout switches for {@link Emitter}. None of them changes document content.
 *
 * @param indentNormalize    has no effect: the AST keeps no source indentation, so output always
 *                           uses two spaces per level. Accepted so configuration can pass it through
 * @param blankLineNormalize one blank line between consecutive top-level sections
 * @param trailingWhitespace what to do with whitespace at line ends outside literal zones
 * @param keySorting         assignments sorted by key ahead of other children, META keys sorted
 * @param stripComments      leave every comment out
 */
public record FormatOptions(
        boolean indentNormalize,
        boolean blankLineNormalize,
        TrailingWhitespace trailingWhitespace,
        boolean keySorting,
        boolean stripComments) {

    public static final FormatOptions DEFAULT =
            new FormatOptions(true, false, TrailingWhitespace.STRIP, false, false);

    /** Trailing whitespace policy. */
    public enum TrailingWhitespace {
        STRIP,
        PRESERVE;

        /**
         * Parses {@code strip} or {@code preserve}, case-insensitively.
         *
         * @throws IllegalArgumentException for any other text
         */
        public static TrailingWhitespace fromString(String text) {
            Objects.requireNonNull(text, "text must not be null");
            return switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "strip" -> STRIP;
                case "preserve" -> PRESERVE;
                default -> throw new IllegalArgumentException(
                        "trailing whitespace must be 'strip' or 'preserve', got: " + text);
            };
        }
    }

    public FormatOptions {
        Objects.requireNonNull(trailingWhitespace, "trailingWhitespace must not be null");
    }

    public FormatOptions withKeySorting(boolean sorted) {
        return new FormatOptions(indentNormalize, blankLineNormalize, trailingWhitespace, sorted, stripComments);
    }

    public FormatOptions withStripComments(boolean strip) {
        return new FormatOptions(indentNormalize, blankLineNormalize, trailingWhitespace, keySorting, strip);
    }

    public FormatOptions withBlankLineNormalize(boolean normalize) {
        return new FormatOptions(indentNormalize, normalize, trailingWhitespace, keySorting, stripComments);
    }
}
