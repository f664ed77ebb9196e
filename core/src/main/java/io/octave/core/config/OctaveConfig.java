package io.octave.core.config;

import io.octave.core.emit.FormatOptions;
import io.octave.core.emit.FormatOptions.TrailingWhitespace;
import io.octave.core.parser.ParserOptions;
import java.util.Objects;

/**
 * Defaults for parsing, emission and validation. Use {@link #builder()} or {@link ConfigLoader}.
 *
 * @param deepNestingThreshold bracket depth of the deep-nesting warning ({@code parser.deep-nesting-threshold})
 * @param lenient              repair {@code NAME{q}} annotations ({@code parser.lenient})
 * @param indentNormalize      {@code emitter.indent-normalize}
 * @param blankLineNormalize   {@code emitter.blank-line-normalize}
 * @param trailingWhitespace   {@code emitter.trailing-whitespace}
 * @param keySorting           {@code emitter.key-sorting}
 * @param stripComments        {@code emitter.strip-comments}
 * @param strict               check undeclared fields during validation ({@code validation.strict})
 */
public record OctaveConfig(
        int deepNestingThreshold,
        boolean lenient,
        boolean indentNormalize,
        boolean blankLineNormalize,
        TrailingWhitespace trailingWhitespace,
        boolean keySorting,
        boolean stripComments,
        boolean strict) {

    public OctaveConfig {
        Objects.requireNonNull(trailingWhitespace, "trailingWhitespace must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Parser options derived from this configuration. */
    public ParserOptions parserOptions() {
        return new ParserOptions(deepNestingThreshold, lenient);
    }

    /** Emitter options derived from this configuration. */
    public FormatOptions formatOptions() {
        return new FormatOptions(indentNormalize, blankLineNormalize, trailingWhitespace, keySorting, stripComments);
    }

    /** Builder for {@link OctaveConfig}; every field starts at its documented default. */
    public static final class Builder {

        private int deepNestingThreshold = ParserOptions.DEFAULT_DEEP_NESTING_THRESHOLD;
        private boolean lenient = true;
        private boolean indentNormalize = true;
        private boolean blankLineNormalize = false;
        private TrailingWhitespace trailingWhitespace = TrailingWhitespace.STRIP;
        private boolean keySorting = false;
        private boolean stripComments = false;
        private boolean strict = false;

        private Builder() {}

        public Builder deepNestingThreshold(int deepNestingThreshold) {
            this.deepNestingThreshold = deepNestingThreshold;
            return this;
        }

        public Builder lenient(boolean lenient) {
            this.lenient = lenient;
            return this;
        }

        public Builder indentNormalize(boolean indentNormalize) {
            this.indentNormalize = indentNormalize;
            return this;
        }

        public Builder blankLineNormalize(boolean blankLineNormalize) {
            this.blankLineNormalize = blankLineNormalize;
            return this;
        }

        public Builder trailingWhitespace(TrailingWhitespace trailingWhitespace) {
            this.trailingWhitespace = trailingWhitespace;
            return this;
        }

        public Builder keySorting(boolean keySorting) {
            this.keySorting = keySorting;
            return this;
        }

        public Builder stripComments(boolean stripComments) {
            this.stripComments = stripComments;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws IllegalArgumentException if the nesting threshold is outside 1..100
         */
        public OctaveConfig build() {
            if (deepNestingThreshold < 1 || deepNestingThreshold > ParserOptions.MAX_NESTING_DEPTH) {
                throw new IllegalArgumentException(String.format(
                        "deep-nesting-threshold must be between 1 and %d, got: %d",
                        ParserOptions.MAX_NESTING_DEPTH, deepNestingThreshold));
            }
            return new OctaveConfig(
                    deepNestingThreshold,
                    lenient,
                    indentNormalize,
                    blankLineNormalize,
                    trailingWhitespace,
                    keySorting,
                    stripComments,
                    strict);
        }
    }
}
