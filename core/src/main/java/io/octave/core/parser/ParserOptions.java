package io.octave.core.parser;

/**
 * Parser tuning.
 *
 * @param deepNestingThreshold bracket depth at which the single deep-nesting warning fires
 * @param lenient              whether the lexer repairs {@code NAME{q}} annotations instead of failing
 */
public record ParserOptions(int deepNestingThreshold, boolean lenient) {

    /** Fixed hard cap on bracket nesting; deeper values abort the parse. */
    public static final int MAX_NESTING_DEPTH = 100;

    public static final int DEFAULT_DEEP_NESTING_THRESHOLD = 5;

    public static final ParserOptions DEFAULT = new ParserOptions(DEFAULT_DEEP_NESTING_THRESHOLD, true);

    public ParserOptions {
        if (deepNestingThreshold < 1 || deepNestingThreshold > MAX_NESTING_DEPTH) {
            throw new IllegalArgumentException(String.format(
                    "deepNestingThreshold must be between 1 and %d, got: %d",
                    MAX_NESTING_DEPTH, deepNestingThreshold));
        }
    }
}
