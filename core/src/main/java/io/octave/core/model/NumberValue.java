package io.octave.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A numeric value. Keeps the source lexeme next to the decoded number so that printing never
 * changes the form the author wrote ({@code 1e10} stays {@code 1e10}).
 *
 * @param lexeme the exact source text
 * @param value  the decoded number: {@link Long} or {@link BigInteger} for integral lexemes,
 *               {@link Double} otherwise
 */
public record NumberValue(String lexeme, Number value) implements Value {

    public NumberValue {
        Objects.requireNonNull(lexeme, "lexeme must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }

    /** Decodes a numeric lexeme as produced by the lexer. */
    public static NumberValue parse(String lexeme) {
        Objects.requireNonNull(lexeme, "lexeme must not be null");
        if (isIntegral(lexeme)) {
            BigInteger big = new BigInteger(lexeme);
            if (big.bitLength() < 64) {
                return new NumberValue(lexeme, big.longValue());
            }
            return new NumberValue(lexeme, big);
        }
        return new NumberValue(lexeme, Double.parseDouble(lexeme));
    }

    public static NumberValue of(long value) {
        return new NumberValue(Long.toString(value), value);
    }

    /**
     * Number from a double.
     *
     * @throws IllegalArgumentException for NaN or an infinity, which have no numeric lexeme
     */
    public static NumberValue of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("number must be finite, got: " + value);
        }
        return new NumberValue(Double.toString(value), value);
    }

    private static boolean isIntegral(String lexeme) {
        return lexeme.indexOf('.') < 0 && lexeme.indexOf('e') < 0 && lexeme.indexOf('E') < 0;
    }

    /** Returns {@code true} when the value was written without fraction or exponent. */
    public boolean isInteger() {
        return value instanceof Long || value instanceof BigInteger;
    }

    /**
     * Exact value of the lexeme. Stays finite where the decoded double overflows ({@code 1e999}).
     */
    public BigDecimal decimalValue() {
        return new BigDecimal(lexeme);
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    @Override
    public String typeName() {
        return "NUMBER";
    }
}
