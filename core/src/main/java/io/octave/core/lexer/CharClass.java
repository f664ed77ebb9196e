package io.octave.core.lexer;

import java.util.Set;

/** Code point classification for identifiers, by Unicode general category. */
final class CharClass {

    /** Canonical operator code points; never part of an identifier. */
    static final Set<Integer> OPERATOR_CODE_POINTS = Set.of(
            (int) '→', (int) '⊕', (int) '⧺', (int) '⇌', (int) '∧', (int) '∨', (int) '§');

    private static final int ZERO_WIDTH_JOINER = 0x200D;

    private CharClass() {}

    static boolean isIdentifierStart(int cp) {
        if (cp < 0x80) {
            return (cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z') || cp == '_' || cp == '.' || cp == '/';
        }
        if (OPERATOR_CODE_POINTS.contains(cp)) {
            return false;
        }
        return switch (Character.getType(cp)) {
            case Character.UPPERCASE_LETTER,
                    Character.LOWERCASE_LETTER,
                    Character.TITLECASE_LETTER,
                    Character.MODIFIER_LETTER,
                    Character.OTHER_LETTER,
                    Character.OTHER_SYMBOL,
                    Character.MATH_SYMBOL,
                    Character.MODIFIER_SYMBOL,
                    Character.OTHER_NUMBER,
                    Character.OTHER_PUNCTUATION -> true;
            default -> false;
        };
    }

    static boolean isIdentifierPart(int cp) {
        if (cp < 0x80) {
            return isIdentifierStart(cp) || (cp >= '0' && cp <= '9') || cp == '-';
        }
        if (isIdentifierStart(cp) || cp == ZERO_WIDTH_JOINER) {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.DECIMAL_DIGIT_NUMBER,
                    Character.LETTER_NUMBER,
                    Character.NON_SPACING_MARK,
                    Character.ENCLOSING_MARK,
                    Character.COMBINING_SPACING_MARK -> true;
            default -> false;
        };
    }

    /** Word characters in the regex {@code \b} sense. */
    static boolean isWordChar(int cp) {
        return cp == '_' || Character.isLetterOrDigit(cp);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
