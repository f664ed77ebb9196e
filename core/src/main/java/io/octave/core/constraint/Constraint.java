package io.octave.core.constraint;

import io.octave.core.emit.Emitter;
import io.octave.core.model.BooleanValue;
import io.octave.core.model.ListValue;
import io.octave.core.model.LiteralZone;
import io.octave.core.model.NullValue;
import io.octave.core.model.NumberValue;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * A single field predicate. The variants form a closed set; each one evaluates itself, so adding a
 * kind means adding a record here and a branch in {@link ConstraintChainParser}.
 *
 * <p>Every variant except {@link Required} passes when the value is missing ({@code null} or
 * {@link io.octave.core.model.Absent}): presence is Required's concern alone.
 *
 * <p>Instances are immutable and may be shared across threads.
 */
public sealed interface Constraint
        permits Constraint.Required,
                Constraint.Optional,
                Constraint.TypeOf,
                Constraint.Enum,
                Constraint.Const,
                Constraint.Regex,
                Constraint.Range,
                Constraint.MinLength,
                Constraint.MaxLength,
                Constraint.Date,
                Constraint.Iso8601,
                Constraint.Lang,
                Constraint.Dir,
                Constraint.AppendOnly {

    /** Priority bucket used when ordering a chain for grammar compilation; lower sorts first. */
    int OTHER_PRIORITY = 4;

    /**
     * Evaluates the constraint.
     *
     * @param value the field value, or {@code null} when the field is missing
     * @param path  dotted field path, copied into errors
     */
    ConstraintResult evaluate(Value value, String path);

    /** Canonical text, e.g. {@code ENUM[A,B]}. */
    String render();

    /** Compilation priority: Const, Enum, Regex, Type, others, then Required/Optional. */
    default int priority() {
        return OTHER_PRIORITY;
    }

    // ── Presence ──

    /** {@code REQ}: the field must be present and not the null literal. */
    record Required() implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value) || value instanceof NullValue) {
                return fail(ConstraintError.REQUIRED_MISSING,
                        String.format("Field '%s' is required but missing", path),
                        this, "present", value == null || value.isAbsent() ? "absent" : "null", path);
            }
            return ConstraintResult.ok();
        }

        @Override
        public String render() {
            return "REQ";
        }

        @Override
        public int priority() {
            return 5;
        }
    }

    /** {@code OPT}: documents that the field may be left out. Always passes. */
    record Optional() implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            return ConstraintResult.ok();
        }

        @Override
        public String render() {
            return "OPT";
        }

        @Override
        public int priority() {
            return 5;
        }
    }

    // ── Type ──

    /** {@code TYPE[X]}. Booleans never satisfy NUMBER; plain strings never satisfy LITERAL. */
    record TypeOf(String type) implements Constraint {

        public static final Set<String> TYPES = Set.of("STRING", "NUMBER", "BOOLEAN", "LIST", "LITERAL");

        public TypeOf {
            Objects.requireNonNull(type, "type must not be null");
            if (!TYPES.contains(type)) {
                throw new IllegalArgumentException("Unknown type '" + type + "', expected one of " + TYPES);
            }
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            boolean matches = switch (type) {
                case "STRING" -> value instanceof StringValue;
                case "NUMBER" -> value instanceof NumberValue;
                case "BOOLEAN" -> value instanceof BooleanValue;
                case "LIST" -> value instanceof ListValue;
                default -> value instanceof LiteralZone;
            };
            if (matches) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.TYPE_VIOLATION,
                    String.format("Field '%s' expected %s, got %s", path, type, value.typeName()),
                    this, type, value.typeName(), path);
        }

        @Override
        public String render() {
            return "TYPE[" + type + "]";
        }

        @Override
        public int priority() {
            return 3;
        }
    }

    // ── Value sets ──

    /** {@code ENUM[a,b]}: exact, case-sensitive membership. */
    record Enum(List<String> allowed) implements Constraint {

        public Enum {
            allowed = List.copyOf(allowed);
            if (allowed.isEmpty()) {
                throw new IllegalArgumentException("ENUM needs at least one value");
            }
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            String actual = text(value);
            if (isScalar(value) && allowed.contains(actual)) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.VALUE_MISMATCH,
                    String.format("Field '%s' value '%s' is not one of %s", path, actual, allowed),
                    this, String.join(",", allowed), actual, path);
        }

        @Override
        public String render() {
            return "ENUM[" + String.join(",", allowed) + "]";
        }

        @Override
        public int priority() {
            return 1;
        }
    }

    /**
     * {@code CONST[x]}: equality that keeps the constant's type. {@code CONST[1]} matches the
     * number 1 (and 1.0) but not the string {@code "1"}.
     */
    record Const(Value expected) implements Constraint {

        public Const {
            Objects.requireNonNull(expected, "expected must not be null");
            if (!isScalar(expected)) {
                throw new IllegalArgumentException("CONST needs a scalar, got " + expected.typeName());
            }
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value) || matches(value)) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.VALUE_MISMATCH,
                    String.format("Field '%s' must equal %s %s, got %s %s",
                            path, expected.typeName(), text(expected), value.typeName(), text(value)),
                    this, text(expected), text(value), path);
        }

        private boolean matches(Value value) {
            if (expected instanceof NumberValue e && value instanceof NumberValue v) {
                return e.decimalValue().compareTo(v.decimalValue()) == 0;
            }
            return expected.equals(value);
        }

        @Override
        public String render() {
            return "CONST[" + Emitter.emitValue(expected) + "]";
        }

        @Override
        public int priority() {
            return 0;
        }
    }

    /** {@code REGEX["..."]}: the string value must contain a match. */
    record Regex(Pattern pattern) implements Constraint {

        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (value instanceof StringValue s && pattern.matcher(s.value()).find()) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.VALUE_MISMATCH,
                    String.format("Field '%s' value '%s' does not match pattern %s", path, text(value), pattern),
                    this, pattern.pattern(), text(value), path);
        }

        @Override
        public String render() {
            return "REGEX[" + Emitter.quote(pattern.pattern()) + "]";
        }

        @Override
        public int priority() {
            return 2;
        }

        // Pattern has identity equality; compare by source text.
        @Override
        public boolean equals(Object other) {
            return other instanceof Regex r && r.pattern.pattern().equals(pattern.pattern());
        }

        @Override
        public int hashCode() {
            return pattern.pattern().hashCode();
        }
    }

    // ── Bounds ──

    /** {@code RANGE[min,max]}, inclusive, numbers only. */
    record Range(BigDecimal min, BigDecimal max) implements Constraint {

        public Range {
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
            if (min.compareTo(max) > 0) {
                throw new IllegalArgumentException("RANGE min " + min + " exceeds max " + max);
            }
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (!(value instanceof NumberValue number)) {
                return fail(ConstraintError.TYPE_VIOLATION,
                        String.format("Field '%s' expected NUMBER for %s, got %s", path, render(), value.typeName()),
                        this, "NUMBER", value.typeName(), path);
            }
            BigDecimal actual = number.decimalValue();
            if (actual.compareTo(min) < 0 || actual.compareTo(max) > 0) {
                return fail(ConstraintError.BOUNDS_VIOLATION,
                        String.format("Field '%s' value %s is outside %s", path, number.lexeme(), render()),
                        this, min.toPlainString() + ".." + max.toPlainString(), number.lexeme(), path);
            }
            return ConstraintResult.ok();
        }

        @Override
        public String render() {
            return "RANGE[" + min.toPlainString() + "," + max.toPlainString() + "]";
        }
    }

    /** {@code MIN_LENGTH[n]}: code points of a string, or items of a list. */
    record MinLength(int length) implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            return checkLength(this, value, path, actual -> actual >= length, "at least " + length);
        }

        @Override
        public String render() {
            return "MIN_LENGTH[" + length + "]";
        }
    }

    /** {@code MAX_LENGTH[n]}: code points of a string, or items of a list. */
    record MaxLength(int length) implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            return checkLength(this, value, path, actual -> actual <= length, "at most " + length);
        }

        @Override
        public String render() {
            return "MAX_LENGTH[" + length + "]";
        }
    }

    // ── Formats ──

    /** {@code DATE}: a calendar date {@code yyyy-MM-dd}. */
    record Date() implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (value instanceof StringValue s && isDate(s.value())) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.TYPE_VIOLATION,
                    String.format("Field '%s' value '%s' is not a date (YYYY-MM-DD)", path, text(value)),
                    this, "YYYY-MM-DD", text(value), path);
        }

        private static boolean isDate(String text) {
            try {
                LocalDate.parse(text);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }

        @Override
        public String render() {
            return "DATE";
        }
    }

    /** {@code ISO8601}: a date, local date-time, or date-time with offset. */
    record Iso8601() implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (value instanceof StringValue s && isIso8601(s.value())) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.TYPE_VIOLATION,
                    String.format("Field '%s' value '%s' is not an ISO 8601 timestamp", path, text(value)),
                    this, "ISO8601", text(value), path);
        }

        private static boolean isIso8601(String text) {
            try {
                OffsetDateTime.parse(text);
                return true;
            } catch (DateTimeParseException notOffset) {
                try {
                    LocalDateTime.parse(text);
                    return true;
                } catch (DateTimeParseException notLocal) {
                    try {
                        LocalDate.parse(text);
                        return true;
                    } catch (DateTimeParseException notDate) {
                        return false;
                    }
                }
            }
        }

        @Override
        public String render() {
            return "ISO8601";
        }
    }

    /** {@code LANG[x]}: a literal zone whose info tag equals {@code x}, ignoring case. */
    record Lang(String language) implements Constraint {

        public Lang {
            Objects.requireNonNull(language, "language must not be null");
        }

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (!(value instanceof LiteralZone zone)) {
                return fail(ConstraintError.TYPE_VIOLATION,
                        String.format("Field '%s' expected a literal zone for %s, got %s", path, render(),
                                value.typeName()),
                        this, "LITERAL", value.typeName(), path);
            }
            if (zone.infoTag() == null || !zone.infoTag().equalsIgnoreCase(language)) {
                String actual = zone.infoTag() == null ? "(none)" : zone.infoTag();
                return fail(ConstraintError.TYPE_VIOLATION,
                        String.format("Field '%s' literal zone language is %s, expected %s", path, actual, language),
                        this, language, actual, path);
            }
            return ConstraintResult.ok();
        }

        @Override
        public String render() {
            return "LANG[" + language + "]";
        }
    }

    /** {@code DIR}: a relative or absolute directory path made of safe segments. */
    record Dir() implements Constraint {

        private static final Pattern PATH_SHAPE =
                Pattern.compile("(?:/|\\./|\\.\\./|~/)?[A-Za-z0-9_.~-]+(?:/[A-Za-z0-9_.~-]+)*/?|/");

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            if (isMissing(value)) {
                return ConstraintResult.ok();
            }
            if (value instanceof StringValue s && PATH_SHAPE.matcher(s.value()).matches()) {
                return ConstraintResult.ok();
            }
            return fail(ConstraintError.TYPE_VIOLATION,
                    String.format("Field '%s' value '%s' is not a directory path", path, text(value)),
                    this, "directory path", text(value), path);
        }

        @Override
        public String render() {
            return "DIR";
        }
    }

    /** {@code APPEND_ONLY}: marks a field whose history only grows. Checked by collaborators, passes here. */
    record AppendOnly() implements Constraint {

        @Override
        public ConstraintResult evaluate(Value value, String path) {
            return ConstraintResult.ok();
        }

        @Override
        public String render() {
            return "APPEND_ONLY";
        }
    }

    // ── Shared helpers ──

    private static boolean isMissing(Value value) {
        return value == null || value.isAbsent();
    }

    private static boolean isScalar(Value value) {
        return value instanceof StringValue
                || value instanceof NumberValue
                || value instanceof BooleanValue
                || value instanceof NullValue;
    }

    /** Plain text of a value for comparisons and messages; strings unquoted. */
    private static String text(Value value) {
        if (value == null || value.isAbsent()) {
            return "absent";
        }
        if (value instanceof StringValue s) {
            return s.value();
        }
        return Emitter.emitValue(value);
    }

    private static ConstraintResult checkLength(
            Constraint constraint,
            Value value,
            String path,
            IntPredicate accepts,
            String expected) {
        if (isMissing(value)) {
            return ConstraintResult.ok();
        }
        int actual;
        if (value instanceof StringValue s) {
            actual = s.value().codePointCount(0, s.value().length());
        } else if (value instanceof ListValue list) {
            actual = (int) list.items().stream().filter(v -> !v.isAbsent()).count();
        } else {
            return fail(ConstraintError.TYPE_VIOLATION,
                    String.format("Field '%s' expected STRING or LIST for %s, got %s",
                            path, constraint.render(), value.typeName()),
                    constraint, "STRING or LIST", value.typeName(), path);
        }
        if (accepts.test(actual)) {
            return ConstraintResult.ok();
        }
        return fail(ConstraintError.BOUNDS_VIOLATION,
                String.format("Field '%s' has length %d, expected %s", path, actual, expected),
                constraint, expected, Integer.toString(actual), path);
    }

    private static ConstraintResult fail(
            String code, String message, Constraint constraint, String expected, String actual, String path) {
        return ConstraintResult.failure(
                new ConstraintError(code, message, constraint.render(), expected, actual, path));
    }
}
