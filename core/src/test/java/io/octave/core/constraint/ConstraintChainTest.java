package io.octave.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.octave.core.error.HolographicPatternException;
import io.octave.core.model.Absent;
import io.octave.core.model.BooleanValue;
import io.octave.core.model.ListValue;
import io.octave.core.model.LiteralZone;
import io.octave.core.model.NullValue;
import io.octave.core.model.NumberValue;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstraintChain}, {@link ConstraintChainParser} and each constraint kind. */
@DisplayName("ConstraintChain")
class ConstraintChainTest {

    private static ConstraintResult check(String chain, Value value) {
        return ConstraintChain.parse(chain).evaluate(value, "FIELD");
    }

    private static List<String> codes(ConstraintResult result) {
        return result.errors().stream().map(ConstraintError::code).toList();
    }

    @Nested
    @DisplayName("Chain evaluation")
    class ChainEvaluation {

        @Test
        @DisplayName("REQUIRED ∧ ENUM against an unlisted value gives exactly one E005")
        void enumMismatch() {
            ConstraintResult result = check("REQUIRED∧ENUM[ACTIVE,INACTIVE]", new StringValue("PENDING"));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).hasSize(1);
            ConstraintError error = result.errors().get(0);
            assertThat(error.code()).isEqualTo("E005");
            assertThat(error.constraint()).isEqualTo("ENUM[ACTIVE,INACTIVE]");
            assertThat(error.actual()).isEqualTo("PENDING");
            assertThat(error.path()).isEqualTo("FIELD");
            assertThat(error.message()).contains("PENDING").contains("ACTIVE");
        }

        @Test
        @DisplayName("every failing term is reported, in chain order")
        void aggregatesAllErrors() {
            ConstraintResult result = check("TYPE[STRING]∧MIN_LENGTH[5]∧ENUM[A]", NumberValue.parse("3"));
            assertThat(codes(result)).containsExactly("E007", "E007", "E005");
        }

        @Test
        @DisplayName("a missing value fails only REQ")
        void missingValue() {
            ConstraintResult result = check("REQ∧TYPE[STRING]∧ENUM[A]", null);
            assertThat(codes(result)).containsExactly("E003");
            assertThat(result.errors().get(0).actual()).isEqualTo("absent");
        }

        @Test
        @DisplayName("REQ also fails on Absent and on the null literal")
        void requiredAbsentAndNull() {
            assertThat(codes(check("REQ", Absent.INSTANCE))).containsExactly("E003");
            ConstraintResult nullResult = check("REQ", NullValue.INSTANCE);
            assertThat(codes(nullResult)).containsExactly("E003");
            assertThat(nullResult.errors().get(0).actual()).isEqualTo("null");
        }

        @Test
        @DisplayName("OPT passes on anything, including missing")
        void optional() {
            assertThat(check("OPT", null).valid()).isTrue();
            assertThat(check("OPT∧ENUM[A]", null).valid()).isTrue();
        }

        @Test
        @DisplayName("compilation order puts CONST, ENUM, REGEX, TYPE first and REQ last")
        void compilationOrder() {
            ConstraintChain chain = ConstraintChain.parse("REQ∧MAX_LENGTH[3]∧TYPE[STRING]∧REGEX[\"a\"]∧ENUM[a]∧CONST[\"a\"]");

            assertThat(chain.compilationOrder().stream().map(Constraint::render).toList())
                    .containsExactly("CONST[a]", "ENUM[a]", "REGEX[\"a\"]", "TYPE[STRING]", "MAX_LENGTH[3]", "REQ");
        }

        @Test
        @DisplayName("render joins canonical terms with ∧")
        void render() {
            ConstraintChain chain = ConstraintChain.parse("required & enum[A, B] range[1,10]");

            assertThat(chain.render()).isEqualTo("REQ∧ENUM[A,B]∧RANGE[1,10]");
            assertThat(chain.isRequired()).isTrue();
        }

        @Test
        @DisplayName("empty text is an empty chain")
        void empty() {
            assertThat(ConstraintChain.parse("  ").isEmpty()).isTrue();
            assertThat(ConstraintChain.EMPTY.evaluate(null, "X").valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Kinds")
    class Kinds {

        @Test
        @DisplayName("TYPE[NUMBER] rejects booleans")
        void booleanIsNotNumber() {
            assertThat(check("TYPE[NUMBER]", NumberValue.parse("1.5")).valid()).isTrue();
            assertThat(codes(check("TYPE[NUMBER]", BooleanValue.TRUE))).containsExactly("E007");
        }

        @Test
        @DisplayName("TYPE[LIST] and TYPE[LITERAL]")
        void listAndLiteral() {
            assertThat(check("TYPE[LIST]", ListValue.EMPTY).valid()).isTrue();
            assertThat(check("TYPE[LITERAL]", LiteralZone.of("x\n")).valid()).isTrue();
            assertThat(check("TYPE[LITERAL]", new StringValue("x")).valid()).isFalse();
        }

        @Test
        @DisplayName("CONST keeps the constant's type")
        void constTyped() {
            assertThat(check("CONST[1]", NumberValue.parse("1")).valid()).isTrue();
            assertThat(check("CONST[1]", NumberValue.parse("1.0")).valid()).isTrue();
            assertThat(codes(check("CONST[1]", new StringValue("1")))).containsExactly("E005");
            assertThat(check("CONST[\"1\"]", new StringValue("1")).valid()).isTrue();
            assertThat(check("CONST[true]", BooleanValue.TRUE).valid()).isTrue();
        }

        @Test
        @DisplayName("REGEX searches string values")
        void regex() {
            assertThat(check("REGEX[\"^[A-Z]+$\"]", new StringValue("ABC")).valid()).isTrue();
            assertThat(codes(check("REGEX[\"^[A-Z]+$\"]", new StringValue("abc")))).containsExactly("E005");
            assertThat(codes(check("REGEX[\"a\"]", NumberValue.parse("1")))).containsExactly("E005");
        }

        @Test
        @DisplayName("unquoted regex with brackets survives splitting")
        void unquotedRegex() {
            ConstraintChain chain = ConstraintChain.parse("REQ∧REGEX[^[a-z-]+$]");

            assertThat(chain.constraints()).hasSize(2);
            assertThat(chain.evaluate(new StringValue("my-slug"), "F").valid()).isTrue();
            assertThat(chain.evaluate(new StringValue("My Slug"), "F").valid()).isFalse();
        }

        @Test
        @DisplayName("RANGE is inclusive and numeric")
        void range() {
            assertThat(check("RANGE[0,100]", NumberValue.parse("0")).valid()).isTrue();
            assertThat(check("RANGE[0,100]", NumberValue.parse("100")).valid()).isTrue();
            assertThat(codes(check("RANGE[0,100]", NumberValue.parse("101")))).containsExactly("E006");
            assertThat(codes(check("RANGE[0,100]", new StringValue("50")))).containsExactly("E007");
        }

        @Test
        @DisplayName("numbers past double range are compared by their written value")
        void overflowingNumber() {
            NumberValue huge = NumberValue.parse("1e999");

            assertThat(codes(check("REQ∧RANGE[0,10]", huge))).containsExactly("E006");
            assertThat(codes(check("CONST[1]", huge))).containsExactly("E005");
            assertThat(check("CONST[1e999]", NumberValue.parse("10e998")).valid()).isTrue();
        }

        @Test
        @DisplayName("RANGE bounds may be decimal")
        void decimalRange() {
            Constraint.Range range = (Constraint.Range) ConstraintChain.parse("RANGE[0.5,1.5]").constraints().get(0);

            assertThat(range.min()).isEqualByComparingTo(new BigDecimal("0.5"));
            assertThat(range.evaluate(NumberValue.parse("1.5"), "F").valid()).isTrue();
        }

        @Test
        @DisplayName("length counts code points of strings and items of lists")
        void lengths() {
            assertThat(check("MIN_LENGTH[3]", new StringValue("abc")).valid()).isTrue();
            assertThat(codes(check("MAX_LENGTH[2]", new StringValue("abc")))).containsExactly("E006");
            assertThat(check("MAX_LENGTH[2]", new StringValue("😀😀")).valid()).isTrue();
            ListValue three = ListValue.of(new StringValue("a"), new StringValue("b"), new StringValue("c"));
            assertThat(codes(check("MAX_LENGTH[2]", three))).containsExactly("E006");
        }

        @Test
        @DisplayName("DATE and ISO8601 formats")
        void dates() {
            assertThat(check("DATE", new StringValue("2024-02-29")).valid()).isTrue();
            assertThat(codes(check("DATE", new StringValue("2024-13-01")))).containsExactly("E007");
            assertThat(check("ISO8601", new StringValue("2024-01-15T10:30:00Z")).valid()).isTrue();
            assertThat(check("ISO8601", new StringValue("2024-01-15T10:30:00")).valid()).isTrue();
            assertThat(check("ISO8601", new StringValue("2024-01-15")).valid()).isTrue();
            assertThat(check("ISO8601", new StringValue("yesterday")).valid()).isFalse();
        }

        @Test
        @DisplayName("LANG checks the literal zone info tag, ignoring case")
        void lang() {
            assertThat(check("LANG[python]", new LiteralZone("x\n", "Python", "```")).valid()).isTrue();
            assertThat(codes(check("LANG[python]", new LiteralZone("x\n", "js", "```")))).containsExactly("E007");
            assertThat(codes(check("LANG[python]", new StringValue("x")))).containsExactly("E007");
        }

        @Test
        @DisplayName("DIR accepts path shapes only")
        void dir() {
            assertThat(check("DIR", new StringValue("src/main")).valid()).isTrue();
            assertThat(check("DIR", new StringValue("/var/log/")).valid()).isTrue();
            assertThat(check("DIR", new StringValue("two words")).valid()).isFalse();
        }

        @Test
        @DisplayName("APPEND_ONLY always passes")
        void appendOnly() {
            assertThat(check("APPEND_ONLY", new StringValue("x")).valid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Parse errors")
    class ParseErrors {

        @Test
        @DisplayName("unknown keyword")
        void unknownKeyword() {
            assertThatThrownBy(() -> ConstraintChain.parse("REQ∧SOMETIMES"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("Unknown constraint 'SOMETIMES'");
        }

        @Test
        @DisplayName("unknown type name")
        void unknownType() {
            assertThatThrownBy(() -> ConstraintChain.parse("TYPE[DATE]"))
                    .isInstanceOf(HolographicPatternException.class);
        }

        @Test
        @DisplayName("invalid regex")
        void invalidRegex() {
            assertThatThrownBy(() -> ConstraintChain.parse("REGEX[\"(\"]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("Invalid REGEX");
        }

        @Test
        @DisplayName("inverted range")
        void invertedRange() {
            assertThatThrownBy(() -> ConstraintChain.parse("RANGE[10,1]"))
                    .isInstanceOf(HolographicPatternException.class);
        }

        @Test
        @DisplayName("missing argument and negative length")
        void badArguments() {
            assertThatThrownBy(() -> ConstraintChain.parse("ENUM"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("requires an argument");
            assertThatThrownBy(() -> ConstraintChain.parse("MIN_LENGTH[-1]"))
                    .isInstanceOf(HolographicPatternException.class);
            assertThatThrownBy(() -> ConstraintChain.parse("REQ[x]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("takes no argument");
        }

        @Test
        @DisplayName("unbalanced brackets")
        void unbalanced() {
            assertThatThrownBy(() -> ConstraintChain.parse("ENUM[A,B"))
                    .isInstanceOf(HolographicPatternException.class);
        }
    }
}
