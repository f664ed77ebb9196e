package io.octave.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.octave.core.error.HolographicPatternException;
import io.octave.core.error.LexerException;
import io.octave.core.model.HolographicValue;
import io.octave.core.model.ListValue;
import io.octave.core.model.NumberValue;
import io.octave.core.model.StringValue;
import io.octave.core.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link HolographicPatternParser}. */
@DisplayName("HolographicPatternParser")
class HolographicPatternParserTest {

    @Nested
    @DisplayName("Valid patterns")
    class Valid {

        @Test
        @DisplayName("example, chain and target")
        void full() {
            HolographicPattern pattern = HolographicPatternParser.parse("[\"ACTIVE\"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]");

            assertThat(pattern.example()).isEqualTo(new StringValue("ACTIVE"));
            assertThat(pattern.constraints().render()).isEqualTo("REQ∧ENUM[ACTIVE,DRAFT]");
            assertThat(pattern.constraints().isRequired()).isTrue();
            assertThat(pattern.target()).isEqualTo("INDEXER");
        }

        @Test
        @DisplayName("ASCII aliases for constraint and flow")
        void asciiAliases() {
            HolographicPattern pattern = HolographicPatternParser.parse("[\"x\"&REQ->§SELF]");

            assertThat(pattern.constraints().render()).isEqualTo("REQ");
            assertThat(pattern.target()).isEqualTo("SELF");
        }

        @Test
        @DisplayName("no target")
        void noTarget() {
            HolographicPattern pattern = HolographicPatternParser.parse("[42∧OPT∧RANGE[0,100]]");

            assertThat(pattern.example()).isEqualTo(NumberValue.parse("42"));
            assertThat(pattern.target()).isNull();
        }

        @Test
        @DisplayName("list example")
        void listExample() {
            HolographicPattern pattern = HolographicPatternParser.parse("[[a,b]∧TYPE[LIST]]");
            assertThat(pattern.example()).isEqualTo(ListValue.of(new StringValue("a"), new StringValue("b")));
        }

        @Test
        @DisplayName("multiple targets are normalized and rendered with section marks")
        void multiTarget() {
            HolographicPattern pattern = HolographicPatternParser.parse("[x∧REQ→§INDEXER∨§DECISION_LOG]");

            assertThat(pattern.target()).isEqualTo("INDEXER∨DECISION_LOG");
            assertThat(pattern.render()).isEqualTo("[x∧REQ→§INDEXER∨§DECISION_LOG]");
        }

        @Test
        @DisplayName("regex with nested brackets is not split")
        void regexWithBrackets() {
            HolographicPattern pattern = HolographicPatternParser.parse("[\"abc\"∧REQ∧REGEX[^[a-z]+$]→§SELF]");

            assertThat(pattern.constraints().constraints()).hasSize(2);
            assertThat(pattern.constraints().evaluate(new StringValue("abc"), "F").valid()).isTrue();
            assertThat(pattern.target()).isEqualTo("SELF");
        }

        @Test
        @DisplayName("render gives canonical text")
        void render() {
            assertThat(HolographicPatternParser.parse("[ \"ACTIVE\" ∧ REQ ∧ ENUM[ACTIVE, DRAFT] → §INDEXER ]").render())
                    .isEqualTo("[ACTIVE∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]");
        }

        @Test
        @DisplayName("compiles a value the parser already recognized")
        void fromParsedValue() {
            HolographicValue value = (HolographicValue) Parser.parse("===S===\nF::[\"a\"∧REQ∧ENUM[a,b]→§META]\n===END===\n")
                    .valueAt("F")
                    .orElseThrow();

            HolographicPattern pattern = HolographicPatternParser.from(value);
            assertThat(pattern.example()).isEqualTo(new StringValue("a"));
            assertThat(pattern.constraints().render()).isEqualTo("REQ∧ENUM[a,b]");
            assertThat(pattern.target()).isEqualTo("META");
        }
    }

    @Nested
    @DisplayName("Invalid patterns")
    class Invalid {

        @Test
        @DisplayName("must be bracketed")
        void notBracketed() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("x∧REQ"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("enclosed in brackets");
        }

        @Test
        @DisplayName("must have a constraint")
        void noConstraint() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("[x]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("no constraint");
        }

        @Test
        @DisplayName("must have an example")
        void noExample() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("[∧REQ]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("no example");
        }

        @Test
        @DisplayName("chain must not be empty")
        void emptyChain() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("[x∧]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("empty constraint chain");
        }

        @Test
        @DisplayName("example that does not lex is wrapped")
        void badExample() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("[{x}∧REQ]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("Invalid example value")
                    .hasCauseInstanceOf(LexerException.class);
        }

        @Test
        @DisplayName("empty target")
        void emptyTarget() {
            assertThatThrownBy(() -> HolographicPatternParser.parse("[x∧REQ→§]"))
                    .isInstanceOf(HolographicPatternException.class)
                    .hasMessageContaining("Empty routing target");
        }
    }
}
