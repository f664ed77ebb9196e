package io.octave.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.octave.core.model.NumberValue;
import io.octave.core.model.StringValue;
import io.octave.core.parser.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link SchemaExtractor}: META, POLICY and FIELDS of a schema document. */
@DisplayName("SchemaExtractor")
class SchemaExtractorTest {

    private static final String USER_SCHEMA = """
            ===USER_SCHEMA===
            META:
              TYPE::PROTOCOL_DEFINITION
              VERSION::"1.2"
            POLICY:
              VERSION::"2.0"
              UNKNOWN_FIELDS::WARN
              TARGETS::[§INDEXER,§DECISION_LOG]
              DEFAULT_TARGET::§SELF
            FIELDS:
              STATUS::["ACTIVE"∧REQ∧ENUM[ACTIVE,DRAFT]→§INDEXER]
              COUNT::[5∧OPT∧RANGE[0,10]]
              RISKS:
                CRITICAL::["x"∧REQ→§RISK_LOG]
              NOTE::free text
            ===END===
            """;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger extractorLogger;

    @BeforeEach
    void setUp() {
        extractorLogger = (Logger) LoggerFactory.getLogger(SchemaExtractor.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        extractorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        extractorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static SchemaDefinition extract(String text) {
        return SchemaExtractor.extract(Parser.parse(text));
    }

    @Nested
    @DisplayName("Header and policy")
    class HeaderAndPolicy {

        @Test
        @DisplayName("name comes from the envelope, version from META")
        void nameAndVersion() {
            SchemaDefinition schema = extract(USER_SCHEMA);

            assertThat(schema.name()).isEqualTo("USER_SCHEMA");
            assertThat(schema.version()).isEqualTo("1.2");
        }

        @Test
        @DisplayName("POLICY block is read with targets normalized")
        void policy() {
            PolicyDefinition policy = extract(USER_SCHEMA).policy();

            assertThat(policy.version()).isEqualTo("2.0");
            assertThat(policy.unknownFields()).isEqualTo(UnknownFieldPolicy.WARN);
            assertThat(policy.targets()).containsExactly("INDEXER", "DECISION_LOG");
            assertThat(policy.defaultTarget()).isEqualTo("SELF");
        }

        @Test
        @DisplayName("missing POLICY gives the default policy")
        void defaultPolicy() {
            SchemaDefinition schema = extract("===S===\nFIELDS:\n  A::[\"a\"∧REQ]\n===END===\n");

            assertThat(schema.policy()).isEqualTo(PolicyDefinition.DEFAULT);
            assertThat(schema.policy().unknownFields()).isEqualTo(UnknownFieldPolicy.REJECT);
            assertThat(schema.version()).isNull();
        }

        @Test
        @DisplayName("unrecognized UNKNOWN_FIELDS value falls back to REJECT with a warning")
        void badUnknownFields() {
            SchemaDefinition schema = extract("===S===\nPOLICY:\n  UNKNOWN_FIELDS::SOMETIMES\n===END===\n");

            assertThat(schema.policy().unknownFields()).isEqualTo(UnknownFieldPolicy.REJECT);
            assertThat(logAppender.list)
                    .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains("SOMETIMES"));
        }

        @Test
        @DisplayName("UnknownFieldPolicy parses case-insensitively")
        void policyFromString() {
            assertThat(UnknownFieldPolicy.fromString("ignore")).isEqualTo(UnknownFieldPolicy.IGNORE);
            assertThatThrownBy(() -> UnknownFieldPolicy.fromString("maybe"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("fields keep declaration order with dotted names for nested blocks")
        void order() {
            assertThat(extract(USER_SCHEMA).fields().keySet())
                    .containsExactly("STATUS", "COUNT", "RISKS.CRITICAL", "NOTE");
        }

        @Test
        @DisplayName("holographic fields carry example, chain and target")
        void holographicField() {
            FieldDefinition status = extract(USER_SCHEMA).field("STATUS").orElseThrow();

            assertThat(status.required()).isTrue();
            assertThat(status.target()).isEqualTo("INDEXER");
            assertThat(status.pattern().example()).isEqualTo(new StringValue("ACTIVE"));
            assertThat(status.pattern().constraints().render()).isEqualTo("REQ∧ENUM[ACTIVE,DRAFT]");
        }

        @Test
        @DisplayName("optional field without target")
        void optionalField() {
            FieldDefinition count = extract(USER_SCHEMA).field("COUNT").orElseThrow();

            assertThat(count.required()).isFalse();
            assertThat(count.target()).isNull();
            assertThat(count.pattern().example()).isEqualTo(NumberValue.parse("5"));
        }

        @Test
        @DisplayName("nested field routes to its own target")
        void nestedField() {
            FieldDefinition critical = extract(USER_SCHEMA).field("RISKS.CRITICAL").orElseThrow();
            assertThat(critical.target()).isEqualTo("RISK_LOG");
        }

        @Test
        @DisplayName("plain value is listed without a pattern and logged")
        void plainValue() {
            FieldDefinition note = extract(USER_SCHEMA).field("NOTE").orElseThrow();

            assertThat(note.pattern()).isNull();
            assertThat(note.required()).isFalse();
            assertThat(logAppender.list)
                    .anyMatch(e -> e.getLevel() == Level.WARN
                            && e.getFormattedMessage().contains("'NOTE'")
                            && e.getFormattedMessage().contains("not a holographic pattern"));
        }

        @Test
        @DisplayName("pattern with an unknown constraint is kept without a pattern")
        void invalidPattern() {
            SchemaDefinition schema = extract("===S===\nFIELDS:\n  A::[\"a\"∧REQ∧REGEX[\"(\"]]\n===END===\n");

            FieldDefinition a = schema.field("A").orElseThrow();
            assertThat(a.pattern()).isNull();
            assertThat(a.raw()).contains("REGEX");
            assertThat(logAppender.list)
                    .anyMatch(e -> e.getLevel() == Level.WARN
                            && e.getFormattedMessage().contains("invalid holographic pattern"));
        }

        @Test
        @DisplayName("document without FIELDS has no fields")
        void noFields() {
            assertThat(extract("===S===\nA::1\n===END===\n").fields()).isEmpty();
        }
    }
}
