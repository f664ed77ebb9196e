package io.octave.core.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.octave.core.error.InvalidTargetException;
import io.octave.core.model.Document;
import io.octave.core.model.StringValue;
import io.octave.core.parser.Parser;
import io.octave.core.routing.RoutingEntry;
import io.octave.core.routing.RoutingLog;
import io.octave.core.routing.TargetRegistry;
import io.octave.core.routing.TargetRouter;
import io.octave.core.schema.SchemaDefinition;
import io.octave.core.schema.SchemaExtractor;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

/** Tests for {@link Validator}: constraint errors, required fields, routing and unknown-field policy. */
@DisplayName("Validator")
class ValidatorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private static final String STATUS_SCHEMA = """
            ===STATUS_SCHEMA===
            POLICY:
              UNKNOWN_FIELDS::%s
              TARGETS::[§AUDIT]
            FIELDS:
              STATUS::["ACTIVE"∧REQ∧ENUM[ACTIVE,INACTIVE]→§INDEXER]
              COUNT::[1∧OPT∧RANGE[0,10]]
              OWNER::["x"∧REQ∧TYPE[STRING]→§AUDIT]
              META.TYPE::["SPEC"∧OPT∧ENUM[SPEC]]
              RISKS.CRITICAL::["x"∧OPT]
            ===END===
            """;

    private static SchemaDefinition schema(String unknownFields) {
        return SchemaExtractor.extract(Parser.parse(String.format(STATUS_SCHEMA, unknownFields)));
    }

    private static Document doc(String body) {
        return Parser.parse("===DOC===\n" + body + "\n===END===\n");
    }

    private final Validator validator = new Validator(FIXED);

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        @DisplayName("valid document has no errors and routes its targeted fields")
        void valid() {
            ValidationReport report = validator.validate(doc("STATUS::ACTIVE\nCOUNT::5\nOWNER::bob"), schema("REJECT"));

            assertThat(report.isValid()).isTrue();
            assertThat(report.routingLog().entries()).extracting(RoutingEntry::sourcePath, RoutingEntry::targetName)
                    .containsExactly(
                            tuple("STATUS", "INDEXER"),
                            tuple("OWNER", "AUDIT"));
            assertThat(report.routingLog().entries().get(0).timestamp()).isEqualTo("2024-05-01T12:00:00Z");
        }

        @Test
        @DisplayName("enum mismatch is one E005 at the field's line, and the route is still logged")
        void enumMismatch() {
            ValidationReport report = validator.validate(doc("STATUS::PENDING\nOWNER::bob"), schema("REJECT"));

            assertThat(report.errors()).hasSize(1);
            ValidationError error = report.errors().get(0);
            assertThat(error.code()).isEqualTo("E005");
            assertThat(error.fieldPath()).isEqualTo("STATUS");
            assertThat(error.line()).isEqualTo(2);
            assertThat(report.routingLog().entriesFor("STATUS")).singleElement()
                    .satisfies(e -> assertThat(e.constraintPassed()).isFalse());
        }

        @Test
        @DisplayName("range violation on an optional field")
        void rangeViolation() {
            ValidationReport report = validator.validate(doc("STATUS::ACTIVE\nCOUNT::11\nOWNER::bob"), schema("REJECT"));
            assertThat(report.errors()).extracting(ValidationError::code).containsExactly("E006");
        }

        @Test
        @DisplayName("a number beyond double range fails RANGE as an error record")
        void overflowingNumber() {
            SchemaDefinition schema = SchemaExtractor.extract(
                    Parser.parse("===S===\nFIELDS:\n  N::[1∧REQ∧RANGE[0,10]]\n===END===\n"));

            ValidationReport report = validator.validate(doc("N::1e999"), schema);

            assertThat(report.errors()).extracting(ValidationError::code).containsExactly("E006");
        }

        @Test
        @DisplayName("missing required field is E003 without a route")
        void missingRequired() {
            ValidationReport report = validator.validate(doc("STATUS::ACTIVE"), schema("REJECT"));

            assertThat(report.errors(ValidationError.REQUIRED_MISSING)).singleElement().satisfies(e -> {
                assertThat(e.fieldPath()).isEqualTo("OWNER");
                assertThat(e.message()).isEqualTo("Field 'OWNER' is required but missing");
            });
            assertThat(report.routingLog().entriesFor("OWNER")).isEmpty();
        }

        @Test
        @DisplayName("explicit null fails REQ")
        void nullRequired() {
            ValidationReport report = validator.validate(doc("STATUS::ACTIVE\nOWNER::null"), schema("REJECT"));
            assertThat(report.errors()).extracting(ValidationError::code).contains("E003");
        }

        @Test
        @DisplayName("META fields are read from the META map")
        void metaField() {
            ValidationReport report =
                    validator.validate(doc("META:\n  TYPE::NOTE\nSTATUS::ACTIVE\nOWNER::bob"), schema("REJECT"));

            assertThat(report.errors()).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo("E005");
                assertThat(e.fieldPath()).isEqualTo("META.TYPE");
            });
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @Test
        @DisplayName("nested field inherits its block target")
        void inheritedTarget() {
            ValidationReport report = validator.validate(
                    doc("STATUS::ACTIVE\nOWNER::bob\nRISKS[→§RISK_LOG]:\n  CRITICAL::high"), schema("REJECT"));

            assertThat(report.routingLog().entriesFor("RISKS.CRITICAL")).singleElement()
                    .satisfies(e -> assertThat(e.targetName()).isEqualTo("RISK_LOG"));
        }

        @Test
        @DisplayName("undeclared target is E009")
        void invalidTarget() {
            SchemaDefinition schema = SchemaExtractor.extract(
                    Parser.parse("===S===\nFIELDS:\n  A::[\"a\"∧REQ→§NOWHERE]\n===END===\n"));

            ValidationReport report = validator.validate(doc("A::a"), schema);

            assertThat(report.errors(ValidationError.INVALID_TARGET)).singleElement()
                    .satisfies(e -> assertThat(e.message()).contains("NOWHERE"));
            assertThat(report.routingLog().hasRoutes()).isFalse();
        }

        @Test
        @DisplayName("policy default target applies to fields without one")
        void defaultTarget() {
            SchemaDefinition schema = SchemaExtractor.extract(Parser.parse(
                    "===S===\nPOLICY:\n  DEFAULT_TARGET::§KNOWLEDGE_BASE\nFIELDS:\n  A::[\"a\"∧REQ]\n===END===\n"));

            ValidationReport report = validator.validate(doc("A::a"), schema);

            assertThat(report.routingLog().entries()).singleElement()
                    .satisfies(e -> assertThat(e.targetName()).isEqualTo("KNOWLEDGE_BASE"));
        }
    }

    @Nested
    @DisplayName("Router seam")
    @ExtendWith(MockitoExtension.class)
    class RouterSeam {

        @Mock
        private TargetRouter router;

        @Test
        @DisplayName("the router receives path, resolved target, value and outcome")
        void routeCall() {
            new Validator(registry -> router).validate(doc("STATUS::ACTIVE\nOWNER::bob"), schema("REJECT"));

            verify(router).route(eq("STATUS"), eq("INDEXER"), eq(new StringValue("ACTIVE")), eq(true),
                    any(RoutingLog.class));
            verify(router).route(eq("OWNER"), eq("AUDIT"), eq(new StringValue("bob")), eq(true),
                    any(RoutingLog.class));
            verify(router, never()).route(eq("COUNT"), anyString(), any(), anyBoolean(), any());
        }

        @Test
        @DisplayName("a router failure becomes E009")
        void routerFailure() {
            when(router.route(anyString(), anyString(), any(), anyBoolean(), any()))
                    .thenThrow(new InvalidTargetException("INDEXER"));

            ValidationReport report =
                    new Validator(registry -> router).validate(doc("STATUS::ACTIVE\nOWNER::bob"), schema("REJECT"));

            assertThat(report.errors()).extracting(ValidationError::code, ValidationError::fieldPath, ValidationError::line)
                    .containsExactly(tuple("E009", "STATUS", 2), tuple("E009", "OWNER", 3));
        }

        @Test
        @DisplayName("the registry handed to the router knows the policy targets")
        void registryFromPolicy() {
            AtomicReference<TargetRegistry> seen = new AtomicReference<>();

            new Validator(registry -> {
                        seen.set(registry);
                        return router;
                    })
                    .validate(doc("STATUS::ACTIVE\nOWNER::bob"), schema("REJECT"));

            assertThat(seen.get().lookup("AUDIT")).contains(TargetRegistry.Kind.CUSTOM);
        }
    }

    @Nested
    @DisplayName("Unknown fields")
    class UnknownFields {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger validatorLogger;

        @BeforeEach
        void setUp() {
            validatorLogger = (Logger) LoggerFactory.getLogger(Validator.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            validatorLogger.addAppender(logAppender);
        }

        @AfterEach
        void tearDown() {
            validatorLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        private static final String BODY = "STATUS::ACTIVE\nOWNER::bob\nEXTRA::1";

        @Test
        @DisplayName("strict REJECT reports undeclared fields with their line")
        void strictReject() {
            ValidationReport report = validator.validate(doc(BODY), schema("REJECT"), true, Map.of());

            assertThat(report.errors(ValidationError.UNKNOWN_FIELD)).singleElement().satisfies(e -> {
                assertThat(e.fieldPath()).isEqualTo("EXTRA");
                assertThat(e.line()).isEqualTo(4);
            });
        }

        @Test
        @DisplayName("non-strict validation ignores undeclared fields")
        void nonStrict() {
            assertThat(validator.validate(doc(BODY), schema("REJECT")).isValid()).isTrue();
        }

        @Test
        @DisplayName("strict WARN logs instead of failing")
        void strictWarn() {
            ValidationReport report = validator.validate(doc(BODY), schema("WARN"), true, Map.of());

            assertThat(report.isValid()).isTrue();
            assertThat(logAppender.list).anyMatch(e -> e.getLevel() == Level.WARN
                    && e.getFormattedMessage().contains("'EXTRA'"));
        }

        @Test
        @DisplayName("strict IGNORE accepts undeclared fields silently")
        void strictIgnore() {
            ValidationReport report = validator.validate(doc(BODY), schema("IGNORE"), true, Map.of());

            assertThat(report.isValid()).isTrue();
            assertThat(logAppender.list).noneMatch(e -> e.getLevel() == Level.WARN);
        }
    }

    @Nested
    @DisplayName("Section schemas")
    class SectionSchemas {

        private final SchemaDefinition overview = SchemaExtractor.extract(Parser.parse(
                "===OVERVIEW_SCHEMA===\nFIELDS:\n  GOAL::[\"ship\"∧REQ∧ENUM[ship,learn]→§DECISION_LOG]\n===END===\n"));

        @Test
        @DisplayName("section fields are addressed with the section key as prefix")
        void sectionPaths() {
            ValidationReport report =
                    validator.validate(doc("§1::OVERVIEW\n  GOAL::ship"), null, false, Map.of("OVERVIEW", overview));

            assertThat(report.isValid()).isTrue();
            assertThat(report.routingLog().entriesFor("OVERVIEW.GOAL")).singleElement()
                    .satisfies(e -> assertThat(e.targetName()).isEqualTo("DECISION_LOG"));
        }

        @Test
        @DisplayName("missing section field is reported with its full path")
        void missingInSection() {
            ValidationReport report =
                    validator.validate(doc("§1::OVERVIEW\n  OTHER::x"), null, false, Map.of("OVERVIEW", overview));

            assertThat(report.errors()).singleElement()
                    .satisfies(e -> assertThat(e.fieldPath()).isEqualTo("OVERVIEW.GOAL"));
        }

        @Test
        @DisplayName("strict mode checks section members too")
        void strictSection() {
            ValidationReport report =
                    validator.validate(doc("§1::OVERVIEW\n  GOAL::ship\n  OTHER::x"), null, true,
                            Map.of("OVERVIEW", overview));

            assertThat(report.errors(ValidationError.UNKNOWN_FIELD)).singleElement()
                    .satisfies(e -> assertThat(e.fieldPath()).isEqualTo("OVERVIEW.OTHER"));
        }
    }
}
