package io.octave.core.schema;

import io.octave.core.emit.Emitter;
import io.octave.core.error.HolographicPatternException;
import io.octave.core.model.Assignment;
import io.octave.core.model.Container;
import io.octave.core.model.Document;
import io.octave.core.model.HolographicValue;
import io.octave.core.model.ListValue;
import io.octave.core.model.Node;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link SchemaDefinition} from a parsed schema document.
 *
 * <p>Reads the envelope name, {@code META.VERSION}, the top-level {@code POLICY} block and the
 * top-level {@code FIELDS} block. Blocks nested in {@code FIELDS} contribute dotted field names
 * ({@code RISKS.CRITICAL}). A field whose value is not a valid holographic pattern is kept with no
 * pattern, so the schema still lists it.
 */
public final class SchemaExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaExtractor.class);

    static final String POLICY_BLOCK = "POLICY";
    static final String FIELDS_BLOCK = "FIELDS";

    private SchemaExtractor() {}

    public static SchemaDefinition extract(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        Value version = document.meta().get("VERSION");
        PolicyDefinition policy = PolicyDefinition.DEFAULT;
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();

        for (Node node : document.nodes()) {
            if (!(node instanceof Container container)) {
                continue;
            }
            if (POLICY_BLOCK.equals(container.key())) {
                policy = extractPolicy(container);
            } else if (FIELDS_BLOCK.equals(container.key())) {
                collectFields(container, "", fields);
            }
        }

        SchemaDefinition schema = new SchemaDefinition(
                document.name(), version == null || version.isAbsent() ? null : text(version), policy, fields);
        LOG.debug("Extracted schema '{}' with {} fields, unknown fields {}",
                schema.name(), fields.size(), policy.unknownFields());
        return schema;
    }

    // ── Policy ──

    private static PolicyDefinition extractPolicy(Container block) {
        String version = PolicyDefinition.DEFAULT_VERSION;
        UnknownFieldPolicy unknownFields = UnknownFieldPolicy.REJECT;
        List<String> targets = List.of();
        String defaultTarget = null;

        for (Node child : block.children()) {
            if (!(child instanceof Assignment assignment)) {
                continue;
            }
            Value value = assignment.value();
            switch (assignment.key()) {
                case "VERSION" -> version = text(value);
                case "UNKNOWN_FIELDS" -> {
                    try {
                        unknownFields = UnknownFieldPolicy.fromString(text(value));
                    } catch (IllegalArgumentException e) {
                        LOG.warn("POLICY.UNKNOWN_FIELDS '{}' at line {} is not REJECT, IGNORE or WARN; using REJECT",
                                text(value), assignment.line());
                    }
                }
                case "TARGETS" -> targets = targetNames(value);
                case "DEFAULT_TARGET" -> defaultTarget = HolographicPatternParser.normalizeTarget(text(value));
                default -> LOG.debug("Ignoring POLICY.{} at line {}", assignment.key(), assignment.line());
            }
        }
        return new PolicyDefinition(version, unknownFields, targets, defaultTarget);
    }

    private static List<String> targetNames(Value value) {
        List<Value> items = value instanceof ListValue list ? list.items() : List.of(value);
        List<String> names = new ArrayList<>();
        for (Value item : items) {
            if (item.isAbsent()) {
                continue;
            }
            String name = HolographicPatternParser.normalizeTarget(text(item));
            if (name != null) {
                names.add(name);
            }
        }
        return names;
    }

    // ── Fields ──

    private static void collectFields(Container block, String prefix, Map<String, FieldDefinition> fields) {
        for (Node child : block.children()) {
            if (child instanceof Container nested) {
                collectFields(nested, prefix + nested.key() + ".", fields);
            } else if (child instanceof Assignment assignment) {
                String name = prefix + assignment.key();
                fields.put(name, field(name, assignment));
            }
        }
    }

    private static FieldDefinition field(String name, Assignment assignment) {
        Value value = assignment.value();
        if (value instanceof HolographicValue holographic) {
            try {
                return new FieldDefinition(name, HolographicPatternParser.from(holographic), holographic.raw());
            } catch (HolographicPatternException e) {
                LOG.warn("Field '{}' at line {} has an invalid holographic pattern: {}",
                        name, assignment.line(), e.getMessage());
                return new FieldDefinition(name, null, holographic.raw());
            }
        }
        String raw = value.isAbsent() ? null : Emitter.emitValue(value);
        LOG.warn("Field '{}' at line {} is not a holographic pattern, it will not be validated", name, assignment.line());
        return new FieldDefinition(name, null, raw);
    }

    private static String text(Value value) {
        return value instanceof StringValue s ? s.value() : Emitter.emitValue(value);
    }
}
