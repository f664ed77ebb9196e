package io.octave.core.validate;

import io.octave.core.constraint.ConstraintResult;
import io.octave.core.error.InvalidTargetException;
import io.octave.core.model.Assignment;
import io.octave.core.model.Container;
import io.octave.core.model.Document;
import io.octave.core.model.InlineMap;
import io.octave.core.model.Node;
import io.octave.core.model.Value;
import io.octave.core.routing.InheritanceResolver;
import io.octave.core.routing.RoutingLog;
import io.octave.core.routing.TargetRegistry;
import io.octave.core.routing.TargetRouter;
import io.octave.core.schema.FieldDefinition;
import io.octave.core.schema.SchemaDefinition;
import io.octave.core.schema.UnknownFieldPolicy;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a document against a schema and routes field values to their targets.
 *
 * <p>For each schema field: a missing required field is an {@code E003} error; a missing optional
 * field is skipped; a present field has its whole constraint chain evaluated and every error
 * collected. Fields with a pattern are then routed by feudal inheritance, and the route is logged
 * whether or not the constraints passed.
 *
 * <p>The top-level schema addresses fields by dotted path from the document root
 * ({@code META.VERSION} reads the META map). Section schemas apply to top-level blocks and
 * sections whose key matches, with field paths {@code KEY.FIELD}. Undeclared assignments are only
 * checked in strict mode, and only against a non-empty field list.
 *
 * <p>Holds no per-call state; one instance may validate many documents concurrently.
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private static final String META_PREFIX = "META.";

    private final Function<TargetRegistry, TargetRouter> routers;

    public Validator() {
        this(Clock.systemUTC());
    }

    /** Validator whose routing timestamps come from {@code clock}. */
    public Validator(Clock clock) {
        this(registry -> new TargetRouter(registry, clock));
    }

    /**
     * Validator with a custom router factory. The factory receives the registry built from each
     * schema's policy targets.
     */
    public Validator(Function<TargetRegistry, TargetRouter> routers) {
        this.routers = Objects.requireNonNull(routers, "routers must not be null");
    }

    public ValidationReport validate(Document document, SchemaDefinition schema) {
        return validate(document, schema, false, Map.of());
    }

    /**
     * Validates a document.
     *
     * @param document       the parsed document
     * @param schema         top-level schema, or {@code null} to validate sections only
     * @param strict         whether undeclared fields are checked against the policy
     * @param sectionSchemas schemas keyed by top-level block or section key; may be {@code null}
     * @throws io.octave.core.error.DepthLimitException if a field path is too deep to resolve
     */
    public ValidationReport validate(
            Document document, SchemaDefinition schema, boolean strict, Map<String, SchemaDefinition> sectionSchemas) {
        Objects.requireNonNull(document, "document must not be null");
        List<ValidationError> errors = new ArrayList<>();
        RoutingLog log = new RoutingLog();
        Map<String, String> blockTargets = document.blockTargets();

        if (schema != null) {
            Scope root = new Scope("", document::find, document.nodes(), document.meta());
            validateScope(root, schema, strict, blockTargets, errors, log);
        }
        if (sectionSchemas != null && !sectionSchemas.isEmpty()) {
            for (Node node : document.nodes()) {
                if (node instanceof Container container && sectionSchemas.containsKey(container.key())) {
                    Scope scope = new Scope(
                            container.key() + ".", path -> lookupIn(container, path), container.children(), Map.of());
                    validateScope(scope, sectionSchemas.get(container.key()), strict, blockTargets, errors, log);
                }
            }
        }

        LOG.debug("Validated document '{}': {} errors, {} routes", document.name(), errors.size(), log.size());
        return new ValidationReport(errors, log);
    }

    // ── Scopes ──

    /** A part of the document validated against one schema. */
    private record Scope(
            String prefix, Function<String, Optional<Node>> lookup, List<Node> members, Map<String, Value> meta) {}

    private void validateScope(
            Scope scope,
            SchemaDefinition schema,
            boolean strict,
            Map<String, String> blockTargets,
            List<ValidationError> errors,
            RoutingLog log) {
        TargetRouter router = routers.apply(new TargetRegistry(schema.policy().targets()));
        for (FieldDefinition field : schema.fields().values()) {
            validateField(scope, field, schema, blockTargets, router, errors, log);
        }
        if (strict) {
            checkUnknownFields(scope, schema, errors);
        }
    }

    private void validateField(
            Scope scope,
            FieldDefinition field,
            SchemaDefinition schema,
            Map<String, String> blockTargets,
            TargetRouter router,
            List<ValidationError> errors,
            RoutingLog log) {
        String path = scope.prefix() + field.name();
        Optional<Node> node = scope.lookup().apply(field.name());
        Value value = node.filter(Assignment.class::isInstance)
                .map(n -> ((Assignment) n).value())
                .filter(v -> !v.isAbsent())
                .orElse(null);
        if (node.isEmpty() && field.name().startsWith(META_PREFIX)) {
            value = metaValue(scope.meta(), field.name());
        }
        int line = node.map(Node::line).orElse(0);

        if (field.pattern() == null) {
            return;
        }
        if (value == null) {
            if (field.required()) {
                errors.add(new ValidationError(
                        ValidationError.REQUIRED_MISSING,
                        String.format("Field '%s' is required but missing", path),
                        path,
                        0));
            }
            return;
        }

        ConstraintResult result = field.pattern().constraints().evaluate(value, path);
        result.errors().forEach(e -> errors.add(ValidationError.from(e, line)));

        Optional<String> target =
                InheritanceResolver.resolve(path, field.target(), blockTargets, schema.defaultTarget());
        if (target.isEmpty()) {
            return;
        }
        try {
            router.route(path, target.get(), value, result.valid(), log);
        } catch (InvalidTargetException e) {
            errors.add(new ValidationError(
                    ValidationError.INVALID_TARGET,
                    String.format(
                            "Invalid target '%s': not a builtin, registered custom, or file path target",
                            e.targetName()),
                    path,
                    line));
        }
    }

    private void checkUnknownFields(Scope scope, SchemaDefinition schema, List<ValidationError> errors) {
        UnknownFieldPolicy policy = schema.policy().unknownFields();
        if (schema.fields().isEmpty() || policy == UnknownFieldPolicy.IGNORE) {
            return;
        }
        for (Node member : scope.members()) {
            if (!(member instanceof Assignment assignment) || schema.fields().containsKey(assignment.key())) {
                continue;
            }
            String path = scope.prefix() + assignment.key();
            if (policy == UnknownFieldPolicy.WARN) {
                LOG.warn("Unknown field '{}' at line {} is not declared by schema '{}'",
                        path, assignment.line(), schema.name());
            } else {
                errors.add(new ValidationError(
                        ValidationError.UNKNOWN_FIELD,
                        String.format("Unknown field '%s' not allowed by schema '%s'", path, schema.name()),
                        path,
                        assignment.line()));
            }
        }
    }

    // ── Lookup ──

    private static Optional<Node> lookupIn(Container container, String path) {
        Optional<Node> current = Optional.of(container);
        for (String segment : path.split("\\.")) {
            if (current.isEmpty() || !(current.get() instanceof Container parent)) {
                return Optional.empty();
            }
            current = parent.child(segment);
        }
        return current;
    }

    /** Reads {@code META.A.B} from the META map, descending through inline maps. */
    private static Value metaValue(Map<String, Value> meta, String fieldName) {
        String[] segments = fieldName.substring(META_PREFIX.length()).split("\\.");
        Value current = meta.get(segments[0]);
        for (int i = 1; i < segments.length && current != null; i++) {
            current = current instanceof InlineMap map ? map.get(segments[i]) : null;
        }
        return current == null || current.isAbsent() ? null : current;
    }
}
