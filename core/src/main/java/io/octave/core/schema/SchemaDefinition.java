package io.octave.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema extracted from an OCTAVE document: policy plus field definitions in declaration order.
 * Immutable once built, so one instance may back concurrent validations.
 *
 * @param name    envelope name of the schema document
 * @param version {@code META.VERSION}, or {@code null}
 * @param policy  the policy block, {@link PolicyDefinition#DEFAULT} when absent
 * @param fields  field definitions keyed by name
 */
public record SchemaDefinition(String name, String version, PolicyDefinition policy, Map<String, FieldDefinition> fields) {

    public SchemaDefinition {
        Objects.requireNonNull(name, "name must not be null");
        policy = policy == null ? PolicyDefinition.DEFAULT : policy;
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /** Schema with the default policy, for building in code. */
    public static SchemaDefinition of(String name, FieldDefinition... fields) {
        Map<String, FieldDefinition> byName = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            byName.put(field.name(), field);
        }
        return new SchemaDefinition(name, null, PolicyDefinition.DEFAULT, byName);
    }

    public Optional<FieldDefinition> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /** Document-level default routing target from the policy, or {@code null}. */
    public String defaultTarget() {
        return policy.defaultTarget();
    }
}
