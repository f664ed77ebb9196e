package io.octave.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * One audit record of a routed field value.
 *
 * @param sourcePath       dotted path of the field, e.g. {@code RISKS.CRITICAL}
 * @param targetName       resolved target without {@code §}
 * @param valueHash        SHA-256 hex digest of the value's canonical text
 * @param constraintPassed whether the field's constraint chain passed
 * @param timestamp        ISO 8601 UTC instant ending in {@code Z}
 */
public record RoutingEntry(
        String sourcePath, String targetName, String valueHash, boolean constraintPassed, String timestamp) {

    private static final ObjectMapper JSON = new ObjectMapper();

    public RoutingEntry {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(valueHash, "valueHash must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public ObjectNode toJson() {
        ObjectNode node = JSON.createObjectNode();
        node.put("source_path", sourcePath);
        node.put("target_name", targetName);
        node.put("value_hash", valueHash);
        node.put("constraint_passed", constraintPassed);
        node.put("timestamp", timestamp);
        return node;
    }
}
