package io.octave.core.schema;

import java.util.List;
import java.util.Objects;

/**
 * Contents of a schema's {@code POLICY} block.
 *
 * @param version       policy version, {@code "1.0"} when not declared
 * @param unknownFields handling of undeclared fields
 * @param targets       custom routing targets, without {@code §}
 * @param defaultTarget document-level default target without {@code §}, or {@code null}
 */
public record PolicyDefinition(
        String version, UnknownFieldPolicy unknownFields, List<String> targets, String defaultTarget) {

    public static final String DEFAULT_VERSION = "1.0";

    public static final PolicyDefinition DEFAULT =
            new PolicyDefinition(DEFAULT_VERSION, UnknownFieldPolicy.REJECT, List.of(), null);

    public PolicyDefinition {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(unknownFields, "unknownFields must not be null");
        targets = List.copyOf(targets);
    }
}
