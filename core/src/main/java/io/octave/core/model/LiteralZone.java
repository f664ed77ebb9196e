package io.octave.core.model;

import java.util.Objects;

/**
 * Opaque fenced payload. Never parsed, never validated, emitted byte for byte.
 *
 * @param content     the lines between the fences, each ending with a newline; empty for an
 *                    empty zone
 * @param infoTag     text after the opening fence (e.g. {@code python}), or {@code null}
 * @param fenceMarker the exact backtick run that opened the zone
 */
public record LiteralZone(String content, String infoTag, String fenceMarker) implements Value {

    public LiteralZone {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fenceMarker, "fenceMarker must not be null");
        if (fenceMarker.length() < 3 || !fenceMarker.chars().allMatch(c -> c == '`')) {
            throw new IllegalArgumentException("fenceMarker must be three or more backticks, got: " + fenceMarker);
        }
        if (infoTag != null && infoTag.isBlank()) {
            infoTag = null;
        }
    }

    public static LiteralZone of(String content) {
        return new LiteralZone(content, null, "```");
    }

    @Override
    public String typeName() {
        return "LITERAL";
    }
}
