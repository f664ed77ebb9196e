package io.octave.core.routing;

import io.octave.core.emit.Emitter;
import io.octave.core.model.StringValue;
import io.octave.core.model.Value;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 of a value's canonical text. Strings hash their content, every other value hashes its
 * canonical emitter form, so equal values hash alike regardless of source spelling.
 */
public final class ValueHasher {

    private ValueHasher() {}

    public static String hash(Value value) {
        Objects.requireNonNull(value, "value must not be null");
        String canonical = value instanceof StringValue s ? s.value() : Emitter.emitValue(value);
        return sha256(canonical);
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
