package io.octave.core.routing;

import io.octave.core.error.InvalidTargetException;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Known routing targets: the built-in set, custom names registered from a schema's
 * {@code POLICY.TARGETS}, and anything shaped like a file path. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class TargetRegistry {

    /** How a target name was recognized. */
    public enum Kind {
        BUILTIN,
        CUSTOM,
        FILE
    }

    public static final Set<String> BUILTINS =
            Set.of("SELF", "META", "INDEXER", "DECISION_LOG", "RISK_LOG", "KNOWLEDGE_BASE");

    /** Absolute, relative or home paths, or a bare file name with an extension. */
    private static final Pattern FILE_PATH = Pattern.compile(
            "(?:/|\\./|\\.\\./|~/)[\\w.\\-/]*|[\\w.\\-]+(?:/[\\w.\\-]+)+|[\\w\\-]+(?:\\.[A-Za-z0-9]+)+");

    private final Set<String> custom = ConcurrentHashMap.newKeySet();

    public TargetRegistry() {}

    /** Registry with the given custom targets already registered. */
    public TargetRegistry(Collection<String> customTargets) {
        customTargets.forEach(this::registerCustom);
    }

    /**
     * Registers a custom target. A leading {@code §} is stripped.
     *
     * @throws IllegalArgumentException if the name is blank
     */
    public void registerCustom(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String bare = strip(name);
        if (bare.isEmpty()) {
            throw new IllegalArgumentException("target name must not be empty");
        }
        custom.add(bare);
    }

    /** Classifies a target name, or returns empty when it is unknown. */
    public Optional<Kind> lookup(String name) {
        String bare = strip(Objects.requireNonNull(name, "name must not be null"));
        if (BUILTINS.contains(bare)) {
            return Optional.of(Kind.BUILTIN);
        }
        if (custom.contains(bare)) {
            return Optional.of(Kind.CUSTOM);
        }
        if (FILE_PATH.matcher(bare).matches()) {
            return Optional.of(Kind.FILE);
        }
        return Optional.empty();
    }

    public boolean isValid(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Returns the kind of a target, throwing when it is unknown.
     *
     * @throws InvalidTargetException if the name is not built in, registered, or path-shaped
     */
    public Kind require(String name) {
        return lookup(name).orElseThrow(() -> new InvalidTargetException(strip(name)));
    }

    /** Number of registered custom targets. */
    public int customCount() {
        return custom.size();
    }

    private static String strip(String name) {
        String trimmed = name.strip();
        return trimmed.startsWith("§") ? trimmed.substring(1) : trimmed;
    }
}
