package io.octave.core.routing;

import io.octave.core.error.DepthLimitException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the routing target of a field by feudal inheritance:
 * <ol>
 * <li>the field's own explicit target;
 * <li>the nearest ancestor block that declares a target, walking from the field's own path up to
 *     the root ({@code A.B.C}, {@code A.B}, {@code A});
 * <li>the schema's document-level default;
 * <li>otherwise no route.
 * </ol>
 * The walk is capped at {@link #MAX_DEPTH} path segments.
 */
public final class InheritanceResolver {

    public static final int MAX_DEPTH = 100;

    private InheritanceResolver() {}

    /**
     * Resolves a target.
     *
     * @param fieldPath      dotted field path
     * @param explicitTarget the field's own target, or {@code null}
     * @param blockTargets   dotted block path to declared target, as from
     *                       {@link io.octave.core.model.Document#blockTargets()}
     * @param defaultTarget  schema default, or {@code null}
     * @throws DepthLimitException if the path has more than {@link #MAX_DEPTH} segments
     */
    public static Optional<String> resolve(
            String fieldPath, String explicitTarget, Map<String, String> blockTargets, String defaultTarget) {
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(blockTargets, "blockTargets must not be null");
        if (explicitTarget != null) {
            return Optional.of(explicitTarget);
        }
        Optional<String> inherited = nearestBlockTarget(Arrays.asList(fieldPath.split("\\.")), blockTargets);
        if (inherited.isPresent()) {
            return inherited;
        }
        return Optional.ofNullable(defaultTarget);
    }

    /** Target of the nearest ancestor (the path itself included) that declares one. */
    public static Optional<String> nearestBlockTarget(List<String> path, Map<String, String> blockTargets) {
        for (String ancestor : ancestors(path)) {
            String target = blockTargets.get(ancestor);
            if (target != null) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    /**
     * Dotted ancestor paths from nearest to farthest, starting with the path itself.
     *
     * @throws DepthLimitException if the path has more than {@link #MAX_DEPTH} segments
     */
    public static List<String> ancestors(List<String> path) {
        if (path.size() > MAX_DEPTH) {
            throw new DepthLimitException(String.join(".", path), path.size(), MAX_DEPTH);
        }
        List<String> result = new ArrayList<>(path.size());
        for (int end = path.size(); end > 0; end--) {
            result.add(String.join(".", path.subList(0, end)));
        }
        return result;
    }
}
