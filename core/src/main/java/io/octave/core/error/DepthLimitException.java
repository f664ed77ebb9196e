package io.octave.core.error;

/**
 * Thrown when an ancestor walk for target inheritance exceeds its depth cap. Distinct from the
 * parser's nesting cap, which bounds bracket nesting inside a single value.
 */
public final class DepthLimitException extends OctaveException {

    private static final long serialVersionUID = 1L;

    public static final String CODE = "E_ANCESTOR_DEPTH";

    private final int depth;
    private final int limit;

    public DepthLimitException(String path, int depth, int limit) {
        super(
                CODE,
                String.format("path '%s' has depth %d, exceeding the ancestor walk limit of %d", path, depth, limit),
                0,
                0,
                Phase.ROUTE);
        this.depth = depth;
        this.limit = limit;
    }

    /** Depth of the path that was rejected. */
    public int depth() {
        return depth;
    }

    /** The configured cap. */
    public int limit() {
        return limit;
    }
}
