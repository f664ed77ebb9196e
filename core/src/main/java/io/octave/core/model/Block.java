package io.octave.core.model;

import java.util.List;

/** {@code KEY:} followed by indented children, optionally routed with {@code KEY[→§TARGET]:}. */
public final class Block extends Container {

    private final String target;

    public Block(String key, String target, int line, List<String> leadingComments) {
        super(key, line, leadingComments);
        this.target = target;
    }

    public Block(String key) {
        this(key, null, 0, List.of());
    }

    /** Declared routing target without section marker, or {@code null}. */
    public String target() {
        return target;
    }

    @Override
    public String toString() {
        return "Block[" + key() + (target == null ? "" : "→" + target) + ", children=" + children().size() + "]";
    }
}
