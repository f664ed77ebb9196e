package io.octave.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code §ID::NAME} with an optional {@code [annotation]}: a block with a stable identifier used
 * for cross-document coverage. The {@link #key()} is the name.
 */
public final class Section extends Container {

    private final String id;
    private final String annotation;

    public Section(String id, String key, String annotation, int line, List<String> leadingComments) {
        super(key, line, leadingComments);
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.annotation = annotation;
    }

    public Section(String id, String key) {
        this(id, key, null, 0, List.of());
    }

    /** Section identifier, e.g. {@code 1}, {@code 2b} or {@code CONTEXT}. */
    public String id() {
        return id;
    }

    /** Bracket annotation text, or {@code null}. */
    public String annotation() {
        return annotation;
    }

    @Override
    public String toString() {
        return "Section[§" + id + "::" + key() + ", children=" + children().size() + "]";
    }
}
