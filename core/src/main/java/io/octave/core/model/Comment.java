package io.octave.core.model;

import java.util.List;
import java.util.Objects;

/** A comment line with no node after it in the same body. */
public record Comment(String text, int line) implements Node {

    public Comment {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String key() {
        return "";
    }

    @Override
    public List<String> leadingComments() {
        return List.of();
    }
}
