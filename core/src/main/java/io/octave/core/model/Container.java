package io.octave.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node with ordered children: a {@link Block} or a {@link Section}.
 *
 * <p>Children keep source order. Repeated keys are allowed (the last one is the effective value);
 * lookups by key therefore return the last match. Mutation after parsing goes through
 * {@link #replaceChild(String, Node)}, which keeps the position of the node it replaces.
 */
public abstract sealed class Container implements Node permits Block, Section {

    private final String key;
    private final int line;
    private final List<Node> children = new ArrayList<>();
    private final List<String> leadingComments;

    protected Container(String key, int line, List<String> leadingComments) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.line = line;
        this.leadingComments = leadingComments == null ? List.of() : List.copyOf(leadingComments);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public int line() {
        return line;
    }

    @Override
    public List<String> leadingComments() {
        return leadingComments;
    }

    /** Read-only view of the children in source order. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** Appends a child. Used while building the tree. */
    public void add(Node child) {
        children.add(Objects.requireNonNull(child, "child must not be null"));
    }

    /** The effective (last) child with the given key. */
    public Optional<Node> child(String childKey) {
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).key().equals(childKey) && !(children.get(i) instanceof Comment)) {
                return Optional.of(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces the effective child with the given key, keeping its position.
     *
     * @throws IllegalArgumentException if no such child exists or the replacement has another key
     */
    public void replaceChild(String childKey, Node replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (!replacement.key().equals(childKey)) {
            throw new IllegalArgumentException(String.format(
                    "replacement key '%s' does not match '%s'", replacement.key(), childKey));
        }
        for (int i = children.size() - 1; i >= 0; i--) {
            Node current = children.get(i);
            if (current.key().equals(childKey) && !(current instanceof Comment)) {
                children.set(i, replacement);
                return;
            }
        }
        throw new IllegalArgumentException(String.format("'%s' has no child '%s'", key, childKey));
    }
}
