package io.octave.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed OCTAVE document: envelope name, optional front matter and grammar version, META map
 * and the ordered top-level nodes.
 *
 * <p>The node graph belongs to one document and is not shared. Collaborators that need to edit a
 * parsed document use {@link #replace(String, Node)} rather than reaching into containers, so the
 * ordering rules stay in one place.
 */
public final class Document {

    /** Name given to a document that has no {@code ===NAME===} envelope. */
    public static final String INFERRED_NAME = "INFERRED";

    private final String name;
    private final String frontMatter;
    private final String grammarVersion;
    private final Map<String, Value> meta;
    private final boolean separator;
    private final List<Node> nodes;
    private final List<String> trailingComments;

    private Document(Builder builder) {
        this.name = builder.name;
        this.frontMatter = builder.frontMatter;
        this.grammarVersion = builder.grammarVersion;
        this.meta = Collections.unmodifiableMap(new LinkedHashMap<>(builder.meta));
        this.separator = builder.separator;
        this.nodes = new ArrayList<>(builder.nodes);
        this.trailingComments = List.copyOf(builder.trailingComments);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Envelope name, {@link #INFERRED_NAME} when the source had none. */
    public String name() {
        return name;
    }

    /** Opaque front matter between the leading {@code ---} lines, or {@code null}. */
    public String frontMatter() {
        return frontMatter;
    }

    /** Version from a leading {@code OCTAVE::x.y.z} sentinel, or {@code null}. */
    public String grammarVersion() {
        return grammarVersion;
    }

    /** META entries in source order. */
    public Map<String, Value> meta() {
        return meta;
    }

    /** Whether a {@code ---} separator followed META. */
    public boolean hasSeparator() {
        return separator;
    }

    /** Top-level nodes in source order (read-only view). */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Comments after the last top-level node. */
    public List<String> trailingComments() {
        return trailingComments;
    }

    /** Resolves a dotted key path such as {@code RISKS.CRITICAL}. */
    public Optional<Node> find(String dottedPath) {
        Objects.requireNonNull(dottedPath, "dottedPath must not be null");
        return find(Arrays.asList(dottedPath.split("\\.")));
    }

    /** Resolves a key path given as segments. The last node with a matching key wins at each level. */
    public Optional<Node> find(List<String> segments) {
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        Optional<Node> current = lastWithKey(nodes, segments.get(0));
        for (int i = 1; i < segments.size() && current.isPresent(); i++) {
            if (!(current.get() instanceof Container container)) {
                return Optional.empty();
            }
            current = container.child(segments.get(i));
        }
        return current;
    }

    /** Value of the assignment at the given path, if the path names an assignment. */
    public Optional<Value> valueAt(String dottedPath) {
        return find(dottedPath).filter(Assignment.class::isInstance).map(n -> ((Assignment) n).value());
    }

    /**
     * Replaces the node at a dotted path, keeping its position among its siblings.
     *
     * @throws IllegalArgumentException if nothing lives at the path or the replacement key differs
     */
    public void replace(String dottedPath, Node replacement) {
        Objects.requireNonNull(replacement, "replacement must not be null");
        List<String> segments = Arrays.asList(dottedPath.split("\\."));
        String leaf = segments.get(segments.size() - 1);
        if (segments.size() == 1) {
            if (!replacement.key().equals(leaf)) {
                throw new IllegalArgumentException(
                        String.format("replacement key '%s' does not match '%s'", replacement.key(), leaf));
            }
            for (int i = nodes.size() - 1; i >= 0; i--) {
                Node node = nodes.get(i);
                if (node.key().equals(leaf) && !(node instanceof Comment)) {
                    nodes.set(i, replacement);
                    return;
                }
            }
            throw new IllegalArgumentException("No node at path: " + dottedPath);
        }
        Node parent = find(segments.subList(0, segments.size() - 1))
                .orElseThrow(() -> new IllegalArgumentException("No node at path: " + dottedPath));
        if (!(parent instanceof Container container)) {
            throw new IllegalArgumentException("Path does not go through a block: " + dottedPath);
        }
        container.replaceChild(leaf, replacement);
    }

    /**
     * Dotted path of every block that declares a routing target, mapped to that target. Sections
     * contribute their name as a path segment.
     */
    public Map<String, String> blockTargets() {
        Map<String, String> targets = new LinkedHashMap<>();
        collectTargets(nodes, "", targets);
        return targets;
    }

    private static void collectTargets(List<Node> children, String prefix, Map<String, String> targets) {
        for (Node node : children) {
            if (node instanceof Container container) {
                String path = prefix.isEmpty() ? container.key() : prefix + "." + container.key();
                if (container instanceof Block block && block.target() != null) {
                    targets.put(path, block.target());
                }
                collectTargets(container.children(), path, targets);
            }
        }
    }

    private static Optional<Node> lastWithKey(List<Node> list, String key) {
        for (int i = list.size() - 1; i >= 0; i--) {
            Node node = list.get(i);
            if (node.key().equals(key) && !(node instanceof Comment)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /** Builder for {@link Document}. */
    public static final class Builder {

        private final String name;
        private String frontMatter;
        private String grammarVersion;
        private final Map<String, Value> meta = new LinkedHashMap<>();
        private boolean separator;
        private final List<Node> nodes = new ArrayList<>();
        private final List<String> trailingComments = new ArrayList<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        public Builder frontMatter(String frontMatter) {
            this.frontMatter = frontMatter;
            return this;
        }

        public Builder grammarVersion(String grammarVersion) {
            this.grammarVersion = grammarVersion;
            return this;
        }

        public Builder meta(String key, Value value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder meta(Map<String, Value> entries) {
            this.meta.putAll(entries);
            return this;
        }

        public Builder separator(boolean separator) {
            this.separator = separator;
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        public Builder nodes(List<? extends Node> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        public Builder trailingComments(List<String> comments) {
            this.trailingComments.addAll(comments);
            return this;
        }

        public Document build() {
            return new Document(this);
        }
    }
}
