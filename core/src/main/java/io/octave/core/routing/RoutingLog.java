package io.octave.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered audit trail of every route taken during one validation call. Every resolved route is
 * recorded, including those whose value failed its constraints.
 *
 * <p>Not thread-safe: one log belongs to one validation call.
 */
public final class RoutingLog {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final List<RoutingEntry> entries = new ArrayList<>();

    public void add(RoutingEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /** Entries in the order they were routed (read-only view). */
    public List<RoutingEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean hasRoutes() {
        return !entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    /** Entries whose source path equals {@code sourcePath}. */
    public List<RoutingEntry> entriesFor(String sourcePath) {
        return entries.stream().filter(e -> e.sourcePath().equals(sourcePath)).toList();
    }

    /** JSON array of {@code {source_path, target_name, value_hash, constraint_passed, timestamp}}. */
    public ArrayNode toJson() {
        ArrayNode array = JSON.createArrayNode();
        entries.forEach(e -> array.add(e.toJson()));
        return array;
    }

    @Override
    public String toString() {
        return "RoutingLog" + entries;
    }
}
