package io.octave.core.routing;

import io.octave.core.model.Value;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a field value to one or more targets and records each route in a {@link RoutingLog}.
 * Routing is audit only: nothing is sent anywhere.
 *
 * <p>A target spec may list alternatives separated by {@code ∨}; every alternative is validated
 * before any entry is written, so a spec with one bad name records nothing.
 */
public class TargetRouter {

    private static final Logger LOG = LoggerFactory.getLogger(TargetRouter.class);

    private final TargetRegistry registry;
    private final Clock clock;

    public TargetRouter(TargetRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TargetRouter(TargetRegistry registry) {
        this(registry, Clock.systemUTC());
    }

    /**
     * Routes a value.
     *
     * @param sourcePath       dotted field path
     * @param targetSpec       target name(s), {@code §} optional, alternatives joined by {@code ∨}
     * @param value            the routed value
     * @param constraintPassed whether the field passed its constraints
     * @param log              receives one entry per target
     * @return the entries written
     * @throws io.octave.core.error.InvalidTargetException if any target is unknown to the registry
     */
    public List<RoutingEntry> route(
            String sourcePath, String targetSpec, Value value, boolean constraintPassed, RoutingLog log) {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        Objects.requireNonNull(targetSpec, "targetSpec must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(log, "log must not be null");

        List<String> targets = targets(targetSpec);
        targets.forEach(registry::require);

        String hash = ValueHasher.hash(value);
        String timestamp = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.MICROS));
        List<RoutingEntry> written = new ArrayList<>(targets.size());
        for (String target : targets) {
            RoutingEntry entry = new RoutingEntry(sourcePath, target, hash, constraintPassed, timestamp);
            log.add(entry);
            written.add(entry);
        }
        LOG.debug("Routed {} to {} (constraints {})", sourcePath, targets, constraintPassed ? "passed" : "failed");
        return written;
    }

    /** Splits a spec on {@code ∨} and strips {@code §} from each name. */
    static List<String> targets(String targetSpec) {
        List<String> names = new ArrayList<>();
        for (String part : targetSpec.split("∨")) {
            String name = part.strip();
            if (name.startsWith("§")) {
                name = name.substring(1);
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("target spec names no target: '" + targetSpec + "'");
        }
        return names;
    }
}
