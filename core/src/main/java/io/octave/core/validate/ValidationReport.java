package io.octave.core.validate;

import io.octave.core.routing.RoutingLog;
import java.util.List;
import java.util.Objects;

/**
 * Result of one validation call: every error found, plus the audit log of routes taken.
 *
 * @param errors     all validation errors in document order
 * @param routingLog routes recorded during the call, including those of invalid values
 */
public record ValidationReport(List<ValidationError> errors, RoutingLog routingLog) {

    public ValidationReport {
        errors = List.copyOf(errors);
        Objects.requireNonNull(routingLog, "routingLog must not be null");
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /** Errors with the given code. */
    public List<ValidationError> errors(String code) {
        return errors.stream().filter(e -> e.code().equals(code)).toList();
    }
}
