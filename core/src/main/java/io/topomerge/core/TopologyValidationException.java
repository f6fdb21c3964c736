package io.topomerge.core;

import java.util.List;

/**
 * Thrown by {@link Topology#validate()} with every inconsistency found,
 * not just the first one.
 */
public final class TopologyValidationException extends Exception {

    private final List<String> violations;

    public TopologyValidationException(List<String> violations) {
        super(violations.size() + " error(s): " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /** Violation messages in the order they were found. */
    public List<String> violations() { return violations; }
}
