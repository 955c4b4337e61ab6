package com.piiguard.infrastructure.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of an edit check.
 *
 * @param allowedAll true when a rule matched and no requested field was rejected
 * @param editable requested fields the principal may change
 * @param rejected requested fields the principal may not change
 */
public record EditDecision(boolean allowedAll, Set<String> editable, Set<String> rejected) {

    public EditDecision {
        editable = Collections.unmodifiableSet(new LinkedHashSet<>(editable));
        rejected = Collections.unmodifiableSet(new LinkedHashSet<>(rejected));
    }

    static EditDecision allowAll(Set<String> requested) {
        return new EditDecision(true, requested, Set.of());
    }

    static EditDecision denied(Set<String> requested) {
        return new EditDecision(false, Set.of(), requested);
    }

    static EditDecision partial(Set<String> requested, Set<String> allowList) {
        Set<String> editable = new LinkedHashSet<>();
        Set<String> rejected = new LinkedHashSet<>();
        for (String field : requested) {
            if (allowList.contains(field)) {
                editable.add(field);
            } else {
                rejected.add(field);
            }
        }
        return new EditDecision(rejected.isEmpty(), editable, rejected);
    }

    /**
     * @throws FieldEditRejectedException if any requested field was rejected
     */
    public EditDecision requireAll() {
        if (!rejected.isEmpty()) {
            throw new FieldEditRejectedException(rejected);
        }
        return this;
    }
}
