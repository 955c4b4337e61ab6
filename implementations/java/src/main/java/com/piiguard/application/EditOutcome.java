package com.piiguard.application;

import com.piiguard.domain.model.ProtectedRecord;

import java.util.Set;

/**
 * Result of applying an edit.
 *
 * @param record the updated record to persist
 * @param applied fields that were changed
 * @param rejected fields that were not changed, by name
 */
public record EditOutcome(ProtectedRecord record, Set<String> applied, Set<String> rejected) {

    public EditOutcome {
        applied = Set.copyOf(applied);
        rejected = Set.copyOf(rejected);
    }

    public boolean isPartiallyRejected() {
        return !rejected.isEmpty();
    }
}
