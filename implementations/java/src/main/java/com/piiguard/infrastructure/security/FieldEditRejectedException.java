package com.piiguard.infrastructure.security;

import java.util.Set;

/**
 * Thrown when submitted fields may not be edited by the principal.
 *
 * <p>Carries the rejected field names so the caller can report them individually.
 */
public class FieldEditRejectedException extends RuntimeException {

    private final Set<String> rejectedFields;

    public FieldEditRejectedException(Set<String> rejectedFields) {
        super("Not permitted to edit fields: " + rejectedFields);
        this.rejectedFields = Set.copyOf(rejectedFields);
    }

    public Set<String> getRejectedFields() {
        return rejectedFields;
    }
}
