package com.piiguard.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Breadth of records a principal may access.
 */
public enum DataScope {
    ALL("all"),
    DEPARTMENT("department"),
    SELF("self");

    private final String claimValue;

    DataScope(String claimValue) {
        this.claimValue = claimValue;
    }

    public static Optional<DataScope> fromClaim(String value) {
        return Arrays.stream(values())
            .filter(scope -> scope.claimValue.equals(value))
            .findFirst();
    }
}
