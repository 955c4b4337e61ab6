package com.piiguard.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles issued by the authentication layer. The claim value is the snake_case name.
 */
public enum Role {
    ADMIN("admin"),
    HR_ADMIN("hr_admin"),
    DEPARTMENT_MANAGER("department_manager"),
    EMPLOYEE("employee");

    private final String claimValue;

    Role(String claimValue) {
        this.claimValue = claimValue;
    }

    /**
     * Case-sensitive lookup by claim value. Unknown values are empty so callers fail closed.
     */
    public static Optional<Role> fromClaim(String value) {
        return Arrays.stream(values())
            .filter(role -> role.claimValue.equals(value))
            .findFirst();
    }
}
