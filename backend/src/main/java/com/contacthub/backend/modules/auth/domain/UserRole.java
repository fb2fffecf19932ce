package com.contacthub.backend.modules.auth.domain;

/**
 * The two static roles. {@link #ADMIN} may do everything {@link #USER} may.
 */
public enum UserRole {
    USER,
    ADMIN;

    public boolean permits(UserRole required) {
        return required == null || this == ADMIN || this == required;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
