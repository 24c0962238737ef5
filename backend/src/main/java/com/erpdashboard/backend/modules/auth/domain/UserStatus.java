package com.erpdashboard.backend.modules.auth.domain;

public enum UserStatus {
    ACTIVE,
    DISABLED;

    public boolean canLogin() {
        return this == ACTIVE;
    }
}
