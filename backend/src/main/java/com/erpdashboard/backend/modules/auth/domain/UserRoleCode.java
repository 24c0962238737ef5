package com.erpdashboard.backend.modules.auth.domain;

public enum UserRoleCode {
    USER,
    MANAGER,
    ADMIN
}
