package com.erpdashboard.backend.modules.customertype.domain;

public enum CustomerTypeStatus {
    ACTIVE,
    INACTIVE
}
