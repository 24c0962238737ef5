package com.erpdashboard.backend.modules.branch.domain;

/**
 * {@code ACTIVE} 지점만 목록에 노출되고 신규 사용자를 받는다.
 */
public enum BranchStatus {
    ACTIVE,
    INACTIVE
}
