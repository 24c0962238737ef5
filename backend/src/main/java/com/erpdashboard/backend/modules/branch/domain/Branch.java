package com.erpdashboard.backend.modules.branch.domain;

import com.erpdashboard.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;

/**
 * 조직의 지점. {@code branchCode}가 사용자 고유 ID 카운터의 범위다.
 */
@Entity
@Table(name = "branch")
public class Branch extends AbstractAuditedEntity {

    @Column(name = "branch_id", nullable = false, unique = true, length = 50)
    private String branchId;

    @Column(name = "branch_name", nullable = false, length = 100)
    private String branchName;

    @Column(name = "branch_location", nullable = false, length = 200)
    private String branchLocation;

    @Column(name = "branch_code", nullable = false, unique = true, length = 16)
    private String branchCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private BranchStatus status;

    public String getBranchId() {
        return branchId;
    }

    public void setBranchId(String branchId) {
        this.branchId = branchId;
    }

    public String getBranchName() {
        return branchName;
    }

    public void setBranchName(String branchName) {
        this.branchName = branchName;
    }

    public String getBranchLocation() {
        return branchLocation;
    }

    public void setBranchLocation(String branchLocation) {
        this.branchLocation = branchLocation;
    }

    public String getBranchCode() {
        return branchCode;
    }

    public void setBranchCode(String branchCode) {
        this.branchCode = branchCode;
    }

    public BranchStatus getStatus() {
        return status;
    }

    public void setStatus(BranchStatus status) {
        this.status = status;
    }
}
