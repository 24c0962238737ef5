package com.erpdashboard.backend.modules.branch.presentation.dto;

import com.erpdashboard.backend.modules.branch.domain.Branch;

public record BranchResponse(String branchId, String branchName, String branchLocation, String branchCode) {

    public static BranchResponse from(Branch branch) {
        return new BranchResponse(
                branch.getBranchId(),
                branch.getBranchName(),
                branch.getBranchLocation(),
                branch.getBranchCode()
        );
    }
}
