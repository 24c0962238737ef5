package com.erpdashboard.backend.modules.branch.presentation.dto;

import java.util.List;

public record BranchListResponse(boolean success, List<BranchResponse> branches) {
}
