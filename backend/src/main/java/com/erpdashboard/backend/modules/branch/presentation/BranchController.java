package com.erpdashboard.backend.modules.branch.presentation;

import com.erpdashboard.backend.modules.branch.application.BranchService;
import com.erpdashboard.backend.modules.branch.presentation.dto.BranchListResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/branches")
public class BranchController {

    private final BranchService branchService;

    public BranchController(BranchService branchService) {
        this.branchService = branchService;
    }

    @Operation(summary = "List active branches", description = "Branches a new user can sign up under, sorted by name.")
    @ApiResponse(responseCode = "200", description = "Active branches")
    @GetMapping("/active")
    public ResponseEntity<BranchListResponse> activeBranches() {
        return ResponseEntity.ok(new BranchListResponse(true, branchService.listActiveBranches()));
    }
}
