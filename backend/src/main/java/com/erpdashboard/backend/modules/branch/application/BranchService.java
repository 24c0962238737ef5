package com.erpdashboard.backend.modules.branch.application;

import java.util.List;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.branch.domain.Branch;
import com.erpdashboard.backend.modules.branch.domain.BranchStatus;
import com.erpdashboard.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.erpdashboard.backend.modules.branch.presentation.dto.BranchResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class BranchService {

    private final BranchRepository branchRepository;

    public BranchService(BranchRepository branchRepository) {
        this.branchRepository = branchRepository;
    }

    public List<BranchResponse> listActiveBranches() {
        return branchRepository.findByStatusOrderByBranchNameAsc(BranchStatus.ACTIVE).stream()
                .map(BranchResponse::from)
                .toList();
    }

    /**
     * slug로 활성 지점을 찾는다. 없거나 비활성인 지점은 거부한다.
     */
    public Branch requireActiveBranch(String branchId) {
        if (branchId == null || branchId.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "BRANCH_NOT_FOUND", "Branch id is required");
        }
        return branchRepository.findByBranchIdAndStatus(branchId.trim(), BranchStatus.ACTIVE)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "BRANCH_NOT_FOUND",
                        "Invalid branch ID: " + branchId));
    }
}
