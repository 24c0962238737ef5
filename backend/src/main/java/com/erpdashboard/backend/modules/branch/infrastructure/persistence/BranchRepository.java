package com.erpdashboard.backend.modules.branch.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.erpdashboard.backend.modules.branch.domain.Branch;
import com.erpdashboard.backend.modules.branch.domain.BranchStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BranchRepository extends JpaRepository<Branch, UUID> {

    Optional<Branch> findByBranchIdAndStatus(String branchId, BranchStatus status);

    List<Branch> findByStatusOrderByBranchNameAsc(BranchStatus status);

    boolean existsByBranchId(String branchId);

    @Modifying
    @Query(value = """
            INSERT INTO branch (id, branch_id, branch_name, branch_location, branch_code, status, created_at, updated_at)
            VALUES (gen_random_uuid(), :branchId, :branchName, :branchLocation, :branchCode, 'ACTIVE',
                    CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("branchId") String branchId,
            @Param("branchName") String branchName,
            @Param("branchLocation") String branchLocation,
            @Param("branchCode") String branchCode
    );
}
