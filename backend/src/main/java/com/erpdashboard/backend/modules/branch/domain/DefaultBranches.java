package com.erpdashboard.backend.modules.branch.domain;

import java.util.List;

/**
 * 설치 시 기본으로 생성되는 지점 목록.
 */
public final class DefaultBranches {

    public static final List<BranchSeed> ALL = List.of(
            new BranchSeed("main", "Main Office", "Dhaka, Bangladesh", "DH"),
            new BranchSeed("bogra", "Bogra Branch", "Bogra, Bangladesh", "BOG"),
            new BranchSeed("dupchanchia", "Dupchanchia Branch", "Dupchanchia, Bangladesh", "DUP"),
            new BranchSeed("chittagong", "Chittagong Branch", "Chittagong, Bangladesh", "CTG"),
            new BranchSeed("sylhet", "Sylhet Branch", "Sylhet, Bangladesh", "SYL"),
            new BranchSeed("rajshahi", "Rajshahi Branch", "Rajshahi, Bangladesh", "RAJ"),
            new BranchSeed("khulna", "Khulna Branch", "Khulna, Bangladesh", "KHU"),
            new BranchSeed("barisal", "Barisal Branch", "Barisal, Bangladesh", "BAR"),
            new BranchSeed("rangpur", "Rangpur Branch", "Rangpur, Bangladesh", "RAN"),
            new BranchSeed("mymensingh", "Mymensingh Branch", "Mymensingh, Bangladesh", "MYM")
    );

    private DefaultBranches() {
    }

    public record BranchSeed(String branchId, String branchName, String branchLocation, String branchCode) {
    }
}
