package com.erpdashboard.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UserProfileResponse(
        UUID userId,
        String uniqueId,
        String displayName,
        String email,
        String role,
        String branchId,
        String branchName,
        String branchLocation,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
