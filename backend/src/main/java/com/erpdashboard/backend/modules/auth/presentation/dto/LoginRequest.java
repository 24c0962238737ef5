package com.erpdashboard.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code displayName}, {@code branchId}는 이메일/uid 조합이 처음 보는 것이어서 계정을 새로 만들 때만 필요하다.
 */
public record LoginRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "firebaseUid is required") @Size(max = 128) String firebaseUid,
        @Size(max = 100) String displayName,
        @Size(max = 50) String branchId
) {
}
