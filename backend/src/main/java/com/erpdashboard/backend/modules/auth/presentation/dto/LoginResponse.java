package com.erpdashboard.backend.modules.auth.presentation.dto;

public record LoginResponse(
        boolean success,
        boolean newUser,
        String message,
        String token,
        String tokenType,
        long expiresIn,
        UserProfileResponse user
) {
}
