package com.erpdashboard.backend.global.security;

import java.security.Principal;
import java.util.UUID;

/**
 * Caller identity restored from an access token. {@link #getName()} is the ERP unique id, e.g. {@code DH-0001}.
 */
public record JwtAuthenticationPrincipal(UUID userId, String uniqueId, String email, String role, String branchId)
        implements Principal {

    @Override
    public String getName() {
        return uniqueId;
    }
}
