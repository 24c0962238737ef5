package com.erpdashboard.backend.modules.auth.presentation;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.global.security.JwtAuthenticationPrincipal;
import com.erpdashboard.backend.modules.auth.application.AuthService;
import com.erpdashboard.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profile")
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Current user", description = "Profile of the user the Bearer token was issued to.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile found"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid token"),
            @ApiResponse(responseCode = "404", description = "Token refers to a deleted user")
    })
    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        if (principal == null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "unauthorized");
        }
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}
