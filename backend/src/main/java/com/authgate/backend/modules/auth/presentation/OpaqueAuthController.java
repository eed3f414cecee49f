package com.authgate.backend.modules.auth.presentation;

import com.authgate.backend.global.config.OpenApiConfig;
import com.authgate.backend.global.security.SecurityUtils;
import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.presentation.dto.LoginRequest;
import com.authgate.backend.modules.auth.presentation.dto.OpaqueTokenRequest;
import com.authgate.backend.modules.auth.presentation.dto.OpaqueTokenValidationResponse;
import com.authgate.backend.modules.auth.presentation.dto.TokenResponse;
import com.authgate.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class OpaqueAuthController {

    private final AuthService authService;

    public OpaqueAuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Log in and receive an opaque access/refresh pair")
    @PostMapping("/login-opaque")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(TokenMode.OPAQUE, request));
    }

    @Operation(summary = "Rotate an opaque refresh token")
    @ApiResponse(responseCode = "401", description = "Refresh token invalid, revoked, expired or already rotated")
    @PostMapping("/refresh-opaque")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody OpaqueTokenRequest request) {
        return ResponseEntity.ok(authService.refresh(TokenMode.OPAQUE, request.token()));
    }

    @Operation(summary = "Revoke an opaque token")
    @PostMapping("/logout-opaque")
    public ResponseEntity<Void> logout(@Valid @RequestBody OpaqueTokenRequest request) {
        authService.logout(TokenMode.OPAQUE, request.token());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Inspect an opaque token of either type")
    @ApiResponse(responseCode = "401", description = "Token unknown, revoked or expired")
    @PostMapping("/validate-opaque")
    public ResponseEntity<OpaqueTokenValidationResponse> validate(@Valid @RequestBody OpaqueTokenRequest request) {
        return ResponseEntity.ok(authService.validateOpaque(request.token()));
    }

    @Operation(summary = "Current user from an opaque access token",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @GetMapping("/me-opaque")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(SecurityUtils.getCurrentPrincipal().user());
    }
}
