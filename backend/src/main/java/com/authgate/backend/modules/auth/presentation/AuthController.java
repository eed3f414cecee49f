package com.authgate.backend.modules.auth.presentation;

import com.authgate.backend.global.config.OpenApiConfig;
import com.authgate.backend.global.security.AuthenticatedUser;
import com.authgate.backend.global.security.SecurityUtils;
import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.presentation.dto.LoginRequest;
import com.authgate.backend.modules.auth.presentation.dto.RefreshRequest;
import com.authgate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.authgate.backend.modules.auth.presentation.dto.TokenResponse;
import com.authgate.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration and the JWT-mode token lifecycle.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register an account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Invalid body or password policy violation")
    })
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(summary = "Log in and receive a JWT access/refresh pair")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tokens issued"),
            @ApiResponse(responseCode = "401", description = "Invalid email or password"),
            @ApiResponse(responseCode = "403", description = "Account inactive")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(TokenMode.JWT, request));
    }

    @Operation(summary = "Rotate a JWT refresh token", description = "The presented refresh token is revoked.")
    @ApiResponse(responseCode = "401", description = "Refresh token invalid, revoked, expired or already rotated")
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(TokenMode.JWT, request.refreshToken()));
    }

    @Operation(summary = "Revoke a JWT refresh token")
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody RefreshRequest request) {
        authService.logout(TokenMode.JWT, request.refreshToken());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Current user from a JWT access token",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME))
    @GetMapping("/me")
    public ResponseEntity<UserResponse> me() {
        AuthenticatedUser principal = SecurityUtils.getCurrentPrincipal();
        return ResponseEntity.ok(principal.user());
    }
}
