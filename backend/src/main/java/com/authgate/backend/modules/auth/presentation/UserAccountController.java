package com.authgate.backend.modules.auth.presentation;

import com.authgate.backend.global.config.OpenApiConfig;
import com.authgate.backend.global.security.SecurityUtils;
import com.authgate.backend.modules.auth.application.UserAccountService;
import com.authgate.backend.modules.auth.presentation.dto.ChangePasswordRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/me")
@SecurityRequirement(name = OpenApiConfig.BEARER_SCHEME)
public class UserAccountController {

    private final UserAccountService userAccountService;

    public UserAccountController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @Operation(summary = "Change password", description = "Revokes every refresh and opaque token of the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Current password wrong or token invalid"),
            @ApiResponse(responseCode = "422", description = "New password violates the policy")
    })
    @PutMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        userAccountService.changePassword(
                SecurityUtils.getCurrentUserId(),
                request.currentPassword(),
                request.newPassword()
        );
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Delete the account and all of its tokens")
    @DeleteMapping
    public ResponseEntity<Void> deleteAccount() {
        userAccountService.deleteAccount(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
