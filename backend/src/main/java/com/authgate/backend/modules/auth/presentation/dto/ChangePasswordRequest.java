package com.authgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "current_password is required") String currentPassword,
        @NotBlank(message = "new_password is required") @Size(max = 72) String newPassword
) {
}
