package com.authgate.backend.modules.auth.presentation.dto;

import java.util.UUID;

import com.authgate.backend.modules.auth.domain.UserAccount;

/**
 * Public projection of an account. The password digest is never part of it.
 */
public record UserResponse(UUID id, String name, String email, String phone) {

    public static UserResponse from(UserAccount user) {
        return new UserResponse(user.getId(), user.getName(), user.getEmail(), user.getPhone());
    }
}
