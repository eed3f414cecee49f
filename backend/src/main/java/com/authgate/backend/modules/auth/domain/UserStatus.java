package com.authgate.backend.modules.auth.domain;

/**
 * Accounts are created {@link #ACTIVE}. No endpoint deactivates an account; {@link #INACTIVE} is
 * set by operators directly in the database, and such accounts can no longer log in, refresh or
 * authenticate.
 */
public enum UserStatus {
    ACTIVE,
    INACTIVE
}
