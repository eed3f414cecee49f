package com.authgate.backend.modules.auth.application;

import java.util.UUID;

import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.UserAccount;

/**
 * Issues and checks credentials for one {@link TokenMode}. {@link AuthService} drives the
 * login/refresh/logout state machine and leaves every mode-specific decision to this type.
 */
public interface CredentialStrategy {

    TokenMode mode();

    /**
     * Mints an access + refresh pair and persists whatever the mode needs to redeem the refresh
     * side later.
     */
    IssuedTokens issue(UserAccount user);

    /**
     * Checks a presented refresh token without consuming it.
     *
     * @return id of the owning user
     * @throws com.authgate.backend.global.error.ProblemException INVALID_REFRESH_TOKEN
     */
    UUID resolveRefreshOwner(String refreshToken);

    /**
     * Revokes the refresh token as part of rotation. Fails when another request consumed it first.
     *
     * @throws com.authgate.backend.global.error.ProblemException INVALID_REFRESH_TOKEN
     */
    void consumeRefresh(String refreshToken);

    /**
     * @return id of the user the access token was issued to
     * @throws com.authgate.backend.global.error.ProblemException TOKEN_INVALID
     */
    UUID resolveAccessOwner(String accessToken);

    /**
     * @return whether the mode's ledger knew the token
     */
    boolean revoke(String token);
}
