package com.authgate.backend.modules.auth.application;

import java.util.UUID;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.OpaqueToken;
import com.authgate.backend.modules.auth.domain.StoredToken;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.TokenType;
import com.authgate.backend.modules.auth.domain.UserAccount;

import org.springframework.stereotype.Component;

/**
 * Both halves of the pair are random strings in {@link OpaqueTokenStore}; the token type
 * column keeps access and refresh tokens from standing in for each other.
 */
@Component
public class OpaqueCredentialStrategy implements CredentialStrategy {

    private final OpaqueTokenStore opaqueTokenStore;

    public OpaqueCredentialStrategy(OpaqueTokenStore opaqueTokenStore) {
        this.opaqueTokenStore = opaqueTokenStore;
    }

    @Override
    public TokenMode mode() {
        return TokenMode.OPAQUE;
    }

    @Override
    public IssuedTokens issue(UserAccount user) {
        OpaqueToken access = opaqueTokenStore.issue(user, TokenType.ACCESS);
        OpaqueToken refresh = opaqueTokenStore.issue(user, TokenType.REFRESH);
        return new IssuedTokens(access.getToken(), refresh.getToken());
    }

    @Override
    public UUID resolveRefreshOwner(String refreshToken) {
        return opaqueTokenStore.validate(refreshToken, TokenType.REFRESH)
                .map(StoredToken::getUserId)
                .orElseThrow(() -> new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN));
    }

    @Override
    public void consumeRefresh(String refreshToken) {
        if (!opaqueTokenStore.consume(refreshToken, TokenType.REFRESH)) {
            throw new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN);
        }
    }

    @Override
    public UUID resolveAccessOwner(String accessToken) {
        return opaqueTokenStore.validate(accessToken, TokenType.ACCESS)
                .map(StoredToken::getUserId)
                .orElseThrow(() -> new ProblemException(ProblemCode.TOKEN_INVALID));
    }

    @Override
    public boolean revoke(String token) {
        return opaqueTokenStore.revoke(token);
    }
}
