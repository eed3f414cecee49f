package com.authgate.backend.modules.auth.application;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.OpaqueToken;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.domain.UserStatus;
import com.authgate.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.authgate.backend.modules.auth.presentation.dto.LoginRequest;
import com.authgate.backend.modules.auth.presentation.dto.OpaqueTokenValidationResponse;
import com.authgate.backend.modules.auth.presentation.dto.RegisterRequest;
import com.authgate.backend.modules.auth.presentation.dto.TokenResponse;
import com.authgate.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Register, login, refresh, logout and current-user flows for both token modes. Any rejection
 * rolls back the surrounding transaction, so a failed refresh never leaves a half-rotated pair.
 */
@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final OpaqueTokenStore opaqueTokenStore;
    private final Map<TokenMode, CredentialStrategy> strategies;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            OpaqueTokenStore opaqueTokenStore,
            List<CredentialStrategy> credentialStrategies
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.opaqueTokenStore = opaqueTokenStore;
        this.strategies = new EnumMap<>(TokenMode.class);
        for (CredentialStrategy strategy : credentialStrategies) {
            CredentialStrategy previous = strategies.put(strategy.mode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate credential strategy for mode " + strategy.mode());
            }
        }
        for (TokenMode mode : TokenMode.values()) {
            if (!strategies.containsKey(mode)) {
                throw new IllegalStateException("No credential strategy registered for mode " + mode);
            }
        }
    }

    public UserResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userAccountRepository.existsByEmailIgnoreCase(email)) {
            log.warn("Registration rejected: email already registered");
            throw new ProblemException(ProblemCode.USER_ALREADY_EXISTS);
        }
        passwordPolicy.check(request.password());

        UserAccount user = new UserAccount();
        user.setName(request.name().trim());
        user.setEmail(email);
        user.setPhone(blankToNull(request.phone()));
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setStatus(UserStatus.ACTIVE);

        UserAccount saved;
        try {
            saved = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration of the same email
            log.warn("Registration rejected: unique index violation on email");
            throw new ProblemException(ProblemCode.USER_ALREADY_EXISTS, null, ex);
        }
        log.info("Registered user {}", saved.getId());
        return UserResponse.from(saved);
    }

    public TokenResponse login(TokenMode mode, LoginRequest request) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .filter(candidate -> passwordHasher.verify(request.password(), candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Login rejected ({}): invalid credentials", mode);
                    return new ProblemException(ProblemCode.INVALID_CREDENTIALS);
                });
        if (!user.isActive()) {
            log.warn("Login rejected ({}): user {} is inactive", mode, user.getId());
            throw new ProblemException(ProblemCode.USER_INACTIVE);
        }

        IssuedTokens tokens = strategy(mode).issue(user);
        log.info("User {} logged in ({})", user.getId(), mode);
        return TokenResponse.bearer(tokens.accessToken(), tokens.refreshToken());
    }

    public TokenResponse refresh(TokenMode mode, String refreshToken) {
        CredentialStrategy strategy = strategy(mode);
        UUID userId = strategy.resolveRefreshOwner(refreshToken);
        UserAccount user = userAccountRepository.findById(userId)
                .filter(UserAccount::isActive)
                .orElseThrow(() -> {
                    log.warn("Refresh rejected ({}): owner {} missing or inactive", mode, userId);
                    return new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN);
                });

        strategy.consumeRefresh(refreshToken);
        IssuedTokens tokens = strategy.issue(user);
        log.info("Rotated refresh token for user {} ({})", user.getId(), mode);
        return TokenResponse.bearer(tokens.accessToken(), tokens.refreshToken());
    }

    /**
     * Unknown tokens are not an error; logout is idempotent from the caller's side.
     */
    public void logout(TokenMode mode, String token) {
        boolean known = strategy(mode).revoke(token);
        if (known) {
            log.info("Token revoked on logout ({})", mode);
        } else {
            log.debug("Logout for unknown token ({})", mode);
        }
    }

    public UserResponse currentUser(TokenMode mode, String accessToken) {
        return UserResponse.from(resolveActiveUser(mode, accessToken));
    }

    /**
     * Resolves the owner of an access token and insists that the account still exists and is
     * active.
     */
    public UserAccount resolveActiveUser(TokenMode mode, String accessToken) {
        UUID userId = strategy(mode).resolveAccessOwner(accessToken);
        return userAccountRepository.findById(userId)
                .filter(UserAccount::isActive)
                .orElseThrow(() -> new ProblemException(ProblemCode.TOKEN_INVALID));
    }

    public OpaqueTokenValidationResponse validateOpaque(String token) {
        OpaqueToken record = opaqueTokenStore.validate(token, null)
                .orElseThrow(() -> new ProblemException(ProblemCode.TOKEN_INVALID));
        UserAccount user = userAccountRepository.findById(record.getUserId())
                .filter(UserAccount::isActive)
                .orElseThrow(() -> new ProblemException(ProblemCode.TOKEN_INVALID));
        return new OpaqueTokenValidationResponse(
                true,
                user.getId(),
                user.getEmail(),
                record.getTokenType().claimValue(),
                record.getExpiresAt()
        );
    }

    private CredentialStrategy strategy(TokenMode mode) {
        CredentialStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalArgumentException("Unsupported token mode: " + mode);
        }
        return strategy;
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
