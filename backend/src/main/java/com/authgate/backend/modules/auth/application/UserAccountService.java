package com.authgate.backend.modules.auth.application;

import java.util.List;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserAccountService {

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final List<TokenStore<?>> tokenStores;

    public UserAccountService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            PasswordPolicy passwordPolicy,
            List<TokenStore<?>> tokenStores
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.passwordPolicy = passwordPolicy;
        this.tokenStores = List.copyOf(tokenStores);
    }

    /**
     * Replaces the password digest and revokes every outstanding token of the user in both
     * ledgers. Stateless JWT access tokens stay valid until they expire.
     */
    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemCode.USER_NOT_FOUND));
        if (!passwordHasher.verify(currentPassword, user.getPasswordHash())) {
            log.warn("Password change rejected for user {}: current password mismatch", userId);
            throw new ProblemException(ProblemCode.INVALID_CREDENTIALS);
        }
        passwordPolicy.check(newPassword);

        user.setPasswordHash(passwordHasher.hash(newPassword));
        userAccountRepository.saveAndFlush(user);

        int revoked = 0;
        for (TokenStore<?> store : tokenStores) {
            revoked += store.revokeAllForUser(userId, null);
        }
        log.info("Password changed for user {}; revoked {} tokens", userId, revoked);
    }

    /**
     * Token rows go with the account through the {@code ON DELETE CASCADE} foreign keys.
     */
    public void deleteAccount(UUID userId) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ProblemCode.USER_NOT_FOUND));
        userAccountRepository.delete(user);
        userAccountRepository.flush();
        log.info("Deleted user {}", userId);
    }
}
