package com.authgate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.authgate.backend.support.TestAuthProperties;
import com.authgate.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserAccountServiceTest {

    @Mock
    private UserAccountRepository userAccountRepository;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private RefreshTokenStore refreshTokenStore;

    @Mock
    private OpaqueTokenStore opaqueTokenStore;

    private UserAccountService service;
    private UserAccount user;

    @BeforeEach
    void setUp() {
        List<TokenStore<?>> stores = List.of(refreshTokenStore, opaqueTokenStore);
        service = new UserAccountService(
                userAccountRepository,
                passwordHasher,
                new PasswordPolicy(TestAuthProperties.defaults()),
                stores
        );
        user = TestUsers.active("alice@example.com");
    }

    @Test
    void changePasswordStoresNewDigestAndRevokesEveryToken() {
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(passwordHasher.verify("old-pw", "$2a$04$digest")).thenReturn(true);
        when(passwordHasher.hash("new-pw")).thenReturn("new-digest");

        service.changePassword(user.getId(), "old-pw", "new-pw");

        assertThat(user.getPasswordHash()).isEqualTo("new-digest");
        verify(userAccountRepository).saveAndFlush(user);
        verify(refreshTokenStore).revokeAllForUser(user.getId(), null);
        verify(opaqueTokenStore).revokeAllForUser(user.getId(), null);
    }

    @Test
    void changePasswordRejectsWrongCurrentPassword() {
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(passwordHasher.verify("bad", "$2a$04$digest")).thenReturn(false);

        assertThatThrownBy(() -> service.changePassword(user.getId(), "bad", "new-pw"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getProblemCode())
                .isEqualTo(ProblemCode.INVALID_CREDENTIALS);
        verify(refreshTokenStore, never()).revokeAllForUser(any(), any());
    }

    @Test
    void changePasswordEnforcesPolicyOnNewPassword() {
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(passwordHasher.verify("old-pw", "$2a$04$digest")).thenReturn(true);

        assertThatThrownBy(() -> service.changePassword(user.getId(), "old-pw", "abc"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getProblemCode())
                .isEqualTo(ProblemCode.PASSWORD_POLICY_VIOLATION);
        verify(userAccountRepository, never()).saveAndFlush(any());
    }

    @Test
    void changePasswordRejectsNewPasswordLongerThan72Bytes() {
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));
        when(passwordHasher.verify("old-pw", "$2a$04$digest")).thenReturn(true);

        assertThatThrownBy(() -> service.changePassword(user.getId(), "old-pw", "\u00e9".repeat(37)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getProblemCode())
                .isEqualTo(ProblemCode.PASSWORD_POLICY_VIOLATION);
        verify(passwordHasher, never()).hash(anyString());
    }

    @Test
    void deleteAccountRemovesUser() {
        when(userAccountRepository.findById(user.getId())).thenReturn(Optional.of(user));

        service.deleteAccount(user.getId());

        verify(userAccountRepository).delete(user);
    }

    @Test
    void deleteUnknownAccountIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(userAccountRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteAccount(missing))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getProblemCode())
                .isEqualTo(ProblemCode.USER_NOT_FOUND);
    }
}
