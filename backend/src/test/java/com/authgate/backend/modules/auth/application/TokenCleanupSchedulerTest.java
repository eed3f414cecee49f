package com.authgate.backend.modules.auth.application;

import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TokenCleanupSchedulerTest {

    @Mock
    private RefreshTokenStore refreshTokenStore;

    @Mock
    private OpaqueTokenStore opaqueTokenStore;

    @Test
    void failingStoreDoesNotStopTheOthers() {
        lenient().when(refreshTokenStore.name()).thenReturn("refresh_token");
        lenient().when(opaqueTokenStore.name()).thenReturn("opaque_token");
        when(refreshTokenStore.cleanupExpired()).thenThrow(new DataAccessResourceFailureException("connection lost"));
        when(opaqueTokenStore.cleanupExpired()).thenReturn(3);
        List<TokenStore<?>> stores = List.of(refreshTokenStore, opaqueTokenStore);

        new TokenCleanupScheduler(stores).purgeExpiredTokens();

        verify(refreshTokenStore).cleanupExpired();
        verify(opaqueTokenStore).cleanupExpired();
    }
}
