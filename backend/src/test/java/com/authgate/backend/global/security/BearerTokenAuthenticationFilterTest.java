package com.authgate.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.support.TestUsers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class BearerTokenAuthenticationFilterTest {

    @Mock
    private AuthService authService;

    private BearerTokenAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new BearerTokenAuthenticationFilter(authService);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void jwtRouteAuthenticatesWithJwtMode() throws Exception {
        UserAccount user = TestUsers.active("alice@example.com");
        when(authService.resolveActiveUser(TokenMode.JWT, "acc")).thenReturn(user);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/auth/me", "Bearer acc"), new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        AuthenticatedUser principal = (AuthenticatedUser) authentication.getPrincipal();
        assertThat(principal.userId()).isEqualTo(user.getId());
        assertThat(principal.mode()).isEqualTo(TokenMode.JWT);
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void opaqueMeRouteUsesOpaqueMode() throws Exception {
        UserAccount user = TestUsers.active("alice@example.com");
        when(authService.resolveActiveUser(TokenMode.OPAQUE, "opaque")).thenReturn(user);

        filter.doFilter(request("GET", "/auth/me-opaque", "Bearer opaque"), new MockHttpServletResponse(), new MockFilterChain());

        AuthenticatedUser principal = (AuthenticatedUser) SecurityContextHolder.getContext().getAuthentication().getPrincipal();
        assertThat(principal.mode()).isEqualTo(TokenMode.OPAQUE);
        assertThat(principal.user().email()).isEqualTo("alice@example.com");
    }

    @Test
    void rejectedTokenLeavesContextEmptyAndContinuesChain() throws Exception {
        when(authService.resolveActiveUser(TokenMode.JWT, "bad")).thenThrow(new ProblemException(ProblemCode.TOKEN_INVALID));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("DELETE", "/users/me", "Bearer bad"), new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void publicAuthRoutesAreNotInspected() throws Exception {
        filter.doFilter(request("POST", "/auth/login", "Bearer acc"), new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(request("POST", "/auth/refresh-opaque", "Bearer acc"), new MockHttpServletResponse(), new MockFilterChain());

        verify(authService, never()).resolveActiveUser(any(), anyString());
    }

    @Test
    void requestWithoutBearerHeaderIsPassedThrough() throws Exception {
        filter.doFilter(request("GET", "/auth/me", "Basic abc"), new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(authService, never()).resolveActiveUser(any(), anyString());
    }

    private static MockHttpServletRequest request(String method, String path, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setServletPath(path);
        request.addHeader("Authorization", authorization);
        return request;
    }
}
