package com.authgate.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.application.AuthService;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.presentation.dto.UserResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves {@code Authorization: Bearer} credentials. {@code /auth/me-opaque} expects an opaque
 * access token, every other protected route a JWT access token. A rejected token leaves the
 * context empty and {@link RestAuthenticationEntryPoint} answers the request.
 */
@Component
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    static final String OPAQUE_ME_PATH = "/auth/me-opaque";
    static final String JWT_ME_PATH = "/auth/me";

    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<SimpleGrantedAuthority> USER_AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final AuthService authService;

    public BearerTokenAuthenticationFilter(AuthService authService) {
        this.authService = authService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            TokenMode mode = modeFor(request.getServletPath());
            try {
                UserAccount user = authService.resolveActiveUser(mode, token);
                AuthenticatedUser principal = new AuthenticatedUser(
                        user.getId(),
                        user.getEmail(),
                        mode,
                        UserResponse.from(user)
                );
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, USER_AUTHORITIES);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                log.debug("Bearer token rejected on {} ({})", request.getServletPath(), mode);
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        if (JWT_ME_PATH.equals(path) || OPAQUE_ME_PATH.equals(path)) {
            return false;
        }
        return path.startsWith("/auth/") || path.startsWith("/health") || path.startsWith("/readyz")
                || path.startsWith("/actuator") || path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui");
    }

    static TokenMode modeFor(String path) {
        return OPAQUE_ME_PATH.equals(path) ? TokenMode.OPAQUE : TokenMode.JWT;
    }
}
