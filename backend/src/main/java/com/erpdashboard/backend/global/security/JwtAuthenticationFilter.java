package com.erpdashboard.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.erpdashboard.backend.modules.auth.application.JwtTokenService;
import com.erpdashboard.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.erpdashboard.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Bearer 액세스 토큰으로 호출자를 복원한다. 토큰이 없거나 유효하지 않으면 익명으로 두고,
 * 보호된 엔드포인트는 {@link ProblemSecurityHandler}를 통해 401을 응답한다.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String DEFAULT_ROLE = "USER";

    private final JwtTokenService jwtTokenService;
    private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        resolveBearerToken(request).ifPresent(token -> authenticate(token, request));
        filterChain.doFilter(request, response);
    }

    private void authenticate(String token, HttpServletRequest request) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseAccessToken(token);
        } catch (InvalidTokenException ex) {
            log.debug("Ignoring invalid access token on {}: {}", request.getRequestURI(), ex.getMessage());
            SecurityContextHolder.clearContext();
            return;
        }

        String role = parsed.role() != null ? parsed.role() : DEFAULT_ROLE;
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                parsed.userId(),
                parsed.uniqueId(),
                parsed.email(),
                role,
                parsed.branchId()
        );
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal, token, List.of(new SimpleGrantedAuthority("ROLE_" + role)));
        authentication.setDetails(detailsSource.buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    private static Optional<String> resolveBearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        String path = request.getServletPath();
        return path.startsWith("/api/auth/") || path.equals("/health") || path.equals("/healthz")
                || path.equals("/readyz");
    }
}
