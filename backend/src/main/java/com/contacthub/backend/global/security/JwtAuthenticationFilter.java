package com.contacthub.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.contacthub.backend.global.error.ProblemResponse;
import com.contacthub.backend.modules.auth.application.InvalidTokenException;
import com.contacthub.backend.modules.auth.application.JwtTokenService;
import com.contacthub.backend.modules.auth.application.JwtTokenService.ValidatedToken;
import com.contacthub.backend.modules.auth.domain.TokenPurpose;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;
import com.contacthub.backend.modules.user.application.CurrentUserService;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Authenticates {@code Bearer} ACCESS tokens. The user state comes from the session cache
 * with a repository fallback, and tokens issued before the last credential change are
 * rejected. When the user store cannot be reached the request is answered with 503.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final CurrentUserService currentUserService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            CurrentUserService currentUserService,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            ObjectMapper objectMapper
    ) {
        this.jwtTokenService = jwtTokenService;
        this.currentUserService = currentUserService;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        ValidatedToken validated;
        try {
            validated = jwtTokenService.validate(token, TokenPurpose.ACCESS);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected access token: {}", ex.getReason());
            reject(request, response, "INVALID_ACCESS_TOKEN");
            return;
        }

        Optional<CachedUserProjection> user;
        try {
            user = currentUserService.resolve(validated.subject());
        } catch (DataAccessException | CannotCreateTransactionException ex) {
            log.error("User store unavailable while authenticating {}: {}", validated.subject(), ex.getMessage());
            dependencyUnavailable(request, response);
            return;
        }
        if (user.isEmpty()) {
            reject(request, response, "INVALID_ACCESS_TOKEN");
            return;
        }
        CachedUserProjection projection = user.get();
        if (validated.issuedBefore(projection.tokensValidAfter())) {
            reject(request, response, "ACCESS_TOKEN_REVOKED");
            return;
        }

        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                projection.id(),
                projection.username(),
                projection.email(),
                projection.role()
        );
        List<SimpleGrantedAuthority> authorities = List.of(new SimpleGrantedAuthority(projection.role().authority()));
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        if (path.equals("/auth/logout")) {
            return false;
        }
        return path.startsWith("/auth/") || path.startsWith("/health") || path.startsWith("/actuator/health");
    }

    private void dependencyUnavailable(HttpServletRequest request, HttpServletResponse response) throws IOException {
        SecurityContextHolder.clearContext();
        response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(
                ProblemResponse.dependencyUnavailable(request.getRequestURI())));
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String code) throws IOException {
        SecurityContextHolder.clearContext();
        authenticationEntryPoint.commence(request, response, new BadCredentialsException(code));
    }
}
