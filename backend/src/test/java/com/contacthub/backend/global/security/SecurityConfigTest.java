package com.contacthub.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserRole;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

class SecurityConfigTest {

    private final AuthorizationManager<RequestAuthorizationContext> adminOnly = SecurityConfig.requireRole(UserRole.ADMIN);
    private final RequestAuthorizationContext context = new RequestAuthorizationContext(new MockHttpServletRequest());

    @Test
    void adminIsGranted() {
        assertThat(adminOnly.check(() -> authenticated(UserRole.ADMIN), context).isGranted()).isTrue();
    }

    @Test
    void userIsDenied() {
        assertThat(adminOnly.check(() -> authenticated(UserRole.USER), context).isGranted()).isFalse();
    }

    @Test
    void anonymousIsDenied() {
        Authentication anonymous = new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

        assertThat(adminOnly.check(() -> anonymous, context).isGranted()).isFalse();
    }

    private static Authentication authenticated(UserRole role) {
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(UUID.randomUUID(), "alice", "a@x.io", role);
        return new UsernamePasswordAuthenticationToken(principal, null, List.of());
    }
}
