package com.contacthub.backend.modules.auth.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class UserRoleTest {

    @Test
    void adminPermitsEverything() {
        assertThat(UserRole.ADMIN.permits(UserRole.ADMIN)).isTrue();
        assertThat(UserRole.ADMIN.permits(UserRole.USER)).isTrue();
    }

    @Test
    void userPermitsOnlyUser() {
        assertThat(UserRole.USER.permits(UserRole.USER)).isTrue();
        assertThat(UserRole.USER.permits(UserRole.ADMIN)).isFalse();
    }

    @Test
    void authorityUsesSpringRolePrefix() {
        assertThat(UserRole.ADMIN.authority()).isEqualTo("ROLE_ADMIN");
    }
}
