package com.contacthub.backend.support;

import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;

import org.springframework.test.util.ReflectionTestUtils;

public final class TestUsers {

    private TestUsers() {
    }

    public static UserAccount user(String username, String email, String passwordHash, boolean verified) {
        UserAccount user = new UserAccount();
        ReflectionTestUtils.setField(user, "id", UUID.nameUUIDFromBytes(username.getBytes()));
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordHash);
        user.setVerified(verified);
        user.setRole(UserRole.USER);
        return user;
    }
}
