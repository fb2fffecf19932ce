package com.contacthub.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password hashing on top of the configured {@link PasswordEncoder} (BCrypt).
 * Verification never throws: a malformed stored hash simply does not match.
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
