package com.contacthub.backend.modules.auth.application;

/**
 * Outbound account mail. Delivery is not guaranteed and is never retried by the caller.
 */
public interface AccountMailer {

    void sendVerificationEmail(String email, String username, String verificationLink);

    void sendPasswordResetEmail(String email, String username, String resetLink);
}
