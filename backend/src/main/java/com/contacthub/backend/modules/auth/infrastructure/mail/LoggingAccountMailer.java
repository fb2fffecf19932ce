package com.contacthub.backend.modules.auth.infrastructure.mail;

import com.contacthub.backend.modules.auth.application.AccountMailer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stand-in mailer used until a delivery provider is wired: records that a message would be
 * sent. Links carry bearer tokens, so only their presence is logged.
 */
@Component
public class LoggingAccountMailer implements AccountMailer {

    private static final Logger log = LoggerFactory.getLogger(LoggingAccountMailer.class);

    @Override
    public void sendVerificationEmail(String email, String username, String verificationLink) {
        log.info("Verification mail queued for {} ({}), link length {}", email, username, verificationLink.length());
    }

    @Override
    public void sendPasswordResetEmail(String email, String username, String resetLink) {
        log.info("Password reset mail queued for {} ({}), link length {}", email, username, resetLink.length());
    }
}
