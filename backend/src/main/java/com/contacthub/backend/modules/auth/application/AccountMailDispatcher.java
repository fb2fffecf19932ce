package com.contacthub.backend.modules.auth.application;

import com.contacthub.backend.global.config.AsyncConfig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Hands account mail to the {@link AccountMailer} on the mail executor so the request thread
 * never waits for delivery. Failures end here, logged.
 */
@Component
public class AccountMailDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AccountMailDispatcher.class);

    private final AccountMailer accountMailer;
    private final String publicBaseUrl;

    public AccountMailDispatcher(AccountMailer accountMailer, @Value("${app.public-base-url}") String publicBaseUrl) {
        this.accountMailer = accountMailer;
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    public void sendVerification(String email, String username, String token) {
        String link = publicBaseUrl + "/auth/confirmed_email/" + token;
        try {
            accountMailer.sendVerificationEmail(email, username, link);
        } catch (RuntimeException ex) {
            log.error("Verification mail to {} failed", email, ex);
        }
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    public void sendPasswordReset(String email, String username, String token) {
        String link = publicBaseUrl + "/auth/reset-password/" + token;
        try {
            accountMailer.sendPasswordResetEmail(email, username, link);
        } catch (RuntimeException ex) {
            log.error("Password reset mail to {} failed", email, ex);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
