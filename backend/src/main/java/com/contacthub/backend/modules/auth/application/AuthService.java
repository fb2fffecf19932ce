package com.contacthub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.TokenPurpose;
import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;
import com.contacthub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.contacthub.backend.modules.auth.presentation.dto.LoginRequest;
import com.contacthub.backend.modules.auth.presentation.dto.MessageResponse;
import com.contacthub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.contacthub.backend.modules.auth.presentation.dto.TokenResponse;
import com.contacthub.backend.modules.auth.presentation.dto.UserResponse;
import com.contacthub.backend.modules.session.application.SessionProjectionService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String EMAIL_TAKEN = "A user with this email already exists.";
    static final String USERNAME_TAKEN = "A user with this username already exists.";
    static final String ALREADY_VERIFIED = "Your email is already verified.";
    static final String EMAIL_VERIFIED = "Email successfully verified.";
    static final String VERIFICATION_SENT = "Check your email for verification instructions.";
    static final String RESET_SENT = "Check your email for password reset instructions";
    static final String PASSWORD_CHANGED = "Password successfully changed";

    private final UserAccountRepository userAccountRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final SessionProjectionService sessionProjectionService;
    private final AccountMailDispatcher mailDispatcher;
    private final Clock clock;
    private final String dummyHash;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService,
            SessionProjectionService sessionProjectionService,
            AccountMailDispatcher mailDispatcher,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.sessionProjectionService = sessionProjectionService;
        this.mailDispatcher = mailDispatcher;
        this.clock = clock;
        // unknown-email logins verify against this so both paths pay for one hash comparison
        this.dummyHash = passwordHasher.hash(UUID.randomUUID().toString());
    }

    public UserResponse register(RegisterRequest request) {
        String email = request.email().trim();
        String username = request.username().trim();
        if (userAccountRepository.existsByEmailIgnoreCase(email)) {
            throw AuthException.conflict(EMAIL_TAKEN);
        }
        if (userAccountRepository.existsByUsernameIgnoreCase(username)) {
            throw AuthException.conflict(USERNAME_TAKEN);
        }

        UserAccount user = new UserAccount();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordHasher.hash(request.password()));
        user.setVerified(false);
        user.setRole(UserRole.USER);

        UserAccount saved;
        try {
            saved = userAccountRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration
            throw AuthException.conflict(userAccountRepository.existsByEmailIgnoreCase(email) ? EMAIL_TAKEN : USERNAME_TAKEN);
        }
        log.info("Registered user {} <{}>", saved.getUsername(), saved.getEmail());

        sendVerification(saved);
        return UserResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public TokenResponse login(LoginRequest request) {
        Optional<UserAccount> found = userAccountRepository.findByEmailIgnoreCase(request.email().trim());
        boolean passwordMatches = passwordHasher.verify(
                request.password(),
                found.map(UserAccount::getPasswordHash).orElse(dummyHash)
        );

        UserAccount user = found.orElseThrow(AuthException::userNotFound);
        if (!user.isVerified()) {
            throw AuthException.unverified(HttpStatus.UNAUTHORIZED);
        }
        if (!passwordMatches) {
            log.info("Rejected login for {}", user.getUsername());
            throw AuthException.invalidCredentials();
        }

        JwtTokenService.IssuedToken token = jwtTokenService.issueAccessToken(user.getUsername());
        sessionProjectionService.remember(user);
        return new TokenResponse(
                token.token(),
                TokenResponse.DEFAULT_TOKEN_TYPE,
                jwtTokenService.getAccessTokenTtl().toSeconds()
        );
    }

    @Transactional
    public MessageResponse confirmEmail(String token) {
        JwtTokenService.ValidatedToken validated;
        try {
            validated = jwtTokenService.validate(token, TokenPurpose.EMAIL_VERIFY);
        } catch (InvalidTokenException ex) {
            log.info("Email verification token rejected: {}", ex.getReason());
            throw verificationError(ex);
        }

        UserAccount user = userAccountRepository.findByEmailIgnoreCase(validated.subject())
                .orElseThrow(() -> verificationError(null));
        if (user.isVerified()) {
            return MessageResponse.of(ALREADY_VERIFIED);
        }
        userAccountRepository.markVerified(user.getEmail());
        sessionProjectionService.forget(user.getUsername());
        log.info("Verified email of {}", user.getUsername());
        return MessageResponse.of(EMAIL_VERIFIED);
    }

    @Transactional(readOnly = true)
    public MessageResponse requestEmail(String email) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(email.trim())
                .orElseThrow(AuthException::userNotFound);
        if (user.isVerified()) {
            return MessageResponse.of(ALREADY_VERIFIED);
        }
        sendVerification(user);
        return MessageResponse.of(VERIFICATION_SENT);
    }

    @Transactional(readOnly = true)
    public MessageResponse forgotPassword(String email) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(email.trim())
                .orElseThrow(AuthException::userNotFound);
        if (!user.isVerified()) {
            throw AuthException.unverified(HttpStatus.BAD_REQUEST);
        }
        JwtTokenService.IssuedToken token = jwtTokenService.issuePasswordResetToken(user.getEmail());
        mailDispatcher.sendPasswordReset(user.getEmail(), user.getUsername(), token.token());
        log.info("Password reset requested for {}", user.getUsername());
        return MessageResponse.of(RESET_SENT);
    }

    /**
     * Replaces the password and moves {@code tokens_valid_after} forward, which spends the
     * reset token and every access token issued before it.
     */
    @Transactional
    public MessageResponse resetPassword(String token, String newPassword) {
        JwtTokenService.ValidatedToken validated;
        try {
            validated = jwtTokenService.validate(token, TokenPurpose.PASSWORD_RESET);
        } catch (InvalidTokenException ex) {
            log.info("Password reset token rejected: {}", ex.getReason());
            throw invalidResetToken(ex);
        }

        UserAccount user = userAccountRepository.findByEmailIgnoreCase(validated.subject())
                .orElseThrow(AuthException::userNotFound);
        if (user.getTokensValidAfter() != null && validated.issuedNoLaterThan(user.getTokensValidAfter().toInstant())) {
            log.info("Password reset token for {} was already spent", user.getUsername());
            throw invalidResetToken(new InvalidTokenException(
                    InvalidTokenException.Reason.REVOKED,
                    "token issued before the last credential change"
            ));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userAccountRepository.updatePassword(user.getId(), passwordHasher.hash(newPassword), now);
        sessionProjectionService.forget(user.getUsername());
        log.info("Password changed for {}", user.getUsername());
        return MessageResponse.of(PASSWORD_CHANGED);
    }

    public void logout(String username) {
        sessionProjectionService.forget(username);
    }

    private void sendVerification(UserAccount user) {
        JwtTokenService.IssuedToken token = jwtTokenService.issueEmailVerificationToken(user.getEmail());
        mailDispatcher.sendVerification(user.getEmail(), user.getUsername(), token.token());
    }

    private static AuthException verificationError(InvalidTokenException cause) {
        return AuthException.invalidToken("VERIFICATION_ERROR", "Verification error", cause);
    }

    private static AuthException invalidResetToken(InvalidTokenException cause) {
        return AuthException.invalidToken("INVALID_TOKEN", "Invalid or expired token", cause);
    }
}
