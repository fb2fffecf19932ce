package com.contacthub.backend.modules.auth.presentation;

import com.contacthub.backend.global.security.SecurityUtils;
import com.contacthub.backend.modules.auth.application.AuthService;
import com.contacthub.backend.modules.auth.presentation.dto.EmailRequest;
import com.contacthub.backend.modules.auth.presentation.dto.LoginRequest;
import com.contacthub.backend.modules.auth.presentation.dto.MessageResponse;
import com.contacthub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.contacthub.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.contacthub.backend.modules.auth.presentation.dto.TokenResponse;
import com.contacthub.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/register")
    @Operation(summary = "Create an unverified account and send the verification mail")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Exchange email and password for an access token")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/auth/confirmed_email/{token}")
    @Operation(summary = "Confirm an email address from the verification link")
    public ResponseEntity<MessageResponse> confirmEmail(@PathVariable String token) {
        return ResponseEntity.ok(authService.confirmEmail(token));
    }

    @PostMapping("/auth/request_email")
    @Operation(summary = "Resend the verification mail")
    public ResponseEntity<MessageResponse> requestEmail(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(authService.requestEmail(request.email()));
    }

    @PostMapping("/auth/forgot-password")
    @Operation(summary = "Send a password reset link")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(authService.forgotPassword(request.email()));
    }

    @PostMapping("/auth/reset-password/{token}")
    @Operation(summary = "Set a new password with a reset token")
    public ResponseEntity<MessageResponse> resetPassword(
            @PathVariable String token,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        return ResponseEntity.ok(authService.resetPassword(token, request.newPassword()));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "Drop the cached session state of the caller")
    public ResponseEntity<Void> logout() {
        authService.logout(SecurityUtils.getCurrentUsername());
        return ResponseEntity.noContent().build();
    }
}
