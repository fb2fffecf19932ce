package com.contacthub.backend.modules.auth.presentation.dto;

public record TokenResponse(String accessToken, String tokenType, long expiresIn) {

    public static final String DEFAULT_TOKEN_TYPE = "bearer";
}
