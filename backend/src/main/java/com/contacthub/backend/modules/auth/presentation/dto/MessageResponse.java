package com.contacthub.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {

    public static MessageResponse of(String message) {
        return new MessageResponse(message);
    }
}
