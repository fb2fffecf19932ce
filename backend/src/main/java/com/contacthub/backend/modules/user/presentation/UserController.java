package com.contacthub.backend.modules.user.presentation;

import com.contacthub.backend.global.security.SecurityUtils;
import com.contacthub.backend.modules.auth.presentation.dto.UserResponse;
import com.contacthub.backend.modules.user.application.CurrentUserService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "users")
public class UserController {

    private final CurrentUserService currentUserService;

    public UserController(CurrentUserService currentUserService) {
        this.currentUserService = currentUserService;
    }

    @GetMapping("/users/me")
    @Operation(summary = "Profile of the authenticated user")
    public ResponseEntity<UserResponse> me() {
        return ResponseEntity.ok(currentUserService.loadProfile(SecurityUtils.getCurrentUsername()));
    }

    @PatchMapping("/users/{username}/role")
    @Operation(summary = "Change a user's role (administrators only)")
    public ResponseEntity<UserResponse> changeRole(
            @PathVariable String username,
            @Valid @RequestBody UpdateRoleRequest request
    ) {
        return ResponseEntity.ok(currentUserService.changeRole(username, request.role()));
    }
}
