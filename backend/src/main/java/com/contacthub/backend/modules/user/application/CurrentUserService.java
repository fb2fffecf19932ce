package com.contacthub.backend.modules.user.application;

import java.util.Optional;

import com.contacthub.backend.global.error.ProblemException;
import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;
import com.contacthub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.contacthub.backend.modules.auth.presentation.dto.UserResponse;
import com.contacthub.backend.modules.session.application.SessionProjectionService;
import com.contacthub.backend.modules.session.domain.CachedUserProjection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CurrentUserService {

    private static final Logger log = LoggerFactory.getLogger(CurrentUserService.class);

    private final UserAccountRepository userAccountRepository;
    private final SessionProjectionService sessionProjectionService;

    public CurrentUserService(UserAccountRepository userAccountRepository, SessionProjectionService sessionProjectionService) {
        this.userAccountRepository = userAccountRepository;
        this.sessionProjectionService = sessionProjectionService;
    }

    /**
     * Cache first; on a miss the repository answers and the cache is refilled.
     */
    @Transactional(readOnly = true)
    public Optional<CachedUserProjection> resolve(String username) {
        Optional<CachedUserProjection> cached = sessionProjectionService.lookup(username);
        if (cached.isPresent()) {
            return cached;
        }
        return userAccountRepository.findByUsernameIgnoreCase(username)
                .map(sessionProjectionService::remember);
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(String username) {
        return resolve(username)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
    }

    /**
     * Role changes evict the cached projection so the new role is visible on the next request.
     */
    @Transactional
    public UserResponse changeRole(String username, UserRole role) {
        UserAccount user = userAccountRepository.findByUsernameIgnoreCase(username)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND", "User not found"));
        if (user.getRole() != role) {
            userAccountRepository.updateRole(user.getId(), role);
            log.info("Role of {} changed from {} to {}", user.getUsername(), user.getRole(), role);
            user.setRole(role);
        }
        sessionProjectionService.forget(user.getUsername());
        return UserResponse.from(user);
    }
}
