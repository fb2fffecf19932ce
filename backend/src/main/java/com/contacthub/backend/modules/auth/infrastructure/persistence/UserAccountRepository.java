package com.contacthub.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.contacthub.backend.modules.auth.domain.UserAccount;
import com.contacthub.backend.modules.auth.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Uniqueness of email and username is enforced by unique indexes; the exists checks are
 * only there for a friendlier conflict message. Every mutation is a single statement.
 */
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    Optional<UserAccount> findByEmailIgnoreCase(String email);

    Optional<UserAccount> findByUsernameIgnoreCase(String username);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsernameIgnoreCase(String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserAccount ua
               set ua.verified = true
             where lower(ua.email) = lower(:email)
               and ua.verified = false
            """)
    int markVerified(@Param("email") String email);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserAccount ua
               set ua.passwordHash = :passwordHash,
                   ua.tokensValidAfter = :tokensValidAfter
             where ua.id = :id
            """)
    int updatePassword(
            @Param("id") UUID id,
            @Param("passwordHash") String passwordHash,
            @Param("tokensValidAfter") OffsetDateTime tokensValidAfter
    );

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update UserAccount ua set ua.role = :role where ua.id = :id")
    int updateRole(@Param("id") UUID id, @Param("role") UserRole role);
}
