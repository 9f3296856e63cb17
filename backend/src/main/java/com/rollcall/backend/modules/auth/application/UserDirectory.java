package com.rollcall.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.global.error.NotFoundException;
import com.rollcall.backend.modules.auth.domain.UserRole;

/**
 * Authoritative source of user identity, role and profile attributes. Every role decision
 * is made against this directory, never against a role label held by the caller.
 */
public interface UserDirectory {

    Optional<DirectoryEntry> findUser(UUID userId);

    /**
     * Case-insensitive email lookup.
     */
    Optional<DirectoryEntry> findByEmail(String email);

    /**
     * Active users holding {@code role}, ordered by name.
     */
    List<DirectoryEntry> listByRole(UserRole role);

    default UserRole getUserRole(UUID userId) {
        return findUser(userId)
                .map(DirectoryEntry::role)
                .orElseThrow(() -> new NotFoundException("user.not_found", "No user with id " + userId));
    }

    record DirectoryEntry(UUID userId, String email, String fullName, UserRole role, boolean active, String enrollmentId) {
    }
}
