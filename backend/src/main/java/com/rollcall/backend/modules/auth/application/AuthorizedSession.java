package com.rollcall.backend.modules.auth.application;

import java.util.UUID;

import com.rollcall.backend.modules.auth.domain.UserRole;

/**
 * A session whose role was confirmed against the {@link UserDirectory} when it was produced.
 */
public record AuthorizedSession(UUID userId, String email, UserRole role) {
}
