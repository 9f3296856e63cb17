package com.rollcall.backend.global.security;

import java.util.UUID;

import com.rollcall.backend.modules.auth.domain.UserRole;

/**
 * Principal of a request whose bearer token was verified and whose role was re-confirmed against the directory.
 */
public record SessionPrincipal(UUID userId, String email, UserRole role) {
}
