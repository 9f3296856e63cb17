package com.rollcall.backend.modules.auth.application;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.rollcall.backend.global.error.AuthorizationException;
import com.rollcall.backend.modules.auth.application.UserDirectory.DirectoryEntry;
import com.rollcall.backend.modules.auth.domain.UserRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Grants read and write scope only after re-reading the caller's role from the {@link UserDirectory}.
 * <p>
 * {@link #authorize} runs at login and on every refresh, {@link #restore} on every authenticated
 * request, and {@link #requireRole} / {@link #requireReadScope} inside every privileged operation.
 * A role claim presented by a client (token, form field) is only ever compared, never trusted.
 */
@Component
public class RoleGate {

    private static final Logger log = LoggerFactory.getLogger(RoleGate.class);

    private final UserDirectory userDirectory;

    public RoleGate(UserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    /**
     * Confirms that {@code identity} currently holds {@code requestedRole}.
     *
     * @throws AuthorizationException when the identity is unknown, inactive or holds another role
     */
    public AuthorizedSession authorize(UUID identity, UserRole requestedRole) {
        Objects.requireNonNull(requestedRole, "requestedRole");
        DirectoryEntry entry = loadActive(identity);
        if (entry.role() != requestedRole) {
            log.warn("Role mismatch for user {}: requested {}, authoritative {}", identity, requestedRole, entry.role());
            throw new AuthorizationException("auth.role_mismatch",
                    "Account is not registered as " + requestedRole.code());
        }
        return new AuthorizedSession(entry.userId(), entry.email(), entry.role());
    }

    /**
     * Re-establishes a session from a token's claims. Same check as {@link #authorize}; a token minted
     * before a role change or deactivation stops working on the next request.
     */
    public AuthorizedSession restore(UUID identity, UserRole claimedRole) {
        return authorize(identity, claimedRole);
    }

    public AuthorizedSession requireRole(UUID identity, UserRole... allowedRoles) {
        Set<UserRole> allowed = allowedRoles.length == 0
                ? EnumSet.noneOf(UserRole.class)
                : EnumSet.copyOf(Arrays.asList(allowedRoles));
        DirectoryEntry entry = loadActive(identity);
        if (!allowed.contains(entry.role())) {
            throw new AuthorizationException("auth.forbidden",
                    "Role " + entry.role().code() + " may not perform this operation");
        }
        return new AuthorizedSession(entry.userId(), entry.email(), entry.role());
    }

    /**
     * Students may read only their own attendance; teachers and department heads may read anyone's.
     */
    public AuthorizedSession requireReadScope(UUID identity, UUID studentId) {
        DirectoryEntry entry = loadActive(identity);
        if (entry.role() == UserRole.STUDENT && !entry.userId().equals(studentId)) {
            throw new AuthorizationException("auth.forbidden", "Students may only read their own attendance");
        }
        return new AuthorizedSession(entry.userId(), entry.email(), entry.role());
    }

    private DirectoryEntry loadActive(UUID identity) {
        if (identity == null) {
            throw new AuthorizationException("auth.unauthenticated", "No authenticated identity");
        }
        DirectoryEntry entry = userDirectory.findUser(identity)
                .orElseThrow(() -> new AuthorizationException("auth.unknown_identity", "Identity is not registered"));
        if (!entry.active()) {
            throw new AuthorizationException("auth.user_inactive", "Account is deactivated");
        }
        return entry;
    }
}
