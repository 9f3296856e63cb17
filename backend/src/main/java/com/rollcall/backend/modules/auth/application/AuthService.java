package com.rollcall.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.Objects;
import java.util.UUID;

import com.rollcall.backend.global.error.AuthorizationException;
import com.rollcall.backend.global.error.NotFoundException;
import com.rollcall.backend.global.error.ProblemException;
import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserSession;
import com.rollcall.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.rollcall.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.rollcall.backend.modules.auth.presentation.dto.LoginRequest;
import com.rollcall.backend.modules.auth.presentation.dto.LoginResponse;
import com.rollcall.backend.modules.auth.presentation.dto.LogoutRequest;
import com.rollcall.backend.modules.auth.presentation.dto.RefreshRequest;
import com.rollcall.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.rollcall.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    private static final String REASON_ROLE_REJECTED = "ROLE_REJECTED";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final RoleGate roleGate;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            RoleGate roleGate,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.roleGate = roleGate;
        this.clock = clock;
    }

    /**
     * Verifies credentials, then asks the {@link RoleGate} to confirm the role the caller asked to sign
     * in as. No session row or token exists unless both checks pass.
     */
    public LoginResponse login(LoginRequest request) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(AuthService::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }

        AuthorizedSession session = roleGate.authorize(user.getId(), request.role());

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = openSession(user, session, normalizeDeviceId(request.deviceId()));
        log.info("User {} signed in as {}", user.getId(), session.role());
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    /**
     * Rotates a refresh token. The role the session was opened for is re-confirmed against the
     * directory, so a demoted or deactivated account cannot keep refreshing.
     */
    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(hashToken(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token"));

        if (session.getRevokedAt() != null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token");
        }

        if (!session.getExpiresAt().isAfter(now)) {
            revokeSession(session, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_expired");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            revokeSession(session, REASON_DEVICE_MISMATCH);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_device_mismatch");
        }

        AppUser user = session.getUser();
        AuthorizedSession authorized;
        try {
            authorized = roleGate.authorize(user.getId(), session.getGrantedRole());
        } catch (AuthorizationException ex) {
            revokeSession(session, REASON_ROLE_REJECTED);
            throw ex;
        }

        revokeSession(session, REASON_ROTATED);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = openSession(user, authorized, sessionDeviceId != null ? sessionDeviceId : requestDeviceId);
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    public void logout(LogoutRequest request) {
        // Unknown tokens get the same response so token validity is not observable.
        userSessionRepository.revokeByRefreshTokenHash(hashToken(request.refreshToken()), OffsetDateTime.now(clock), REASON_LOGOUT);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("user.not_found", "No user with id " + userId));
        return UserProfileResponse.from(user);
    }

    private TokenPairResponse openSession(AppUser user, AuthorizedSession authorized, String deviceId) {
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(authorized, refreshToken);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(hashToken(refreshToken));
        session.setGrantedRole(authorized.role());
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);
        userSessionRepository.save(session);
        return tokens;
    }

    private void revokeSession(UserSession session, String reason) {
        session.setRevokedAt(OffsetDateTime.now(clock));
        session.setRevokedReason(reason);
        userSessionRepository.save(session);
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Email or password is incorrect");
    }

    static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_ID_MAX_LENGTH ? trimmed.substring(0, DEVICE_ID_MAX_LENGTH) : trimmed;
    }

    static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
