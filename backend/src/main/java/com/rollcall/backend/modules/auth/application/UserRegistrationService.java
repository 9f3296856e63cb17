package com.rollcall.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import com.rollcall.backend.global.error.AuthorizationException;
import com.rollcall.backend.global.error.NotFoundException;
import com.rollcall.backend.global.error.ProblemException;
import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.modules.audit.application.AuditLogService;
import com.rollcall.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;
import com.rollcall.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.rollcall.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.rollcall.backend.modules.auth.presentation.dto.RegisterStaffRequest;
import com.rollcall.backend.modules.auth.presentation.dto.RegisterStudentRequest;
import com.rollcall.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.rollcall.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Account lifecycle managed by department heads: registration, profile edits and deactivation.
 * Accounts are never deleted, so attendance records always keep a resolvable student.
 */
@Service
@Transactional
public class UserRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(UserRegistrationService.class);
    private static final String RESOURCE_USER = "USER";

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final RoleGate roleGate;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final Set<String> hodEmailAllowlist;

    public UserRegistrationService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            RoleGate roleGate,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${rollcall.registration.hod-emails:}") String hodEmails
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.roleGate = roleGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.hodEmailAllowlist = Arrays.stream(hodEmails.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .map(email -> email.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public UserProfileResponse registerStudent(RegisterStudentRequest request, UUID actorId) {
        roleGate.requireRole(actorId, UserRole.HOD);
        AppUser user = newUser(request.email(), request.password(), request.name(), UserRole.STUDENT);
        user.setEnrollmentId(request.enrollmentId().trim());
        user.setCourse(request.course().trim());
        user.setSemester(request.semester().trim());
        user.setPhone(request.phone().trim());
        return saveRegistered(user, actorId);
    }

    public UserProfileResponse registerTeacher(RegisterStaffRequest request, UUID actorId) {
        roleGate.requireRole(actorId, UserRole.HOD);
        AppUser user = newUser(request.email(), request.password(), request.name(), UserRole.TEACHER);
        applyStaffAttributes(user, request);
        return saveRegistered(user, actorId);
    }

    /**
     * Department-head accounts can be restricted to {@code rollcall.registration.hod-emails}; an empty
     * list allows any address.
     */
    public UserProfileResponse registerHod(RegisterStaffRequest request, UUID actorId) {
        roleGate.requireRole(actorId, UserRole.HOD);
        String email = normalizeEmail(request.email());
        if (!hodEmailAllowlist.isEmpty() && !hodEmailAllowlist.contains(email)) {
            throw new AuthorizationException("user.hod_email_not_allowed", "This address may not hold a department head account");
        }
        AppUser user = newUser(request.email(), request.password(), request.name(), UserRole.HOD);
        applyStaffAttributes(user, request);
        return saveRegistered(user, actorId);
    }

    public UserProfileResponse updateUser(UUID userId, UpdateUserRequest request, UUID actorId) {
        roleGate.requireRole(actorId, UserRole.HOD);
        AppUser user = findUser(userId);

        Map<String, Object> changes = new LinkedHashMap<>();
        if (request.name() != null) {
            String name = request.name().trim();
            if (name.length() < 2) {
                throw new ValidationException("user.invalid_name", "name must be at least 2 characters");
            }
            user.setFullName(name);
            changes.put("name", name);
        }

        boolean student = user.getRole() == UserRole.STUDENT;
        if (student) {
            rejectIfPresent(request.employeeId(), "employeeId");
            rejectIfPresent(request.department(), "department");
            applyIfPresent(request.enrollmentId(), "enrollmentId", user::setEnrollmentId, changes);
            applyIfPresent(request.course(), "course", user::setCourse, changes);
            applyIfPresent(request.semester(), "semester", user::setSemester, changes);
            applyIfPresent(request.phone(), "phone", user::setPhone, changes);
        } else {
            rejectIfPresent(request.enrollmentId(), "enrollmentId");
            rejectIfPresent(request.course(), "course");
            rejectIfPresent(request.semester(), "semester");
            applyIfPresent(request.phone(), "phone", user::setPhone, changes);
            applyIfPresent(request.employeeId(), "employeeId", user::setEmployeeId, changes);
            applyIfPresent(request.department(), "department", user::setDepartment, changes);
        }

        AppUser saved = appUserRepository.save(user);
        if (!changes.isEmpty()) {
            audit(AuditLogService.ACTION_USER_UPDATED, saved, actorId, changes);
        }
        return UserProfileResponse.from(saved);
    }

    /**
     * Deactivates the account and revokes its sessions. Attendance records are kept.
     */
    public void deactivateUser(UUID userId, UUID actorId) {
        roleGate.requireRole(actorId, UserRole.HOD);
        if (userId.equals(actorId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "user.cannot_deactivate_self", "A department head cannot deactivate their own account");
        }
        AppUser user = findUser(userId);
        if (user.getStatus() == UserStatus.INACTIVE) {
            return;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        user.setStatus(UserStatus.INACTIVE);
        user.setDeactivatedAt(now);
        appUserRepository.save(user);
        int revoked = userSessionRepository.revokeAllForUser(userId, now, "ACCOUNT_DEACTIVATED");
        audit(AuditLogService.ACTION_USER_DEACTIVATED, user, actorId, Map.of("revokedSessions", revoked));
        log.info("User {} deactivated by {}", userId, actorId);
    }

    /**
     * Teachers may list students (their marking roster); department heads may list any role.
     */
    @Transactional(readOnly = true)
    public List<UserProfileResponse> listUsers(UserRole role, UUID actorId) {
        AuthorizedSession actor = roleGate.requireRole(actorId, UserRole.TEACHER, UserRole.HOD);
        if (actor.role() == UserRole.TEACHER && role != UserRole.STUDENT) {
            throw new AuthorizationException("auth.forbidden", "Teachers may only list students");
        }
        return appUserRepository.findByRoleAndStatus(role, UserStatus.ACTIVE).stream()
                .map(UserProfileResponse::from)
                .toList();
    }

    private AppUser newUser(String rawEmail, String rawPassword, String name, UserRole role) {
        String email = normalizeEmail(rawEmail);
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "user.email_taken", "An account with this email already exists");
        }
        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setFullName(name.trim());
        user.setRole(role);
        user.setStatus(UserStatus.ACTIVE);
        return user;
    }

    private void applyStaffAttributes(AppUser user, RegisterStaffRequest request) {
        user.setEmployeeId(request.employeeId().trim());
        if (StringUtils.hasText(request.department())) {
            user.setDepartment(request.department().trim());
        }
    }

    private UserProfileResponse saveRegistered(AppUser user, UUID actorId) {
        AppUser saved = appUserRepository.save(user);
        audit(AuditLogService.ACTION_USER_REGISTERED, saved, actorId, Map.of("role", saved.getRole().code()));
        log.info("Registered {} account {} by {}", saved.getRole(), saved.getId(), actorId);
        return UserProfileResponse.from(saved);
    }

    private AppUser findUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("user.not_found", "No user with id " + userId));
    }

    private void audit(String action, AppUser user, UUID actorId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(action, RESOURCE_USER, String.valueOf(user.getId()), actorId, detail));
    }

    private static void applyIfPresent(String value, String field, Consumer<String> setter, Map<String, Object> changes) {
        if (value == null) {
            return;
        }
        String trimmed = value.trim();
        setter.accept(trimmed.isEmpty() ? null : trimmed);
        changes.put(field, trimmed);
    }

    private static void rejectIfPresent(String value, String field) {
        if (StringUtils.hasText(value)) {
            throw new ValidationException("user.field_not_applicable", field + " does not apply to this account type");
        }
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
