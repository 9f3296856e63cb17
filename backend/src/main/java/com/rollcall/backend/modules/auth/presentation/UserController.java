package com.rollcall.backend.modules.auth.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.global.security.SecurityUtils;
import com.rollcall.backend.modules.auth.application.UserRegistrationService;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.presentation.dto.RegisterStaffRequest;
import com.rollcall.backend.modules.auth.presentation.dto.RegisterStudentRequest;
import com.rollcall.backend.modules.auth.presentation.dto.UpdateUserRequest;
import com.rollcall.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserRegistrationService userRegistrationService;

    public UserController(UserRegistrationService userRegistrationService) {
        this.userRegistrationService = userRegistrationService;
    }

    @Operation(summary = "List active users of one role", description = "Teachers may only list students.")
    @GetMapping
    public ResponseEntity<List<UserProfileResponse>> listUsers(
            @RequestParam(name = "role", defaultValue = "STUDENT") String role
    ) {
        UserRole parsed;
        try {
            parsed = UserRole.fromCode(role);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("user.invalid_role", ex.getMessage());
        }
        return ResponseEntity.ok(userRegistrationService.listUsers(parsed, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/students")
    public ResponseEntity<UserProfileResponse> registerStudent(@Valid @RequestBody RegisterStudentRequest request) {
        return created(userRegistrationService.registerStudent(request, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/teachers")
    public ResponseEntity<UserProfileResponse> registerTeacher(@Valid @RequestBody RegisterStaffRequest request) {
        return created(userRegistrationService.registerTeacher(request, SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/hods")
    public ResponseEntity<UserProfileResponse> registerHod(@Valid @RequestBody RegisterStaffRequest request) {
        return created(userRegistrationService.registerHod(request, SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> updateUser(
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(userRegistrationService.updateUser(userId, request, SecurityUtils.getCurrentUserId()));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deactivateUser(@PathVariable UUID userId) {
        userRegistrationService.deactivateUser(userId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<UserProfileResponse> created(UserProfileResponse profile) {
        return ResponseEntity.created(URI.create("/users/" + profile.userId())).body(profile);
    }
}
