package com.rollcall.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.domain.UserStatus;

public record UserProfileResponse(
        UUID userId,
        String email,
        String displayName,
        UserRole role,
        UserStatus status,
        String enrollmentId,
        String course,
        String semester,
        String phone,
        String employeeId,
        String department,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getRole(),
                user.getStatus(),
                user.getEnrollmentId(),
                user.getCourse(),
                user.getSemester(),
                user.getPhone(),
                user.getEmployeeId(),
                user.getDepartment(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
