package com.rollcall.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial profile edit; null fields are left untouched.
 */
public record UpdateUserRequest(
        @Size(min = 2, max = 100, message = "name must be at least 2 characters") String name,
        @Size(max = 50) String enrollmentId,
        @Size(max = 100) String course,
        @Size(max = 20) String semester,
        @Size(max = 30) String phone,
        @Size(max = 50) String employeeId,
        @Size(max = 100) String department
) {
}
