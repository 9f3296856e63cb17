package com.rollcall.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Registration payload for teachers and department heads.
 */
public record RegisterStaffRequest(
        @NotBlank @Size(min = 2, max = 100, message = "name must be at least 2 characters") String name,
        @NotBlank @Email(message = "email must be valid") String email,
        @NotBlank @Size(min = 6, max = 100, message = "password must be at least 6 characters") String password,
        @NotBlank @Size(min = 2, max = 50, message = "employeeId is required") String employeeId,
        @Size(max = 100) String department
) {
}
