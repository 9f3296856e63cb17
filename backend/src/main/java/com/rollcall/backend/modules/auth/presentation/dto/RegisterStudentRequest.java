package com.rollcall.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterStudentRequest(
        @NotBlank @Size(min = 2, max = 100, message = "name must be at least 2 characters") String name,
        @NotBlank @Email(message = "email must be valid") String email,
        @NotBlank @Size(min = 6, max = 100, message = "password must be at least 6 characters") String password,
        @NotBlank @Size(min = 3, max = 50, message = "enrollmentId is required") String enrollmentId,
        @NotBlank @Size(min = 2, max = 100, message = "course is required") String course,
        @NotBlank @Size(max = 20, message = "semester is required") String semester,
        @NotBlank @Size(min = 10, max = 30, message = "phone must be at least 10 characters") String phone
) {
}
