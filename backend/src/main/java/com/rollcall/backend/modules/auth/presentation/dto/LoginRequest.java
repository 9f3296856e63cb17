package com.rollcall.backend.modules.auth.presentation.dto;

import com.rollcall.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record LoginRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") String email,
        @NotBlank(message = "password is required") String password,
        @NotNull(message = "role is required") UserRole role,
        String deviceId
) {
}
