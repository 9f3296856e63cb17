package com.rollcall.backend.modules.attendance.presentation.dto;

import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * {@code date} is an ISO day ({@code 2024-03-31}) or timestamp; timestamps are reduced to their UTC day.
 */
public record MarkAttendanceRequest(
        @NotNull UUID studentId,
        @NotBlank String date,
        @NotNull AttendanceStatus status
) {
}
