package com.rollcall.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

public record MarkDayRequest(
        @NotEmpty List<@Valid Entry> entries
) {

    public record Entry(@NotNull UUID studentId, @NotNull AttendanceStatus status) {
    }
}
