package com.rollcall.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.UUID;

public record MonthlyAttendanceResponse(
        UUID studentId,
        int year,
        int month,
        AttendanceSummaryResponse summary,
        List<AttendanceRecordResponse> records
) {
}
