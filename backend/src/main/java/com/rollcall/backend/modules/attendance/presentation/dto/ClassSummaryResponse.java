package com.rollcall.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record ClassSummaryResponse(
        LocalDate from,
        LocalDate to,
        List<StudentSummary> students
) {

    public record StudentSummary(
            UUID studentId,
            String fullName,
            String enrollmentId,
            int presentDays,
            int absentDays,
            int lateDays,
            int totalDays,
            int attendancePercentage
    ) {
    }
}
