package com.rollcall.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceSummary;

public record AttendanceSummaryResponse(
        UUID studentId,
        LocalDate from,
        LocalDate to,
        int presentDays,
        int absentDays,
        int lateDays,
        int totalDays,
        int attendancePercentage
) {

    public static AttendanceSummaryResponse of(AttendanceSummary summary, LocalDate from, LocalDate to) {
        return new AttendanceSummaryResponse(
                summary.studentId(),
                from,
                to,
                summary.presentDays(),
                summary.absentDays(),
                summary.lateDays(),
                summary.totalDays(),
                summary.attendancePercentage()
        );
    }
}
