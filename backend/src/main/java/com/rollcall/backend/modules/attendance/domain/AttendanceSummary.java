package com.rollcall.backend.modules.attendance.domain;

import java.util.UUID;

/**
 * Counts for one student over a set of days. {@code totalDays} is the sum of the three status counts.
 */
public record AttendanceSummary(
        UUID studentId,
        int presentDays,
        int absentDays,
        int lateDays,
        int totalDays,
        int attendancePercentage
) {

    public static AttendanceSummary empty(UUID studentId) {
        return new AttendanceSummary(studentId, 0, 0, 0, 0, 0);
    }
}
