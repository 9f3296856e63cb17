package com.rollcall.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;

/**
 * One day for the whole active roster. Students without a record have a null {@code status}.
 */
public record DayAttendanceResponse(
        LocalDate date,
        int present,
        int late,
        int absent,
        int unmarked,
        List<RosterEntry> students
) {

    public record RosterEntry(
            UUID studentId,
            String fullName,
            String enrollmentId,
            AttendanceStatus status,
            UUID recordId
    ) {
    }
}
