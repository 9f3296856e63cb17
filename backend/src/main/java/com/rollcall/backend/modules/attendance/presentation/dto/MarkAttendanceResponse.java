package com.rollcall.backend.modules.attendance.presentation.dto;

import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkOutcome;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkResult;

public record MarkAttendanceResponse(AttendanceRecordResponse record, MarkOutcome outcome) {

    public static MarkAttendanceResponse from(MarkResult result) {
        return new MarkAttendanceResponse(AttendanceRecordResponse.from(result.record()), result.outcome());
    }
}
