package com.rollcall.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkResult;

public record MarkDayResponse(
        LocalDate date,
        int created,
        int updated,
        int unchanged,
        List<MarkAttendanceResponse> results
) {

    public static MarkDayResponse from(LocalDate date, List<MarkResult> results) {
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        for (MarkResult result : results) {
            switch (result.outcome()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new MarkDayResponse(date, created, updated, unchanged,
                results.stream().map(MarkAttendanceResponse::from).toList());
    }
}
