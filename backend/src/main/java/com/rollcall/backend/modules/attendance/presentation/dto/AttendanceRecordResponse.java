package com.rollcall.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;

public record AttendanceRecordResponse(
        UUID id,
        UUID studentId,
        LocalDate date,
        AttendanceStatus status,
        UUID createdBy,
        OffsetDateTime createdAt,
        UUID updatedBy,
        OffsetDateTime updatedAt
) {

    public static AttendanceRecordResponse from(AttendanceRecord record) {
        return new AttendanceRecordResponse(
                record.getId(),
                record.getStudentId(),
                record.getAttendanceDate(),
                record.getStatus(),
                record.getCreatedBy(),
                record.getCreatedAt(),
                record.getUpdatedBy(),
                record.getUpdatedAt()
        );
    }
}
