package com.rollcall.backend.modules.attendance.application;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Inclusive day range, optionally narrowed to one student.
 */
public record AttendanceQuery(UUID studentId, LocalDate from, LocalDate to) {
}
