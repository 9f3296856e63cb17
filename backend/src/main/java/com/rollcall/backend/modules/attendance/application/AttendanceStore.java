package com.rollcall.backend.modules.attendance.application;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;

/**
 * Persistence seam for attendance records, keyed uniquely by (studentId, date).
 * Implementations translate storage failures into {@code StoreException}.
 */
public interface AttendanceStore {

    Optional<AttendanceRecord> findOne(UUID studentId, LocalDate date);

    /**
     * @throws AttendanceConflictException when a record for the same student and day already exists
     */
    AttendanceRecord insert(AttendanceRecord record);

    /**
     * @throws AttendanceConflictException when the record was changed by another writer since it was read
     */
    AttendanceRecord update(AttendanceRecord record);

    List<AttendanceRecord> query(AttendanceQuery query);
}
