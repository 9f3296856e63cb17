package com.rollcall.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, UUID> {

    Optional<AttendanceRecord> findByStudentIdAndAttendanceDate(UUID studentId, LocalDate attendanceDate);

    List<AttendanceRecord> findByStudentIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
            UUID studentId,
            LocalDate from,
            LocalDate to
    );

    List<AttendanceRecord> findByAttendanceDateBetweenOrderByAttendanceDateAscStudentIdAsc(LocalDate from, LocalDate to);
}
