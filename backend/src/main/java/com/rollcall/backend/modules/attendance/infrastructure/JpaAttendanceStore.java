package com.rollcall.backend.modules.attendance.infrastructure;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.global.error.StoreException;
import com.rollcall.backend.modules.attendance.application.AttendanceConflictException;
import com.rollcall.backend.modules.attendance.application.AttendanceQuery;
import com.rollcall.backend.modules.attendance.application.AttendanceStore;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.infrastructure.persistence.AttendanceRecordRepository;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * {@link AttendanceStore} over PostgreSQL. Writes are flushed immediately so key clashes surface inside the
 * writer's attempt rather than at commit.
 */
@Component
public class JpaAttendanceStore implements AttendanceStore {

    private final AttendanceRecordRepository attendanceRecordRepository;

    public JpaAttendanceStore(AttendanceRecordRepository attendanceRecordRepository) {
        this.attendanceRecordRepository = attendanceRecordRepository;
    }

    @Override
    public Optional<AttendanceRecord> findOne(UUID studentId, LocalDate date) {
        try {
            return attendanceRecordRepository.findByStudentIdAndAttendanceDate(studentId, date);
        } catch (DataAccessException ex) {
            throw new StoreException("Attendance lookup failed", ex);
        }
    }

    @Override
    public AttendanceRecord insert(AttendanceRecord record) {
        try {
            return attendanceRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException ex) {
            if (isStudentDayViolation(ex)) {
                throw new AttendanceConflictException(
                        "Attendance for " + record.getStudentId() + " on " + record.getAttendanceDate() + " already exists", ex);
            }
            throw new StoreException("Attendance insert failed", ex);
        } catch (DataAccessException ex) {
            throw new StoreException("Attendance insert failed", ex);
        }
    }

    @Override
    public AttendanceRecord update(AttendanceRecord record) {
        try {
            return attendanceRecordRepository.saveAndFlush(record);
        } catch (OptimisticLockingFailureException ex) {
            throw new AttendanceConflictException(
                    "Attendance for " + record.getStudentId() + " on " + record.getAttendanceDate() + " changed concurrently", ex);
        } catch (DataAccessException ex) {
            throw new StoreException("Attendance update failed", ex);
        }
    }

    @Override
    public List<AttendanceRecord> query(AttendanceQuery query) {
        try {
            if (query.studentId() == null) {
                return attendanceRecordRepository.findByAttendanceDateBetweenOrderByAttendanceDateAscStudentIdAsc(
                        query.from(), query.to());
            }
            return attendanceRecordRepository.findByStudentIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
                    query.studentId(), query.from(), query.to());
        } catch (DataAccessException ex) {
            throw new StoreException("Attendance query failed", ex);
        }
    }

    private boolean isStudentDayViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(AttendanceRecord.STUDENT_DAY_CONSTRAINT);
    }
}
