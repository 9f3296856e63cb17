package com.rollcall.backend.modules.attendance.application;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.auth.application.AuthorizedSession;
import com.rollcall.backend.modules.auth.application.RoleGate;
import com.rollcall.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Range and day queries over attendance. Bounds are whole UTC calendar days and both are inclusive.
 */
@Service
@Transactional(readOnly = true)
public class AttendanceReader {

    static final Comparator<AttendanceRecord> DATE_THEN_STUDENT = Comparator
            .comparing(AttendanceRecord::getAttendanceDate)
            .thenComparing(AttendanceRecord::getStudentId);

    private final AttendanceStore attendanceStore;
    private final RoleGate roleGate;

    public AttendanceReader(AttendanceStore attendanceStore, RoleGate roleGate) {
        this.attendanceStore = attendanceStore;
        this.roleGate = roleGate;
    }

    /**
     * Records with {@code from <= date <= to}, for one student or, when {@code studentId} is null, for all
     * students. Ordered by date, then student.
     */
    public List<AttendanceRecord> queryRange(UUID studentId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        return attendanceStore.query(new AttendanceQuery(studentId, from, to)).stream()
                .sorted(DATE_THEN_STUDENT)
                .toList();
    }

    /**
     * Range query on behalf of {@code callerId}. Students read only their own records and default to them
     * when {@code studentId} is omitted; reading every student's records needs a staff role.
     */
    public List<AttendanceRecord> queryRangeFor(UUID callerId, UUID studentId, LocalDate from, LocalDate to) {
        return queryRange(resolveScope(callerId, studentId), from, to);
    }

    public List<AttendanceRecord> findDay(UUID callerId, LocalDate date) {
        roleGate.requireRole(callerId, UserRole.TEACHER, UserRole.HOD);
        return queryRange(null, date, date);
    }

    /**
     * @return the student whose records the caller may read, or null for "all students"
     */
    UUID resolveScope(UUID callerId, UUID studentId) {
        if (studentId != null) {
            roleGate.requireReadScope(callerId, studentId);
            return studentId;
        }
        AuthorizedSession session = roleGate.requireRole(callerId, UserRole.STUDENT, UserRole.TEACHER, UserRole.HOD);
        return session.role() == UserRole.STUDENT ? session.userId() : null;
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("attendance.invalid_range", "from and to are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("attendance.invalid_range", "from " + from + " is after to " + to);
        }
    }
}
