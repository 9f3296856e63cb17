package com.rollcall.backend.modules.attendance.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import com.rollcall.backend.global.error.NotFoundException;
import com.rollcall.backend.global.error.RetryableProblemException;
import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.audit.application.AuditLogService;
import com.rollcall.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rollcall.backend.modules.auth.application.RoleGate;
import com.rollcall.backend.modules.auth.application.UserDirectory;
import com.rollcall.backend.modules.auth.application.UserDirectory.DirectoryEntry;
import com.rollcall.backend.modules.auth.domain.UserRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Marks attendance with insert-or-update semantics: one record per (student, day), whoever writes it.
 * <p>
 * Every attempt runs in its own transaction. When an insert loses to a concurrent insert of the same key
 * (or an update to a concurrent update) the attempt rolls back and the next attempt re-reads the winning
 * record and takes the update path. Callers see a 409 with {@code Retry-After} only after
 * {@link #MAX_ATTEMPTS} collisions in a row.
 */
@Service
public class AttendanceWriter {

    private static final Logger log = LoggerFactory.getLogger(AttendanceWriter.class);

    static final int MAX_ATTEMPTS = 3;
    static final int CONFLICT_RETRY_AFTER_SECONDS = 1;
    static final String RESOURCE_ATTENDANCE = "ATTENDANCE";

    private final AttendanceStore attendanceStore;
    private final UserDirectory userDirectory;
    private final RoleGate roleGate;
    private final AttendanceCalendar calendar;
    private final AuditLogService auditLogService;
    private final TransactionOperations transactionOperations;

    public AttendanceWriter(
            AttendanceStore attendanceStore,
            UserDirectory userDirectory,
            RoleGate roleGate,
            AttendanceCalendar calendar,
            AuditLogService auditLogService,
            TransactionOperations transactionOperations
    ) {
        this.attendanceStore = attendanceStore;
        this.userDirectory = userDirectory;
        this.roleGate = roleGate;
        this.calendar = calendar;
        this.auditLogService = auditLogService;
        this.transactionOperations = transactionOperations;
    }

    public MarkResult markAttendance(UUID studentId, LocalDate date, AttendanceStatus status, UUID authorId) {
        roleGate.requireRole(authorId, UserRole.TEACHER, UserRole.HOD);
        validateDate(date);
        validateEntry(studentId, status);

        return withRetry(studentId + " on " + date,
                () -> transactionOperations.execute(tx -> upsert(studentId, date, status, authorId)));
    }

    /**
     * Marks a whole roster for one day in a single transaction. Every entry is validated before
     * anything is written; one bad entry rejects the batch.
     */
    public List<MarkResult> markAll(LocalDate date, Map<UUID, AttendanceStatus> entries, UUID authorId) {
        roleGate.requireRole(authorId, UserRole.TEACHER, UserRole.HOD);
        validateDate(date);
        if (entries == null || entries.isEmpty()) {
            throw new ValidationException("attendance.empty_batch", "At least one entry is required");
        }
        Map<UUID, AttendanceStatus> ordered = new LinkedHashMap<>(entries);
        ordered.forEach(this::validateEntry);

        return withRetry(ordered.size() + " students on " + date, () -> transactionOperations.execute(tx -> {
            List<MarkResult> results = new ArrayList<>(ordered.size());
            ordered.forEach((studentId, status) -> results.add(upsert(studentId, date, status, authorId)));
            return results;
        }));
    }

    private MarkResult upsert(UUID studentId, LocalDate date, AttendanceStatus status, UUID authorId) {
        OffsetDateTime now = calendar.now();
        Optional<AttendanceRecord> existing = attendanceStore.findOne(studentId, date);
        if (existing.isEmpty()) {
            AttendanceRecord created = attendanceStore.insert(new AttendanceRecord(studentId, date, status, authorId, now));
            audit(AuditLogService.ACTION_ATTENDANCE_CREATED, created, null, authorId);
            return new MarkResult(created, MarkOutcome.CREATED);
        }

        AttendanceRecord record = existing.get();
        AttendanceStatus previous = record.getStatus();
        if (!record.changeStatus(status, authorId, now)) {
            return new MarkResult(record, MarkOutcome.UNCHANGED);
        }
        AttendanceRecord updated = attendanceStore.update(record);
        audit(AuditLogService.ACTION_ATTENDANCE_UPDATED, updated, previous, authorId);
        return new MarkResult(updated, MarkOutcome.UPDATED);
    }

    private <T> T withRetry(String description, Supplier<T> attempt) {
        AttendanceConflictException lastConflict = null;
        for (int attemptNumber = 1; attemptNumber <= MAX_ATTEMPTS; attemptNumber++) {
            try {
                return attempt.get();
            } catch (AttendanceConflictException ex) {
                lastConflict = ex;
                log.info("Attendance write for {} collided with a concurrent write (attempt {}/{})",
                        description, attemptNumber, MAX_ATTEMPTS);
            }
        }
        log.warn("Attendance write for {} gave up after {} conflicting attempts", description, MAX_ATTEMPTS);
        throw new RetryableProblemException(HttpStatus.CONFLICT, "attendance.write_conflict",
                "Attendance was changed concurrently; retry the request", CONFLICT_RETRY_AFTER_SECONDS, lastConflict);
    }

    private void validateDate(LocalDate date) {
        if (date == null) {
            throw new ValidationException("attendance.invalid_date", "date is required");
        }
        if (calendar.isFuture(date)) {
            throw new ValidationException("attendance.future_date",
                    "Attendance cannot be marked for " + date + ", after " + calendar.today());
        }
    }

    private void validateEntry(UUID studentId, AttendanceStatus status) {
        if (studentId == null) {
            throw new ValidationException("attendance.invalid_student", "studentId is required");
        }
        if (status == null) {
            throw new ValidationException("attendance.invalid_status", "status is required for student " + studentId);
        }
        DirectoryEntry student = userDirectory.findUser(studentId)
                .orElseThrow(() -> new NotFoundException("attendance.student_not_found", "No student with id " + studentId));
        if (student.role() != UserRole.STUDENT) {
            throw new ValidationException("attendance.invalid_student", "User " + studentId + " is not a student");
        }
        if (!student.active()) {
            throw new ValidationException("attendance.student_inactive", "Student " + studentId + " is deactivated");
        }
    }

    private void audit(String action, AttendanceRecord record, AttendanceStatus previous, UUID authorId) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("studentId", record.getStudentId().toString());
        detail.put("date", record.getAttendanceDate().toString());
        detail.put("status", record.getStatus().code());
        if (previous != null) {
            detail.put("previousStatus", previous.code());
        }
        auditLogService.record(new AuditLogCommand(
                action,
                RESOURCE_ATTENDANCE,
                record.getStudentId() + ":" + record.getAttendanceDate(),
                authorId,
                detail
        ));
    }

    public enum MarkOutcome {
        CREATED,
        UPDATED,
        UNCHANGED
    }

    public record MarkResult(AttendanceRecord record, MarkOutcome outcome) {
    }
}
