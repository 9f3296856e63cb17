package com.rollcall.backend.modules.attendance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.rollcall.backend.global.error.AuthorizationException;
import com.rollcall.backend.global.error.NotFoundException;
import com.rollcall.backend.global.error.RetryableProblemException;
import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.modules.attendance.application.AttendanceCalendar;
import com.rollcall.backend.modules.attendance.application.AttendanceConflictException;
import com.rollcall.backend.modules.attendance.application.AttendanceQuery;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkOutcome;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkResult;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.audit.application.AuditLogService;
import com.rollcall.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.rollcall.backend.modules.auth.application.RoleGate;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.support.InMemoryAttendanceStore;
import com.rollcall.backend.support.TestDirectory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class AttendanceWriterTest {

    private static final LocalDate TODAY = LocalDate.parse("2024-03-31");

    @Mock
    private AuditLogService auditLogService;

    private InMemoryAttendanceStore store;
    private TestDirectory directory;
    private AttendanceWriter writer;

    private UUID teacherId;
    private UUID hodId;
    private UUID studentId;
    private UUID otherStudentId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC);
        store = new InMemoryAttendanceStore();
        directory = new TestDirectory();
        teacherId = directory.add(UserRole.TEACHER, "Tara Teacher");
        hodId = directory.add(UserRole.HOD, "Hana Head");
        studentId = directory.add(UserRole.STUDENT, "Sam Student");
        otherStudentId = directory.add(UserRole.STUDENT, "Olu Student");

        writer = new AttendanceWriter(
                store,
                directory,
                new RoleGate(directory),
                new AttendanceCalendar(clock),
                auditLogService,
                TransactionOperations.withoutTransaction()
        );
    }

    @Test
    @DisplayName("first mark creates a record with the author and creation time")
    void firstMarkCreates() {
        MarkResult result = writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);

        assertThat(result.outcome()).isEqualTo(MarkOutcome.CREATED);
        AttendanceRecord record = result.record();
        assertThat(record.getCreatedBy()).isEqualTo(teacherId);
        assertThat(record.getCreatedAt()).isEqualTo("2024-03-31T12:00:00Z");
        assertThat(record.getUpdatedAt()).isNull();
        assertThat(store.size()).isEqualTo(1);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().actionType()).isEqualTo(AuditLogService.ACTION_ATTENDANCE_CREATED);
        assertThat(captor.getValue().resourceKey()).isEqualTo(studentId + ":2024-03-31");
    }

    @Test
    @DisplayName("marking the same status twice leaves exactly one unchanged record")
    void sameStatusIsIdempotent() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        MarkResult second = writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);

        assertThat(second.outcome()).isEqualTo(MarkOutcome.UNCHANGED);
        assertThat(second.record().getStatus()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(second.record().getUpdatedAt()).isNull();
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.updateCount()).isZero();
        verify(auditLogService, times(1)).record(any());
    }

    @Test
    @DisplayName("a different status updates the existing record instead of adding one")
    void differentStatusUpdates() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        MarkResult second = writer.markAttendance(studentId, TODAY, AttendanceStatus.ABSENT, hodId);

        assertThat(second.outcome()).isEqualTo(MarkOutcome.UPDATED);
        assertThat(second.record().getStatus()).isEqualTo(AttendanceStatus.ABSENT);
        assertThat(second.record().getCreatedBy()).isEqualTo(teacherId);
        assertThat(second.record().getUpdatedBy()).isEqualTo(hodId);
        assertThat(second.record().getUpdatedAt()).isNotNull();
        assertThat(store.query(new AttendanceQuery(studentId, TODAY, TODAY))).hasSize(1);
    }

    @Test
    void futureDateIsRejected() {
        assertThatThrownBy(() -> writer.markAttendance(studentId, TODAY.plusDays(1), AttendanceStatus.PRESENT, teacherId))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("attendance.future_date");
        assertThat(store.size()).isZero();
    }

    @Test
    void studentsCannotMarkAttendance() {
        assertThatThrownBy(() -> writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, studentId))
                .isInstanceOf(AuthorizationException.class)
                .extracting("code").isEqualTo("auth.forbidden");
        assertThat(store.size()).isZero();
        verify(auditLogService, never()).record(any());
    }

    @Test
    void authorRoleIsReadFromDirectoryOnEveryCall() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        directory.changeRole(teacherId, UserRole.STUDENT);

        assertThatThrownBy(() -> writer.markAttendance(studentId, TODAY, AttendanceStatus.ABSENT, teacherId))
                .isInstanceOf(AuthorizationException.class);
        assertThat(store.findOne(studentId, TODAY)).get()
                .extracting(AttendanceRecord::getStatus).isEqualTo(AttendanceStatus.PRESENT);
    }

    @Test
    void unknownStudentIsNotFound() {
        assertThatThrownBy(() -> writer.markAttendance(UUID.randomUUID(), TODAY, AttendanceStatus.PRESENT, teacherId))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void markingATeacherIsInvalid() {
        assertThatThrownBy(() -> writer.markAttendance(teacherId, TODAY, AttendanceStatus.PRESENT, hodId))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("attendance.invalid_student");
    }

    @Test
    void missingStatusIsInvalid() {
        assertThatThrownBy(() -> writer.markAttendance(studentId, TODAY, null, teacherId))
                .isInstanceOf(ValidationException.class)
                .extracting("code").isEqualTo("attendance.invalid_status");
    }

    @Test
    @DisplayName("a batch with one bad entry writes nothing")
    void markAllValidatesBeforeWriting() {
        Map<UUID, AttendanceStatus> entries = new LinkedHashMap<>();
        entries.put(studentId, AttendanceStatus.PRESENT);
        entries.put(teacherId, AttendanceStatus.ABSENT);

        assertThatThrownBy(() -> writer.markAll(TODAY, entries, teacherId))
                .isInstanceOf(ValidationException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void markAllReportsOutcomePerStudent() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        Map<UUID, AttendanceStatus> entries = new LinkedHashMap<>();
        entries.put(studentId, AttendanceStatus.LATE);
        entries.put(otherStudentId, AttendanceStatus.PRESENT);

        List<MarkResult> results = writer.markAll(TODAY, entries, teacherId);

        assertThat(results).extracting(MarkResult::outcome)
                .containsExactly(MarkOutcome.UPDATED, MarkOutcome.CREATED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("concurrent first marks of one slot leave a single record")
    void concurrentMarksYieldOneRecord() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<MarkResult>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                Callable<MarkResult> task = () -> {
                    start.await();
                    return writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int created = 0;
            for (Future<MarkResult> future : futures) {
                if (future.get(10, TimeUnit.SECONDS).outcome() == MarkOutcome.CREATED) {
                    created++;
                }
            }

            assertThat(created).isEqualTo(1);
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.insertCount()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void persistentConflictSurfacesAsRetryable409() {
        InMemoryAttendanceStore alwaysConflicting = new InMemoryAttendanceStore() {
            @Override
            public AttendanceRecord insert(AttendanceRecord record) {
                throw new AttendanceConflictException("simulated", null);
            }
        };
        AttendanceWriter conflicted = new AttendanceWriter(
                alwaysConflicting,
                directory,
                new RoleGate(directory),
                new AttendanceCalendar(Clock.fixed(Instant.parse("2024-03-31T12:00:00Z"), ZoneOffset.UTC)),
                auditLogService,
                TransactionOperations.withoutTransaction()
        );

        assertThatThrownBy(() -> conflicted.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getRetryAfterSeconds()).isPositive();
                    assertThat(ex.getCode()).isEqualTo("attendance.write_conflict");
                });
    }

    @Test
    @DisplayName("an update that loses to a concurrent write re-reads the winner and applies the change on top")
    void staleUpdateIsRetriedAgainstFreshRecord() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        AttendanceRecord concurrentWinner = new AttendanceRecord(studentId, TODAY, AttendanceStatus.ABSENT, hodId,
                OffsetDateTime.parse("2024-03-31T11:59:00Z"));
        store.commitConcurrentlyBeforeNextUpdate(concurrentWinner);

        MarkResult result = writer.markAttendance(studentId, TODAY, AttendanceStatus.LATE, teacherId);

        assertThat(result.outcome()).isEqualTo(MarkOutcome.UPDATED);
        assertThat(result.record()).isSameAs(concurrentWinner);
        assertThat(store.conflictCount()).isEqualTo(1);
        assertThat(store.updateCount()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(1);
        AttendanceRecord stored = store.findOne(studentId, TODAY).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AttendanceStatus.LATE);
        assertThat(stored.getCreatedBy()).isEqualTo(hodId);
        assertThat(stored.getUpdatedBy()).isEqualTo(teacherId);
    }

    @Test
    @DisplayName("a concurrent write with the requested status turns the retry into a no-op")
    void staleUpdateMatchingWinnerIsUnchanged() {
        writer.markAttendance(studentId, TODAY, AttendanceStatus.PRESENT, teacherId);
        store.commitConcurrentlyBeforeNextUpdate(new AttendanceRecord(studentId, TODAY, AttendanceStatus.LATE, hodId,
                OffsetDateTime.parse("2024-03-31T11:59:00Z")));

        MarkResult result = writer.markAttendance(studentId, TODAY, AttendanceStatus.LATE, teacherId);

        assertThat(result.outcome()).isEqualTo(MarkOutcome.UNCHANGED);
        assertThat(result.record().getCreatedBy()).isEqualTo(hodId);
        assertThat(store.conflictCount()).isEqualTo(1);
        assertThat(store.updateCount()).isEqualTo(1);
    }
}
