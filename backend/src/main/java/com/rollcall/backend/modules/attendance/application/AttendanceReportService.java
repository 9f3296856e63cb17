package com.rollcall.backend.modules.attendance.application;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceSummary;
import com.rollcall.backend.modules.attendance.domain.DailyTally;
import com.rollcall.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.AttendanceSummaryResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.ClassSummaryResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.DayAttendanceResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.MonthlyAttendanceResponse;
import com.rollcall.backend.modules.auth.application.AuthorizedSession;
import com.rollcall.backend.modules.auth.application.RoleGate;
import com.rollcall.backend.modules.auth.application.UserDirectory;
import com.rollcall.backend.modules.auth.application.UserDirectory.DirectoryEntry;
import com.rollcall.backend.modules.auth.domain.UserRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read views built from {@link AttendanceReader} and {@link AggregationEngine}: the student dashboard
 * (range and monthly summaries) and the teacher dashboard (day roster and class summary).
 */
@Service
@Transactional(readOnly = true)
public class AttendanceReportService {

    private final AttendanceReader attendanceReader;
    private final AggregationEngine aggregationEngine;
    private final UserDirectory userDirectory;
    private final RoleGate roleGate;

    public AttendanceReportService(
            AttendanceReader attendanceReader,
            AggregationEngine aggregationEngine,
            UserDirectory userDirectory,
            RoleGate roleGate
    ) {
        this.attendanceReader = attendanceReader;
        this.aggregationEngine = aggregationEngine;
        this.userDirectory = userDirectory;
        this.roleGate = roleGate;
    }

    public AttendanceSummaryResponse summarize(UUID callerId, UUID studentId, LocalDate from, LocalDate to) {
        UUID subject = requireStudentSubject(callerId, studentId);
        List<AttendanceRecord> records = attendanceReader.queryRange(subject, from, to);
        return AttendanceSummaryResponse.of(aggregationEngine.summarize(subject, records), from, to);
    }

    public MonthlyAttendanceResponse monthly(UUID callerId, UUID studentId, int year, int month) {
        if (month < 1 || month > 12) {
            throw new ValidationException("attendance.invalid_month", "month must be between 1 and 12");
        }
        YearMonth period;
        try {
            period = YearMonth.of(year, month);
        } catch (DateTimeException ex) {
            throw new ValidationException("attendance.invalid_month", "No such month: " + year + "-" + month);
        }
        UUID subject = requireStudentSubject(callerId, studentId);
        LocalDate from = period.atDay(1);
        LocalDate to = period.atEndOfMonth();

        List<AttendanceRecord> records = attendanceReader.queryRange(subject, from, to);
        AttendanceSummary summary = aggregationEngine.summarize(subject, records);
        return new MonthlyAttendanceResponse(
                subject,
                year,
                month,
                AttendanceSummaryResponse.of(summary, from, to),
                records.stream().map(AttendanceRecordResponse::from).toList()
        );
    }

    /**
     * Every active student, including those with no records in the range (0%).
     */
    public ClassSummaryResponse classSummary(UUID callerId, LocalDate from, LocalDate to) {
        roleGate.requireRole(callerId, UserRole.TEACHER, UserRole.HOD);
        List<AttendanceRecord> records = attendanceReader.queryRange(null, from, to);
        Map<UUID, AttendanceSummary> byStudent = aggregationEngine.summarizeByStudent(records);

        List<ClassSummaryResponse.StudentSummary> students = userDirectory.listByRole(UserRole.STUDENT).stream()
                .map(student -> {
                    AttendanceSummary summary = byStudent.getOrDefault(student.userId(),
                            AttendanceSummary.empty(student.userId()));
                    return new ClassSummaryResponse.StudentSummary(
                            student.userId(),
                            student.fullName(),
                            student.enrollmentId(),
                            summary.presentDays(),
                            summary.absentDays(),
                            summary.lateDays(),
                            summary.totalDays(),
                            summary.attendancePercentage()
                    );
                })
                .toList();
        return new ClassSummaryResponse(from, to, students);
    }

    public DayAttendanceResponse day(UUID callerId, LocalDate date) {
        List<AttendanceRecord> dayRecords = attendanceReader.findDay(callerId, date);
        List<DirectoryEntry> roster = userDirectory.listByRole(UserRole.STUDENT);
        Set<UUID> rosterIds = roster.stream().map(DirectoryEntry::userId).collect(Collectors.toSet());

        List<AttendanceRecord> rosterRecords = dayRecords.stream()
                .filter(record -> rosterIds.contains(record.getStudentId()))
                .toList();
        DailyTally tally = aggregationEngine.tallyDay(date, rosterRecords, roster.size());
        Map<UUID, AttendanceRecord> byStudent = rosterRecords.stream()
                .collect(Collectors.toMap(AttendanceRecord::getStudentId, Function.identity(), AttendanceReportService::later));

        List<DayAttendanceResponse.RosterEntry> students = roster.stream()
                .map(student -> {
                    AttendanceRecord record = byStudent.get(student.userId());
                    return new DayAttendanceResponse.RosterEntry(
                            student.userId(),
                            student.fullName(),
                            student.enrollmentId(),
                            record != null ? record.getStatus() : null,
                            record != null ? record.getId() : null
                    );
                })
                .toList();
        return new DayAttendanceResponse(date, tally.present(), tally.late(), tally.absent(), tally.unmarked(), students);
    }

    /**
     * Resolves whose summary is shown. A student defaults to themself; staff must name a student.
     */
    private UUID requireStudentSubject(UUID callerId, UUID studentId) {
        if (studentId != null) {
            roleGate.requireReadScope(callerId, studentId);
            return studentId;
        }
        AuthorizedSession session = roleGate.requireRole(callerId, UserRole.STUDENT, UserRole.TEACHER, UserRole.HOD);
        if (session.role() != UserRole.STUDENT) {
            throw new ValidationException("attendance.student_required", "studentId is required");
        }
        return session.userId();
    }

    private static AttendanceRecord later(AttendanceRecord left, AttendanceRecord right) {
        if (left.lastWrittenAt() == null) {
            return right;
        }
        if (right.lastWrittenAt() == null) {
            return left;
        }
        return right.lastWrittenAt().isBefore(left.lastWrittenAt()) ? left : right;
    }
}
