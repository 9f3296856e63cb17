package com.rollcall.backend.modules.attendance;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rollcall.backend.modules.attendance.application.AggregationEngine;
import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.attendance.domain.AttendanceSummary;
import com.rollcall.backend.modules.attendance.domain.DailyTally;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AggregationEngineTest {

    private static final UUID STUDENT = UUID.fromString("00000000-0000-0000-0000-000000000201");
    private static final UUID OTHER_STUDENT = UUID.fromString("00000000-0000-0000-0000-000000000202");
    private static final UUID TEACHER = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final OffsetDateTime T0 = OffsetDateTime.parse("2024-03-01T08:00:00Z");

    private final AggregationEngine engine = new AggregationEngine();

    @Test
    @DisplayName("no records gives zero counts and 0%")
    void emptyInputIsZero() {
        AttendanceSummary summary = engine.summarize(STUDENT, List.of());

        assertThat(summary).isEqualTo(AttendanceSummary.empty(STUDENT));
    }

    @Test
    @DisplayName("adding a present day moves 2 of 3 (67%) to 3 of 4 (75%)")
    void presentDayRaisesPercentage() {
        List<AttendanceRecord> records = new ArrayList<>(List.of(
                record(STUDENT, "2024-03-01", AttendanceStatus.PRESENT),
                record(STUDENT, "2024-03-02", AttendanceStatus.PRESENT),
                record(STUDENT, "2024-03-03", AttendanceStatus.ABSENT)
        ));
        assertThat(engine.summarize(STUDENT, records).attendancePercentage()).isEqualTo(67);

        records.add(record(STUDENT, "2024-03-04", AttendanceStatus.PRESENT));
        AttendanceSummary summary = engine.summarize(STUDENT, records);

        assertThat(summary.attendancePercentage()).isEqualTo(75);
        assertThat(summary.presentDays()).isEqualTo(3);
        assertThat(summary.absentDays()).isEqualTo(1);
        assertThat(summary.totalDays()).isEqualTo(4);
    }

    @Test
    @DisplayName("late days count half and rounding is half-up")
    void lateWeightIsHalf() {
        List<AttendanceRecord> records = List.of(
                record(STUDENT, "2024-03-01", AttendanceStatus.LATE),
                record(STUDENT, "2024-03-02", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-03", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-04", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-05", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-06", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-07", AttendanceStatus.ABSENT),
                record(STUDENT, "2024-03-08", AttendanceStatus.ABSENT)
        );

        // 0.5 / 8 = 6.25%
        AttendanceSummary summary = engine.summarize(STUDENT, records);

        assertThat(summary.lateDays()).isEqualTo(1);
        assertThat(summary.attendancePercentage()).isEqualTo(6);
        assertThat(AggregationEngine.percentage(0, 1, 4)).isEqualTo(13);
        assertThat(AggregationEngine.percentage(1, 1, 2)).isEqualTo(75);
        assertThat(AggregationEngine.percentage(0, 2, 2)).isEqualTo(50);
    }

    @Test
    void totalIsSumOfCounts() {
        List<AttendanceRecord> records = List.of(
                record(STUDENT, "2024-03-01", AttendanceStatus.PRESENT),
                record(STUDENT, "2024-03-02", AttendanceStatus.LATE),
                record(STUDENT, "2024-03-03", AttendanceStatus.ABSENT),
                record(OTHER_STUDENT, "2024-03-01", AttendanceStatus.ABSENT)
        );

        AttendanceSummary summary = engine.summarize(STUDENT, records);

        assertThat(summary.totalDays())
                .isEqualTo(summary.presentDays() + summary.absentDays() + summary.lateDays())
                .isEqualTo(3);
        assertThat(summary.attendancePercentage()).isEqualTo(50);
    }

    @Test
    @DisplayName("duplicate rows for one day collapse to the most recently written")
    void duplicatesCollapseToLatest() {
        AttendanceRecord first = record(STUDENT, "2024-03-01", AttendanceStatus.ABSENT);
        AttendanceRecord second = new AttendanceRecord(STUDENT, LocalDate.parse("2024-03-01"),
                AttendanceStatus.PRESENT, TEACHER, T0.plusHours(2));

        AttendanceSummary summary = engine.summarize(STUDENT, List.of(second, first));

        assertThat(summary.totalDays()).isEqualTo(1);
        assertThat(summary.presentDays()).isEqualTo(1);
        assertThat(summary.attendancePercentage()).isEqualTo(100);
    }

    @Test
    void updatedRecordWinsOverLaterCreatedDuplicate() {
        AttendanceRecord updated = record(STUDENT, "2024-03-01", AttendanceStatus.PRESENT);
        updated.changeStatus(AttendanceStatus.LATE, TEACHER, T0.plusHours(5));
        AttendanceRecord stale = new AttendanceRecord(STUDENT, LocalDate.parse("2024-03-01"),
                AttendanceStatus.ABSENT, TEACHER, T0.plusHours(1));

        AttendanceSummary summary = engine.summarize(STUDENT, List.of(updated, stale));

        assertThat(summary.lateDays()).isEqualTo(1);
        assertThat(summary.totalDays()).isEqualTo(1);
    }

    @Test
    void summarizeByStudentGroupsRecords() {
        Map<UUID, AttendanceSummary> summaries = engine.summarizeByStudent(List.of(
                record(STUDENT, "2024-03-01", AttendanceStatus.PRESENT),
                record(OTHER_STUDENT, "2024-03-01", AttendanceStatus.ABSENT),
                record(OTHER_STUDENT, "2024-03-02", AttendanceStatus.PRESENT)
        ));

        assertThat(summaries).containsOnlyKeys(STUDENT, OTHER_STUDENT);
        assertThat(summaries.get(STUDENT).attendancePercentage()).isEqualTo(100);
        assertThat(summaries.get(OTHER_STUDENT).attendancePercentage()).isEqualTo(50);
    }

    @Test
    void tallyDayCountsUnmarkedAgainstRoster() {
        LocalDate day = LocalDate.parse("2024-03-01");
        DailyTally tally = engine.tallyDay(day, List.of(
                record(STUDENT, "2024-03-01", AttendanceStatus.LATE),
                record(OTHER_STUDENT, "2024-03-01", AttendanceStatus.PRESENT),
                record(OTHER_STUDENT, "2024-03-02", AttendanceStatus.ABSENT)
        ), 5);

        assertThat(tally.present()).isEqualTo(1);
        assertThat(tally.late()).isEqualTo(1);
        assertThat(tally.absent()).isZero();
        assertThat(tally.unmarked()).isEqualTo(3);
    }

    private static AttendanceRecord record(UUID studentId, String date, AttendanceStatus status) {
        return new AttendanceRecord(studentId, LocalDate.parse(date), status, TEACHER, T0);
    }
}
