package com.rollcall.backend.modules.attendance.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

import com.rollcall.backend.modules.attendance.domain.AttendanceRecord;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.attendance.domain.AttendanceSummary;
import com.rollcall.backend.modules.attendance.domain.DailyTally;

import org.springframework.stereotype.Component;

/**
 * Derives attendance counts and percentages. Pure: no store access, no clock.
 * <p>
 * {@code percentage = round_half_up(100 * (present + LATE_WEIGHT * late) / total)}, and 0 when there are no
 * records. Every surface that shows a percentage goes through this class.
 */
@Component
public class AggregationEngine {

    public static final BigDecimal LATE_WEIGHT = new BigDecimal("0.5");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Comparator<AttendanceRecord> BY_LAST_WRITE = Comparator.comparing(
            AttendanceRecord::lastWrittenAt,
            Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder())
    );

    /**
     * Summarizes the records belonging to {@code studentId}; records of other students are ignored.
     */
    public AttendanceSummary summarize(UUID studentId, Collection<AttendanceRecord> records) {
        List<AttendanceRecord> own = records.stream()
                .filter(record -> Objects.equals(record.getStudentId(), studentId))
                .toList();
        return count(studentId, collapse(own));
    }

    public Map<UUID, AttendanceSummary> summarizeByStudent(Collection<AttendanceRecord> records) {
        Map<UUID, List<AttendanceRecord>> byStudent = collapse(records).stream()
                .collect(Collectors.groupingBy(AttendanceRecord::getStudentId, LinkedHashMap::new, Collectors.toList()));
        Map<UUID, AttendanceSummary> summaries = new LinkedHashMap<>();
        byStudent.forEach((studentId, own) -> summaries.put(studentId, count(studentId, own)));
        return summaries;
    }

    /**
     * Counts one day's statuses. Students on the roster without a record are {@code unmarked}.
     */
    public DailyTally tallyDay(LocalDate date, Collection<AttendanceRecord> records, int rosterSize) {
        int present = 0;
        int late = 0;
        int absent = 0;
        for (AttendanceRecord record : collapse(records)) {
            if (!date.equals(record.getAttendanceDate())) {
                continue;
            }
            switch (record.getStatus()) {
                case PRESENT -> present++;
                case LATE -> late++;
                case ABSENT -> absent++;
            }
        }
        int unmarked = Math.max(0, rosterSize - (present + late + absent));
        return new DailyTally(date, present, late, absent, unmarked);
    }

    public static int percentage(int presentDays, int lateDays, int totalDays) {
        if (totalDays == 0) {
            return 0;
        }
        BigDecimal attended = BigDecimal.valueOf(presentDays).add(LATE_WEIGHT.multiply(BigDecimal.valueOf(lateDays)));
        return attended.multiply(HUNDRED)
                .divide(BigDecimal.valueOf(totalDays), 0, RoundingMode.HALF_UP)
                .intValueExact();
    }

    /**
     * Keeps one record per (student, day): the most recently written. Duplicates only exist in data
     * that bypassed the writer.
     */
    List<AttendanceRecord> collapse(Collection<AttendanceRecord> records) {
        Map<DayKey, AttendanceRecord> latest = new LinkedHashMap<>();
        for (AttendanceRecord record : records) {
            latest.merge(new DayKey(record.getStudentId(), record.getAttendanceDate()), record,
                    (current, candidate) -> BY_LAST_WRITE.compare(candidate, current) >= 0 ? candidate : current);
        }
        return List.copyOf(latest.values());
    }

    private static AttendanceSummary count(UUID studentId, Collection<AttendanceRecord> records) {
        Map<AttendanceStatus, Long> counts = records.stream()
                .collect(Collectors.groupingBy(AttendanceRecord::getStatus, Collectors.counting()));
        int present = counts.getOrDefault(AttendanceStatus.PRESENT, 0L).intValue();
        int absent = counts.getOrDefault(AttendanceStatus.ABSENT, 0L).intValue();
        int late = counts.getOrDefault(AttendanceStatus.LATE, 0L).intValue();
        int total = present + absent + late;
        return new AttendanceSummary(studentId, present, absent, late, total, percentage(present, late, total));
    }

    private record DayKey(UUID studentId, LocalDate date) {
    }
}
