package com.rollcall.backend.modules.attendance.application;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

import com.rollcall.backend.global.error.ValidationException;

import org.springframework.stereotype.Component;

/**
 * The one calendar attendance days are computed in: UTC. Instants, client timestamps and "today" all
 * resolve to a {@link LocalDate} here, so a day means the same thing on the write and read paths.
 */
@Component
public class AttendanceCalendar {

    public static final ZoneOffset ZONE = ZoneOffset.UTC;

    private final Clock clock;

    public AttendanceCalendar(Clock clock) {
        this.clock = clock;
    }

    public LocalDate today() {
        return dayOf(clock.instant());
    }

    public OffsetDateTime now() {
        return OffsetDateTime.ofInstant(clock.instant(), ZONE);
    }

    public LocalDate dayOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZONE);
    }

    public LocalDate dayOf(OffsetDateTime timestamp) {
        return dayOf(timestamp.toInstant());
    }

    public boolean isFuture(LocalDate day) {
        return day.isAfter(today());
    }

    /**
     * Accepts {@code 2024-03-31}, {@code 2024-03-31T23:59:59} (read as UTC) or a timestamp with an offset,
     * which is normalized to UTC before the day is taken.
     *
     * @throws ValidationException when the value is blank or not ISO-8601
     */
    public LocalDate parseDay(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("attendance.invalid_date", "date is required");
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed);
            }
            if (hasOffset(trimmed)) {
                return dayOf(OffsetDateTime.parse(trimmed));
            }
            return LocalDateTime.parse(trimmed).toLocalDate();
        } catch (DateTimeParseException ex) {
            throw new ValidationException("attendance.invalid_date", "Not an ISO-8601 date: " + value);
        }
    }

    private static boolean hasOffset(String value) {
        int timeStart = value.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = value.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }
}
