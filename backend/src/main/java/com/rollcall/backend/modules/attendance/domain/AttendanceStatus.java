package com.rollcall.backend.modules.attendance.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceStatus {
    PRESENT,
    ABSENT,
    LATE;

    @JsonValue
    public String code() {
        return name();
    }

    @JsonCreator
    public static AttendanceStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return AttendanceStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown attendance status: " + code, ex);
        }
    }
}
