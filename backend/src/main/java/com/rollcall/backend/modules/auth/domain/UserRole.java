package com.rollcall.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The single role a user holds. HOD is the department head.
 */
public enum UserRole {
    STUDENT,
    TEACHER,
    HOD;

    @JsonValue
    public String code() {
        return name();
    }

    /**
     * Parses a role code case-insensitively ("teacher", "HOD").
     *
     * @throws IllegalArgumentException for null or unknown codes
     */
    @JsonCreator
    public static UserRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("role is required");
        }
        try {
            return UserRole.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown role: " + code, ex);
        }
    }
}
