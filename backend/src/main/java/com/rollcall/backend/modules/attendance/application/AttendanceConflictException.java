package com.rollcall.backend.modules.attendance.application;

/**
 * Raised by an {@link AttendanceStore} when a write collides with a concurrent write of the same
 * (student, day) key: a duplicate insert or a stale update.
 */
public class AttendanceConflictException extends RuntimeException {

    public AttendanceConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
