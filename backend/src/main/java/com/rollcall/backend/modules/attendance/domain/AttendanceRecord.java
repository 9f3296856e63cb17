package com.rollcall.backend.modules.attendance.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * One student's status on one calendar day. {@code updatedAt} stays null until the status first changes.
 */
@Entity
@Table(
        name = "attendance_record",
        uniqueConstraints = @UniqueConstraint(
                name = AttendanceRecord.STUDENT_DAY_CONSTRAINT,
                columnNames = {"student_id", "attendance_date"}
        )
)
public class AttendanceRecord {

    public static final String STUDENT_DAY_CONSTRAINT = "uq_attendance_student_day";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "attendance_date", nullable = false, updatable = false)
    private LocalDate attendanceDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AttendanceStatus status;

    @Column(name = "created_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_by", columnDefinition = "uuid")
    private UUID updatedBy;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected AttendanceRecord() {
    }

    public AttendanceRecord(UUID studentId, LocalDate attendanceDate, AttendanceStatus status, UUID createdBy,
                            OffsetDateTime createdAt) {
        this.studentId = studentId;
        this.attendanceDate = attendanceDate;
        this.status = status;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    /**
     * @return false when {@code newStatus} equals the current status and nothing was changed
     */
    public boolean changeStatus(AttendanceStatus newStatus, UUID changedBy, OffsetDateTime changedAt) {
        if (status == newStatus) {
            return false;
        }
        this.status = newStatus;
        this.updatedBy = changedBy;
        this.updatedAt = changedAt;
        return true;
    }

    /**
     * Time of the last write, used to pick a winner among duplicate rows for one day.
     */
    public OffsetDateTime lastWrittenAt() {
        return updatedAt != null ? updatedAt : createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public LocalDate getAttendanceDate() {
        return attendanceDate;
    }

    public AttendanceStatus getStatus() {
        return status;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
