package com.rollcall.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rollcall.backend.global.error.ValidationException;
import com.rollcall.backend.global.security.SecurityUtils;
import com.rollcall.backend.modules.attendance.application.AttendanceCalendar;
import com.rollcall.backend.modules.attendance.application.AttendanceReader;
import com.rollcall.backend.modules.attendance.application.AttendanceReportService;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkOutcome;
import com.rollcall.backend.modules.attendance.application.AttendanceWriter.MarkResult;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.AttendanceSummaryResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.ClassSummaryResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.DayAttendanceResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.MarkAttendanceRequest;
import com.rollcall.backend.modules.attendance.presentation.dto.MarkAttendanceResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.MarkDayRequest;
import com.rollcall.backend.modules.attendance.presentation.dto.MarkDayResponse;
import com.rollcall.backend.modules.attendance.presentation.dto.MonthlyAttendanceResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/attendance")
public class AttendanceController {

    private final AttendanceWriter attendanceWriter;
    private final AttendanceReader attendanceReader;
    private final AttendanceReportService attendanceReportService;
    private final AttendanceCalendar calendar;

    public AttendanceController(
            AttendanceWriter attendanceWriter,
            AttendanceReader attendanceReader,
            AttendanceReportService attendanceReportService,
            AttendanceCalendar calendar
    ) {
        this.attendanceWriter = attendanceWriter;
        this.attendanceReader = attendanceReader;
        this.attendanceReportService = attendanceReportService;
        this.calendar = calendar;
    }

    @Operation(
            summary = "Mark one student's attendance for a day",
            description = """
                    Creates the record for (studentId, date) or changes its status. \
                    Repeating the same status is a no-op and returns outcome `UNCHANGED`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Record created"),
            @ApiResponse(responseCode = "200", description = "Record updated or unchanged"),
            @ApiResponse(responseCode = "400", description = "Future date, unknown status or user is not a student"),
            @ApiResponse(responseCode = "403", description = "Caller is not a teacher or department head"),
            @ApiResponse(responseCode = "409", description = "Concurrent writes kept colliding; retry after `Retry-After`")
    })
    @PutMapping
    public ResponseEntity<MarkAttendanceResponse> mark(@Valid @RequestBody MarkAttendanceRequest request) {
        LocalDate date = calendar.parseDay(request.date());
        MarkResult result = attendanceWriter.markAttendance(
                request.studentId(), date, request.status(), SecurityUtils.getCurrentUserId());
        HttpStatus status = result.outcome() == MarkOutcome.CREATED ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(MarkAttendanceResponse.from(result));
    }

    @Operation(summary = "Mark several students for one day", description = "All entries are validated before any is written.")
    @PutMapping("/days/{date}")
    public ResponseEntity<MarkDayResponse> markDay(
            @PathVariable("date") String date,
            @Valid @RequestBody MarkDayRequest request
    ) {
        LocalDate day = calendar.parseDay(date);
        Map<UUID, AttendanceStatus> entries = new LinkedHashMap<>();
        for (MarkDayRequest.Entry entry : request.entries()) {
            if (entries.putIfAbsent(entry.studentId(), entry.status()) != null) {
                throw new ValidationException("attendance.duplicate_entry",
                        "Student " + entry.studentId() + " appears more than once");
            }
        }
        List<MarkResult> results = attendanceWriter.markAll(day, entries, SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(MarkDayResponse.from(day, results));
    }

    @Operation(summary = "Attendance records in an inclusive day range")
    @GetMapping
    public ResponseEntity<List<AttendanceRecordResponse>> query(
            @RequestParam(name = "studentId", required = false) UUID studentId,
            @RequestParam(name = "from") String from,
            @RequestParam(name = "to") String to
    ) {
        List<AttendanceRecordResponse> records = attendanceReader
                .queryRangeFor(SecurityUtils.getCurrentUserId(), studentId, calendar.parseDay(from), calendar.parseDay(to))
                .stream()
                .map(AttendanceRecordResponse::from)
                .toList();
        return ResponseEntity.ok(records);
    }

    @GetMapping("/days/{date}")
    public ResponseEntity<DayAttendanceResponse> day(@PathVariable("date") String date) {
        return ResponseEntity.ok(attendanceReportService.day(SecurityUtils.getCurrentUserId(), calendar.parseDay(date)));
    }

    @GetMapping("/summary")
    public ResponseEntity<AttendanceSummaryResponse> summary(
            @RequestParam(name = "studentId", required = false) UUID studentId,
            @RequestParam(name = "from") String from,
            @RequestParam(name = "to") String to
    ) {
        return ResponseEntity.ok(attendanceReportService.summarize(
                SecurityUtils.getCurrentUserId(), studentId, calendar.parseDay(from), calendar.parseDay(to)));
    }

    @GetMapping("/summary/monthly")
    public ResponseEntity<MonthlyAttendanceResponse> monthly(
            @RequestParam(name = "studentId", required = false) UUID studentId,
            @RequestParam(name = "year") int year,
            @RequestParam(name = "month") int month
    ) {
        return ResponseEntity.ok(attendanceReportService.monthly(SecurityUtils.getCurrentUserId(), studentId, year, month));
    }

    @Operation(summary = "Per-student summaries for every active student", description = "Teachers and department heads only.")
    @GetMapping("/summary/class")
    public ResponseEntity<ClassSummaryResponse> classSummary(
            @RequestParam(name = "from") String from,
            @RequestParam(name = "to") String to
    ) {
        return ResponseEntity.ok(attendanceReportService.classSummary(
                SecurityUtils.getCurrentUserId(), calendar.parseDay(from), calendar.parseDay(to)));
    }
}
