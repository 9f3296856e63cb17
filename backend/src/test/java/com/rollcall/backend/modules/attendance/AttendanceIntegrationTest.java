package com.rollcall.backend.modules.attendance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.rollcall.backend.modules.attendance.application.AttendanceWriter;
import com.rollcall.backend.modules.attendance.domain.AttendanceStatus;
import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.support.AbstractPostgresIntegrationTest;
import com.rollcall.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AttendanceIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Secret123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private AttendanceWriter attendanceWriter;

    private AppUser teacher;
    private AppUser student;
    private AppUser otherStudent;
    private LocalDate yesterday;

    @BeforeEach
    void setUp() {
        teacher = testUserFactory.ensureTeacher("teacher@rollcall.test", PASSWORD);
        student = testUserFactory.ensureStudent("alice@rollcall.test", PASSWORD);
        otherStudent = testUserFactory.ensureStudent("bob@rollcall.test", PASSWORD);
        yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1);
    }

    @Test
    void markingTwiceKeepsSingleRecord() throws Exception {
        String token = accessToken("teacher@rollcall.test", "TEACHER");

        mockMvc.perform(put("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(markBody(student.getId(), yesterday, "PRESENT")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome").value("CREATED"));

        mockMvc.perform(put("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(markBody(student.getId(), yesterday, "PRESENT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("UNCHANGED"));

        mockMvc.perform(put("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(markBody(student.getId(), yesterday, "LATE")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("UPDATED"))
                .andExpect(jsonPath("$.record.status").value("LATE"));

        assertThat(recordCount(student.getId())).isEqualTo(1);
    }

    @Test
    void studentCannotMarkAttendance() throws Exception {
        String token = accessToken("alice@rollcall.test", "STUDENT");

        mockMvc.perform(put("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(markBody(student.getId(), yesterday, "PRESENT")))
                .andExpect(status().isForbidden());

        assertThat(recordCount(student.getId())).isZero();
    }

    @Test
    void futureDateIsRejected() throws Exception {
        String token = accessToken("teacher@rollcall.test", "TEACHER");

        mockMvc.perform(put("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(markBody(student.getId(), yesterday.plusDays(3), "PRESENT")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("attendance.future_date"));
    }

    @Test
    void studentCannotReadAnotherStudentsRecords() throws Exception {
        String token = accessToken("alice@rollcall.test", "STUDENT");

        mockMvc.perform(get("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .param("studentId", otherStudent.getId().toString())
                        .param("from", yesterday.minusDays(7).toString())
                        .param("to", yesterday.toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.forbidden"));

        mockMvc.perform(get("/attendance")
                        .header("Authorization", "Bearer " + token)
                        .param("studentId", student.getId().toString())
                        .param("from", yesterday.minusDays(7).toString())
                        .param("to", yesterday.toString()))
                .andExpect(status().isOk());
    }

    @Test
    void summaryReflectsMarkedDays() throws Exception {
        attendanceWriter.markAttendance(student.getId(), yesterday.minusDays(2), AttendanceStatus.PRESENT, teacher.getId());
        attendanceWriter.markAttendance(student.getId(), yesterday.minusDays(1), AttendanceStatus.LATE, teacher.getId());
        attendanceWriter.markAttendance(student.getId(), yesterday, AttendanceStatus.ABSENT, teacher.getId());
        String token = accessToken("alice@rollcall.test", "STUDENT");

        mockMvc.perform(get("/attendance/summary")
                        .header("Authorization", "Bearer " + token)
                        .param("from", yesterday.minusDays(2).toString())
                        .param("to", yesterday.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDays").value(3))
                .andExpect(jsonPath("$.lateDays").value(1))
                .andExpect(jsonPath("$.attendancePercentage").value(50));
    }

    @Test
    void concurrentMarksOfEmptySlotLeaveOneRecord() throws Exception {
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AttendanceWriter.MarkResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return attendanceWriter.markAttendance(student.getId(), yesterday, AttendanceStatus.PRESENT, teacher.getId());
                }));
            }
            start.countDown();
            for (Future<AttendanceWriter.MarkResult> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).record().getStatus()).isEqualTo(AttendanceStatus.PRESENT);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(recordCount(student.getId())).isEqualTo(1);
        assertThat(futures.stream().filter(f -> outcomeOf(f) == AttendanceWriter.MarkOutcome.CREATED).count())
                .isEqualTo(1);
    }

    private AttendanceWriter.MarkOutcome outcomeOf(Future<AttendanceWriter.MarkResult> future) {
        try {
            return future.get().outcome();
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }

    private int recordCount(UUID studentId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM attendance_record WHERE student_id = ?", Integer.class, studentId);
        return count == null ? 0 : count;
    }

    private String accessToken(String email, String role) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"%s","password":"%s","role":"%s","deviceId":"it"}
                                """.formatted(email, PASSWORD, role)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString())
                .path("tokens").path("accessToken").asText();
    }

    private static String markBody(UUID studentId, LocalDate date, String status) {
        return """
                {"studentId":"%s","date":"%s","status":"%s"}
                """.formatted(studentId, date, status);
    }
}
