package com.rollcall.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rollcall.backend.modules.auth.domain.AppUser;
import com.rollcall.backend.modules.auth.domain.UserRole;
import com.rollcall.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.rollcall.backend.support.AbstractPostgresIntegrationTest;
import com.rollcall.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AuthIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String DEVICE_ID = "integration-device";
    private static final String PASSWORD = "Secret123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private UserSessionRepository userSessionRepository;

    @Test
    void hodLoginReturnsTokensAndProfile() throws Exception {
        testUserFactory.ensureHod("hod@rollcall.test", PASSWORD);

        JsonNode login = login("hod@rollcall.test", "HOD");

        assertThat(login.path("user").path("role").asText()).isEqualTo("HOD");
        String accessToken = login.path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("hod@rollcall.test"))
                .andExpect(jsonPath("$.role").value("HOD"));
    }

    @Test
    void loginWithWrongRoleIsForbiddenAndOpensNoSession() throws Exception {
        testUserFactory.ensureTeacher("teacher@rollcall.test", PASSWORD);

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("teacher@rollcall.test", PASSWORD, "STUDENT")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.role_mismatch"));

        assertThat(userSessionRepository.count()).isZero();
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        testUserFactory.ensureStudent("student@rollcall.test", PASSWORD);

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("student@rollcall.test", "not-the-password", "STUDENT")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.invalid_credentials"));
    }

    @Test
    void changedRoleInvalidatesIssuedAccessToken() throws Exception {
        AppUser teacher = testUserFactory.ensureTeacher("demoted@rollcall.test", PASSWORD);
        String accessToken = login("demoted@rollcall.test", "TEACHER").path("tokens").path("accessToken").asText();

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk());

        testUserFactory.changeRole(teacher, UserRole.STUDENT);

        mockMvc.perform(get("/profile/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("auth.role_mismatch"));
    }

    @Test
    void refreshRotatesRefreshToken() throws Exception {
        testUserFactory.ensureStudent("rotate@rollcall.test", PASSWORD);
        String refreshToken = login("rotate@rollcall.test", "STUDENT").path("tokens").path("refreshToken").asText();

        MvcResult refreshed = mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"%s\",\"deviceId\":\"%s\"}".formatted(refreshToken, DEVICE_ID)))
                .andExpect(status().isOk())
                .andReturn();
        String rotated = objectMapper.readTree(refreshed.getResponse().getContentAsString())
                .path("tokens").path("refreshToken").asText();

        assertThat(rotated).isNotBlank().isNotEqualTo(refreshToken);

        mockMvc.perform(post("/auth/refresh")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"refreshToken\":\"%s\",\"deviceId\":\"%s\"}".formatted(refreshToken, DEVICE_ID)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void profileWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/profile/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("auth.unauthenticated"));
    }

    private JsonNode login(String email, String role) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email, PASSWORD, role)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String loginBody(String email, String password, String role) {
        return """
                {"email":"%s","password":"%s","role":"%s","deviceId":"%s"}
                """.formatted(email, password, role, DEVICE_ID);
    }
}
