package com.contacthub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.contacthub.backend.modules.auth.application.AccountMailer;
import com.contacthub.backend.modules.session.application.SessionCache;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Whole account lifecycle against real PostgreSQL and Redis. Skipped when Docker is absent.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class AuthFlowIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("contacthub_test")
            .withUsername("contacthub")
            .withPassword("contacthub");

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>("redis:7.2-alpine")
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureBackingStores(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.data.redis.host", REDIS::getHost);
        registry.add("spring.data.redis.port", () -> REDIS.getMappedPort(6379));
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SessionCache sessionCache;

    @MockBean
    private AccountMailer accountMailer;

    @Test
    void registerConfirmLoginAndResetPassword() throws Exception {
        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"alice","email":"alice@example.com","password":"pw123456"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.verified").value(false));

        mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"alice2","email":"ALICE@example.com","password":"pw123456"}
                                """))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("pw123456")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("EMAIL_NOT_VERIFIED"));

        ArgumentCaptor<String> verifyLink = ArgumentCaptor.forClass(String.class);
        verify(accountMailer, timeout(5_000)).sendVerificationEmail(eq("alice@example.com"), eq("alice"), verifyLink.capture());
        mockMvc.perform(get("/auth/confirmed_email/" + lastSegment(verifyLink.getValue())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Email successfully verified."));

        String accessToken = login("pw123456");
        assertThat(sessionCache.get("alice")).isPresent();

        mockMvc.perform(get("/users/me").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.role").value("USER"));

        mockMvc.perform(post("/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email":"alice@example.com"}
                                """))
                .andExpect(status().isOk());
        ArgumentCaptor<String> resetLink = ArgumentCaptor.forClass(String.class);
        verify(accountMailer, timeout(5_000)).sendPasswordResetEmail(eq("alice@example.com"), eq("alice"), resetLink.capture());

        mockMvc.perform(post("/auth/reset-password/" + lastSegment(resetLink.getValue()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"newPassword":"new-password-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password successfully changed"));
        assertThat(sessionCache.get("alice")).isEmpty();

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("pw123456")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
        assertThat(login("new-password-1")).isNotBlank();
    }

    @Test
    void protectedRoutesRequireBearerToken() throws Exception {
        mockMvc.perform(get("/users/me"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/users/me").header("Authorization", "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    private String login(String password) throws Exception {
        String body = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(password)))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.path("accessToken").asText();
    }

    private static String loginBody(String password) {
        return "{\"email\":\"alice@example.com\",\"password\":\"" + password + "\"}";
    }

    private static String lastSegment(String link) {
        return link.substring(link.lastIndexOf('/') + 1);
    }
}
