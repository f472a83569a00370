package com.microblog.admin.adapter.in.web;

import com.microblog.admin.application.port.in.GetStatsUseCase;
import com.microblog.admin.application.port.in.RegisterUserUseCase;
import com.microblog.admin.application.port.in.RegisterUserUseCase.RegisteredUser;
import com.microblog.admin.application.port.out.AdminDataPort.DataCounts;
import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.exception.ApiKeyInUseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(AdminController.class)
@Import(AppProperties.class)
class AdminControllerTest {

    private static final String ADMIN_TOKEN = "operator-secret";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AppProperties appProperties;

    @MockBean
    private RegisterUserUseCase registerUserUseCase;

    @MockBean
    private GetStatsUseCase getStatsUseCase;

    @MockBean
    private VerifyCredentialUseCase verifyCredentialUseCase;

    @BeforeEach
    void setUp() {
        appProperties.getSecurity().setAdminToken(ADMIN_TOKEN);
    }

    @Test
    void shouldRegisterUser() throws Exception {
        when(registerUserUseCase.registerUser("Alice", "alice_key"))
            .thenReturn(new RegisteredUser(2, "Alice", "alice_key"));

        mockMvc.perform(post("/api/v1/admin/users")
                .header("X-Admin-Token", ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Alice\",\"apiKey\":\"alice_key\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(2))
            .andExpect(jsonPath("$.apiKey").value("alice_key"));

        verifyNoInteractions(verifyCredentialUseCase);
    }

    @Test
    void shouldRejectWrongAdminToken() throws Exception {
        mockMvc.perform(post("/api/v1/admin/users")
                .header("X-Admin-Token", "guess")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Mallory\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("ADMIN_TOKEN_INVALID"));

        verify(registerUserUseCase, never()).registerUser(any(), any());
    }

    @Test
    void shouldRejectUserApiKeyOnAdminPath() throws Exception {
        mockMvc.perform(get("/api/v1/admin/stats").header("api-key", "test"))
            .andExpect(status().isForbidden());
    }

    @Test
    void shouldReportTakenApiKey() throws Exception {
        when(registerUserUseCase.registerUser("Nick", "test")).thenThrow(new ApiKeyInUseException());

        mockMvc.perform(post("/api/v1/admin/users")
                .header("X-Admin-Token", ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Nick\",\"apiKey\":\"test\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("API_KEY_IN_USE"));
    }

    @Test
    void shouldRejectBlankName() throws Exception {
        mockMvc.perform(post("/api/v1/admin/users")
                .header("X-Admin-Token", ADMIN_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnStats() throws Exception {
        when(getStatsUseCase.getStats()).thenReturn(new DataCounts(5, 4, 3, 2, 1));

        mockMvc.perform(get("/api/v1/admin/stats").header("X-Admin-Token", ADMIN_TOKEN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.users").value(5))
            .andExpect(jsonPath("$.media").value(1));
    }
}
