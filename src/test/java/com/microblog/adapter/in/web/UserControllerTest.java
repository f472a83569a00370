package com.microblog.adapter.in.web;

import com.microblog.application.port.in.GetUserProfileUseCase;
import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserProfile;
import com.microblog.infrastructure.config.AppProperties;
import com.microblog.infrastructure.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(UserController.class)
@Import(AppProperties.class)
class UserControllerTest {

    private static final User NICK = new User(UserId.of(1), "Nick");
    private static final User ALICE = new User(UserId.of(2), "Alice");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetUserProfileUseCase getUserProfileUseCase;

    @MockBean
    private VerifyCredentialUseCase verifyCredentialUseCase;

    @BeforeEach
    void setUp() {
        when(verifyCredentialUseCase.verifyCredential("test")).thenReturn(Result.success(NICK));
    }

    @Test
    void shouldReturnOwnProfile() throws Exception {
        when(getUserProfileUseCase.getProfile(NICK.id()))
            .thenReturn(new UserProfile(NICK, List.of(ALICE), List.of()));

        mockMvc.perform(get("/api/v1/users/me").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(1))
            .andExpect(jsonPath("$.name").value("Nick"))
            .andExpect(jsonPath("$.followers[0].name").value("Alice"))
            .andExpect(jsonPath("$.following").isEmpty());
    }

    @Test
    void shouldReturnOtherProfile() throws Exception {
        when(getUserProfileUseCase.getProfile(ALICE.id()))
            .thenReturn(new UserProfile(ALICE, List.of(), List.of(NICK)));

        mockMvc.perform(get("/api/v1/users/2").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.following[0].id").value(1));
    }

    @Test
    void shouldReportUnknownUser() throws Exception {
        when(getUserProfileUseCase.getProfile(UserId.of(99))).thenThrow(new UserNotFoundException(UserId.of(99)));

        mockMvc.perform(get("/api/v1/users/99").header("api-key", "test"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("USER_NOT_FOUND"));
    }

    @Test
    void shouldRejectNonPositiveId() throws Exception {
        mockMvc.perform(get("/api/v1/users/0").header("api-key", "test"))
            .andExpect(status().isBadRequest());
    }
}
