package com.microblog.adapter.in.web;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.GetFollowStatsUseCase;
import com.microblog.application.port.in.GetFollowersUseCase;
import com.microblog.application.port.in.GetFollowingUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.error.ValidationError;
import com.microblog.domain.model.FollowStats;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(FollowController.class)
@Import(AppProperties.class)
class FollowControllerTest {

    private static final User NICK = new User(UserId.of(1), "Nick");
    private static final User ALICE = new User(UserId.of(2), "Alice");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FollowUserUseCase followUserUseCase;

    @MockBean
    private UnfollowUserUseCase unfollowUserUseCase;

    @MockBean
    private GetFollowersUseCase getFollowersUseCase;

    @MockBean
    private GetFollowingUseCase getFollowingUseCase;

    @MockBean
    private GetFollowStatsUseCase getFollowStatsUseCase;

    @MockBean
    private VerifyCredentialUseCase verifyCredentialUseCase;

    @BeforeEach
    void setUp() {
        when(verifyCredentialUseCase.verifyCredential("test")).thenReturn(Result.success(NICK));
    }

    @Test
    void shouldFollowUser() throws Exception {
        when(followUserUseCase.followUser(NICK.id(), ALICE.id())).thenReturn(Result.success(null));

        mockMvc.perform(post("/api/v1/users/2/follow").header("api-key", "test"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.followerId").value(1))
            .andExpect(jsonPath("$.followeeId").value(2))
            .andExpect(jsonPath("$.status").value("followed"));
    }

    @Test
    void shouldRejectSelfFollow() throws Exception {
        when(followUserUseCase.followUser(NICK.id(), NICK.id()))
            .thenReturn(Result.failure(new FollowError.ValidationFailed(
                ValidationError.FollowValidationError.SelfFollow.INSTANCE)));

        mockMvc.perform(post("/api/v1/users/1/follow").header("api-key", "test"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("SELF_FOLLOW"));
    }

    @Test
    void shouldReportDuplicateFollowAsConflict() throws Exception {
        when(followUserUseCase.followUser(NICK.id(), ALICE.id()))
            .thenReturn(Result.failure(new FollowError.AlreadyFollowing(NICK.id(), ALICE.id())));

        mockMvc.perform(post("/api/v1/users/2/follow").header("api-key", "test"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_FOLLOWING"));
    }

    @Test
    void shouldReportUnknownFollowee() throws Exception {
        when(followUserUseCase.followUser(NICK.id(), UserId.of(99)))
            .thenReturn(Result.failure(new FollowError.UserNotFound(UserId.of(99))));

        mockMvc.perform(post("/api/v1/users/99/follow").header("api-key", "test"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectMalformedTargetId() throws Exception {
        mockMvc.perform(post("/api/v1/users/bob/follow").header("api-key", "test"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USER_ID_INVALID_FORMAT"));

        verify(followUserUseCase, never()).followUser(any(), any());
    }

    @Test
    void shouldUnfollowUser() throws Exception {
        when(unfollowUserUseCase.unfollow(NICK.id(), ALICE.id())).thenReturn(Result.success(null));

        mockMvc.perform(delete("/api/v1/users/2/follow").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("unfollowed"));
    }

    @Test
    void shouldReportMissingFollowOnUnfollow() throws Exception {
        when(unfollowUserUseCase.unfollow(NICK.id(), ALICE.id()))
            .thenReturn(Result.failure(new FollowError.NotFollowing(NICK.id(), ALICE.id())));

        mockMvc.perform(delete("/api/v1/users/2/follow").header("api-key", "test"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOLLOWING"));
    }

    @Test
    void shouldListFollowers() throws Exception {
        when(getFollowersUseCase.getFollowers(ALICE.id())).thenReturn(List.of(NICK));

        mockMvc.perform(get("/api/v1/users/2/followers").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(1))
            .andExpect(jsonPath("$[0].name").value("Nick"));
    }

    @Test
    void shouldListFollowing() throws Exception {
        when(getFollowingUseCase.getFollowing(NICK.id())).thenReturn(List.of(ALICE));

        mockMvc.perform(get("/api/v1/users/1/following").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Alice"));
    }

    @Test
    void shouldReturnFollowStats() throws Exception {
        when(getFollowStatsUseCase.getFollowStats(NICK.id())).thenReturn(new FollowStats(3, 4));

        mockMvc.perform(get("/api/v1/users/1/follow-stats").header("api-key", "test"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.followers").value(3))
            .andExpect(jsonPath("$.following").value(4));
    }

    @Test
    void shouldReturnNotFoundForUnknownUser() throws Exception {
        when(getFollowersUseCase.getFollowers(UserId.of(99))).thenThrow(new UserNotFoundException(UserId.of(99)));
        when(getFollowingUseCase.getFollowing(UserId.of(99))).thenThrow(new UserNotFoundException(UserId.of(99)));
        when(getFollowStatsUseCase.getFollowStats(UserId.of(99))).thenThrow(new UserNotFoundException(UserId.of(99)));

        for (String path : List.of("followers", "following", "follow-stats")) {
            mockMvc.perform(get("/api/v1/users/99/" + path).header("api-key", "test"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("USER_NOT_FOUND"));
        }
    }
}
