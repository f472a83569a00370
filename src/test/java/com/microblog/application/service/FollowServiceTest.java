package com.microblog.application.service;

import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.MetricsPort;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.error.ErrorKind;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.FollowStats;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.exception.StorageFailureException;
import com.microblog.infrastructure.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FollowService")
class FollowServiceTest {

    private static final UserId ALICE = UserId.of(1);
    private static final UserId BOB = UserId.of(2);

    @Mock
    private FollowRepository followRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private MetricsPort metrics;

    private FollowService followService;

    @BeforeEach
    void setUp() {
        followService = new FollowService(followRepository, userRepository, metrics);
    }

    @Nested
    @DisplayName("followUser")
    class FollowUserTests {

        @Test
        @DisplayName("Should create follow relationship")
        void shouldCreateFollowRelationship() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.exists(ALICE, BOB)).thenReturn(false);
            when(followRepository.save(any())).thenReturn(true);

            // When
            var result = followService.followUser(ALICE, BOB);

            // Then
            assertTrue(result.isSuccess());
            verify(followRepository).save(argThat(f -> f.followerId().equals(ALICE) && f.followeeId().equals(BOB)));
            verify(metrics).incrementFollows();
        }

        @Test
        @DisplayName("Should deny following self without touching storage")
        void shouldDenySelfFollow() {
            // When
            var result = followService.followUser(ALICE, ALICE);

            // Then
            assertInstanceOf(FollowError.ValidationFailed.class, result.errorOrNull());
            assertEquals(ErrorKind.PERMISSION_DENIED, result.errorOrNull().kind());
            verifyNoInteractions(followRepository, userRepository);
        }

        @Test
        @DisplayName("Should fail when followee does not exist")
        void shouldFailWhenFolloweeMissing() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(false);

            // When
            var result = followService.followUser(ALICE, BOB);

            // Then
            assertInstanceOf(FollowError.UserNotFound.class, result.errorOrNull());
            assertEquals(ErrorKind.NOT_FOUND, result.errorOrNull().kind());
            verify(followRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should report conflict when already following")
        void shouldFailWhenAlreadyFollowing() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.exists(ALICE, BOB)).thenReturn(true);

            // When
            var result = followService.followUser(ALICE, BOB);

            // Then
            assertInstanceOf(FollowError.AlreadyFollowing.class, result.errorOrNull());
            assertEquals(ErrorKind.CONFLICT, result.errorOrNull().kind());
            verify(followRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should report conflict when a concurrent insert wins")
        void shouldReportConflictWhenInsertIgnored() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.exists(ALICE, BOB)).thenReturn(false);
            when(followRepository.save(any())).thenReturn(false);

            // When
            var result = followService.followUser(ALICE, BOB);

            // Then
            assertInstanceOf(FollowError.AlreadyFollowing.class, result.errorOrNull());
            verify(metrics, never()).incrementFollows();
        }

        @Test
        @DisplayName("Should map a foreign key violation to not found")
        void shouldMapForeignKeyViolation() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.exists(ALICE, BOB)).thenReturn(false);
            when(followRepository.save(any())).thenThrow(new DataIntegrityViolationException("fk_followee"));

            // When
            var result = followService.followUser(ALICE, BOB);

            // Then
            assertInstanceOf(FollowError.UserNotFound.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should wrap other storage failures")
        void shouldWrapStorageFailure() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.exists(ALICE, BOB)).thenReturn(false);
            when(followRepository.save(any())).thenThrow(new QueryTimeoutException("slow"));

            // When / Then
            var ex = assertThrows(StorageFailureException.class, () -> followService.followUser(ALICE, BOB));
            assertEquals(ErrorKind.BAD_REQUEST, ex.getKind());
        }
    }

    @Nested
    @DisplayName("unfollow")
    class UnfollowTests {

        @Test
        @DisplayName("Should remove follow relationship")
        void shouldUnfollow() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.delete(ALICE, BOB)).thenReturn(true);

            // When
            var result = followService.unfollow(ALICE, BOB);

            // Then
            assertTrue(result.isSuccess());
            verify(metrics).incrementUnfollows();
        }

        @Test
        @DisplayName("Should deny unfollowing self without touching storage")
        void shouldDenySelfUnfollow() {
            var result = followService.unfollow(BOB, BOB);

            assertEquals(ErrorKind.PERMISSION_DENIED, result.errorOrNull().kind());
            verifyNoInteractions(followRepository, userRepository);
        }

        @Test
        @DisplayName("Should report not found when not following")
        void shouldFailWhenNotFollowing() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(true);
            when(followRepository.delete(ALICE, BOB)).thenReturn(false);

            // When
            var result = followService.unfollow(ALICE, BOB);

            // Then
            assertInstanceOf(FollowError.NotFollowing.class, result.errorOrNull());
            assertEquals(ErrorKind.NOT_FOUND, result.errorOrNull().kind());
            verify(metrics, never()).incrementUnfollows();
        }

        @Test
        @DisplayName("Should report not found for unknown followee")
        void shouldFailForUnknownFollowee() {
            when(userRepository.exists(BOB)).thenReturn(false);

            var result = followService.unfollow(ALICE, BOB);

            assertInstanceOf(FollowError.UserNotFound.class, result.errorOrNull());
            verify(followRepository, never()).delete(any(), any());
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("Should combine follower and following counts")
        void shouldReturnStats() {
            when(userRepository.exists(ALICE)).thenReturn(true);
            when(followRepository.countFollowers(ALICE)).thenReturn(3L);
            when(followRepository.countFollowing(ALICE)).thenReturn(5L);

            assertEquals(new FollowStats(3, 5), followService.getFollowStats(ALICE));
        }

        @Test
        @DisplayName("Should list followers and following from the repository")
        void shouldListBothDirections() {
            List<User> followers = List.of(new User(BOB, "Bob"));
            when(userRepository.exists(ALICE)).thenReturn(true);
            when(followRepository.findFollowers(ALICE)).thenReturn(followers);
            when(followRepository.findFollowing(ALICE)).thenReturn(List.of());

            assertEquals(followers, followService.getFollowers(ALICE));
            assertTrue(followService.getFollowing(ALICE).isEmpty());
        }

        @Test
        @DisplayName("Should report an unknown user instead of empty results")
        void shouldRejectUnknownUser() {
            // Given
            when(userRepository.exists(BOB)).thenReturn(false);

            // When / Then
            var ex = assertThrows(UserNotFoundException.class, () -> followService.getFollowers(BOB));
            assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
            assertThrows(UserNotFoundException.class, () -> followService.getFollowing(BOB));
            assertThrows(UserNotFoundException.class, () -> followService.getFollowStats(BOB));
            verifyNoInteractions(followRepository);
        }
    }
}
