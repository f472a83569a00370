package com.microblog.adapter.in.web;

import com.microblog.application.port.in.FollowUserUseCase;
import com.microblog.application.port.in.GetFollowStatsUseCase;
import com.microblog.application.port.in.GetFollowersUseCase;
import com.microblog.application.port.in.GetFollowingUseCase;
import com.microblog.application.port.in.UnfollowUserUseCase;
import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.FollowStats;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;
import com.microblog.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Follows", description = "Follow/unfollow operations")
public class FollowController {

    private final FollowUserUseCase followUserUseCase;
    private final UnfollowUserUseCase unfollowUserUseCase;
    private final GetFollowersUseCase getFollowersUseCase;
    private final GetFollowingUseCase getFollowingUseCase;
    private final GetFollowStatsUseCase getFollowStatsUseCase;

    public FollowController(
            FollowUserUseCase followUserUseCase,
            UnfollowUserUseCase unfollowUserUseCase,
            GetFollowersUseCase getFollowersUseCase,
            GetFollowingUseCase getFollowingUseCase,
            GetFollowStatsUseCase getFollowStatsUseCase) {
        this.followUserUseCase = followUserUseCase;
        this.unfollowUserUseCase = unfollowUserUseCase;
        this.getFollowersUseCase = getFollowersUseCase;
        this.getFollowingUseCase = getFollowingUseCase;
        this.getFollowStatsUseCase = getFollowStatsUseCase;
    }

    @PostMapping("/users/{targetId}/follow")
    @Operation(summary = "Follow a user", description = "Make the authenticated user follow the target user")
    public ResponseEntity<?> followUser(
            @Parameter(description = "User ID to follow", example = "2")
            @PathVariable String targetId) {

        var followeeResult = UserId.parse(targetId);
        if (followeeResult.isFailure()) {
            var error = followeeResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }

        UserId followerId = RequestContext.getUserId();
        Result<Void, FollowError> result = followUserUseCase.followUser(followerId, followeeResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED)
                .body(new FollowResponse(followerId.value(), followeeResult.getOrThrow().value(), "followed"))
            : toFollowErrorResponse(result.errorOrNull());
    }

    @DeleteMapping("/users/{targetId}/follow")
    @Operation(summary = "Unfollow a user", description = "Make the authenticated user unfollow the target user")
    public ResponseEntity<?> unfollowUser(
            @Parameter(description = "User ID to unfollow", example = "2")
            @PathVariable String targetId) {

        var followeeResult = UserId.parse(targetId);
        if (followeeResult.isFailure()) {
            var error = followeeResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }

        UserId followerId = RequestContext.getUserId();
        Result<Void, FollowError> result = unfollowUserUseCase.unfollow(followerId, followeeResult.getOrThrow());

        return result.isSuccess()
            ? ResponseEntity.ok(new FollowResponse(followerId.value(), followeeResult.getOrThrow().value(), "unfollowed"))
            : toFollowErrorResponse(result.errorOrNull());
    }

    @GetMapping("/users/{userId}/followers")
    @Operation(summary = "Get followers", description = "Users following the specified user, most recent first")
    public ResponseEntity<?> getFollowers(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId) {
        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            var error = userIdResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        return ResponseEntity.ok(getFollowersUseCase.getFollowers(userIdResult.getOrThrow()).stream()
            .map(UserResponse::from)
            .toList());
    }

    @GetMapping("/users/{userId}/following")
    @Operation(summary = "Get following", description = "Users the specified user follows, most recent first")
    public ResponseEntity<?> getFollowing(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId) {
        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            var error = userIdResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        List<UserResponse> following = getFollowingUseCase.getFollowing(userIdResult.getOrThrow()).stream()
            .map(UserResponse::from)
            .toList();
        return ResponseEntity.ok(following);
    }

    @GetMapping("/users/{userId}/follow-stats")
    @Operation(summary = "Get follow counts")
    public ResponseEntity<?> getFollowStats(
            @Parameter(description = "User ID", example = "1")
            @PathVariable String userId) {
        var userIdResult = UserId.parse(userId);
        if (userIdResult.isFailure()) {
            var error = userIdResult.errorOrNull();
            return ErrorResponses.of(error.kind(), error.code(), error.message());
        }
        FollowStats stats = getFollowStatsUseCase.getFollowStats(userIdResult.getOrThrow());
        return ResponseEntity.ok(stats);
    }

    private ResponseEntity<ErrorResponse> toFollowErrorResponse(FollowError error) {
        return ErrorResponses.of(error.kind(), error.code(), error.message());
    }

    public record FollowResponse(long followerId, long followeeId, String status) {}
}
