package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.FollowValidationError;

import java.time.Instant;

public record Follow(
    UserId followerId,
    UserId followeeId,
    Instant createdAt
) {
    public static Result<Follow, FollowValidationError> create(UserId followerId, UserId followeeId) {
        if (followerId.equals(followeeId)) {
            return Result.failure(FollowValidationError.SelfFollow.INSTANCE);
        }
        return Result.success(new Follow(followerId, followeeId, Instant.now()));
    }

    /**
     * Checks an unfollow request; there is no edge to remove between a user and themselves.
     */
    public static Result<Void, FollowValidationError> checkUnfollow(UserId followerId, UserId followeeId) {
        if (followerId.equals(followeeId)) {
            return Result.failure(FollowValidationError.SelfUnfollow.INSTANCE);
        }
        return Result.success(null);
    }
}
