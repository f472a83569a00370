package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.TweetContentError;

import java.time.Instant;

/**
 * A short post. {@code id} is null until the tweet has been stored.
 */
public record Tweet(
    Long id,
    UserId authorId,
    String content,
    Instant createdAt
) {
    public static final int MAX_CONTENT_LENGTH = 280;

    public static Result<Tweet, TweetContentError> create(UserId authorId, String content) {
        if (content == null || content.isBlank()) {
            return Result.failure(TweetContentError.EmptyContent.INSTANCE);
        }
        String trimmed = content.trim();
        int length = trimmed.codePointCount(0, trimmed.length());
        if (length > MAX_CONTENT_LENGTH) {
            return Result.failure(new TweetContentError.ContentTooLong(length, MAX_CONTENT_LENGTH));
        }
        return Result.success(new Tweet(null, authorId, trimmed, Instant.now()));
    }

    public Tweet withId(long id) {
        return new Tweet(id, authorId, content, createdAt);
    }

    public boolean isAuthoredBy(UserId userId) {
        return authorId.equals(userId);
    }
}
