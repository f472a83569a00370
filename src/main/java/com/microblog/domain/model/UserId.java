package com.microblog.domain.model;

import com.microblog.domain.error.ValidationError.UserIdError;

/**
 * Value Object for User identity. Users are keyed by a database-assigned positive integer.
 */
public record UserId(long value) {

    public UserId {
        if (value <= 0) {
            throw new IllegalStateException("UserId must be positive, was " + value + " - use parse() for external input");
        }
    }

    /**
     * Parses external input (path segments, headers) into a UserId.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed <= 0) {
                return Result.failure(new UserIdError.InvalidFormat(value));
            }
            return Result.success(new UserId(parsed));
        } catch (NumberFormatException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
    }

    /**
     * Wraps an id read from our own storage.
     */
    public static UserId of(long value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
