package com.microblog.domain.model;

/**
 * A registered account as seen by other users: id and display name only.
 * Credential material never leaves the persistence adapter.
 */
public record User(UserId id, String name) {

    public static final int MAX_NAME_LENGTH = 100;
}
