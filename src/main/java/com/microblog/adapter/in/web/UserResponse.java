package com.microblog.adapter.in.web;

import com.microblog.domain.model.User;

public record UserResponse(long id, String name) {

    public static UserResponse from(User user) {
        return new UserResponse(user.id().value(), user.name());
    }
}
