package com.microblog.domain.model;

import java.util.List;

public record UserProfile(
    User user,
    List<User> followers,
    List<User> following
) {
    public UserProfile {
        followers = List.copyOf(followers);
        following = List.copyOf(following);
    }
}
