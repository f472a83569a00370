package com.microblog.domain.model;

public record FollowStats(long followers, long following) {}
