package com.microblog.application.port.in;

import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.util.List;

public interface GetFollowingUseCase {

    List<User> getFollowing(UserId userId);
}
