package com.microblog.application.port.in;

import com.microblog.domain.error.FollowError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.UserId;

public interface FollowUserUseCase {

    Result<Void, FollowError> followUser(UserId followerId, UserId followeeId);
}
