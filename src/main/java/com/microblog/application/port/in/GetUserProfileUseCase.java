package com.microblog.application.port.in;

import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserProfile;

public interface GetUserProfileUseCase {

    /**
     * @throws com.microblog.infrastructure.exception.UserNotFoundException if no such user exists
     */
    UserProfile getProfile(UserId userId);
}
