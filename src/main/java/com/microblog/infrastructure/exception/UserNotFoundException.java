package com.microblog.infrastructure.exception;

import com.microblog.domain.error.ErrorKind;
import com.microblog.domain.model.UserId;

public class UserNotFoundException extends BusinessException {

    public UserNotFoundException(UserId userId) {
        super(ErrorKind.NOT_FOUND, "USER_NOT_FOUND", "User not found: " + userId);
    }
}
