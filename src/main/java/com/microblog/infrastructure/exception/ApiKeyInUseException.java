package com.microblog.infrastructure.exception;

import com.microblog.domain.error.ErrorKind;

public class ApiKeyInUseException extends BusinessException {

    public ApiKeyInUseException() {
        super(ErrorKind.CONFLICT, "API_KEY_IN_USE", "The API key is already assigned to another user");
    }
}
