package com.microblog.application.port.in;

import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;

public interface VerifyCredentialUseCase {

    /**
     * Resolves an opaque API key to the user it belongs to.
     * Never throws; every failure is reported as an {@link AuthError}.
     */
    Result<User, AuthError> verifyCredential(String rawCredential);
}
