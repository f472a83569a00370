package com.microblog.application.port.out;

import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;

import java.util.Optional;

public interface UserRepository {

    /**
     * Inserts a user with both credential forms.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the digest is already taken
     */
    User create(String name, String apiKeyDigest, String apiKeyHash);

    Optional<User> findById(UserId userId);

    boolean exists(UserId userId);

    /**
     * Looks a user up by the fast digest of their API key.
     */
    Optional<StoredCredential> findByApiKeyDigest(String apiKeyDigest);

    long count();

    record StoredCredential(User user, String apiKeyHash) {}
}
