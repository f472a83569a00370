package com.microblog.admin.application.port.in;

public interface RegisterUserUseCase {

    /**
     * Creates a user. When {@code apiKey} is null a random key is generated.
     * The returned key is the only time it is visible in clear text.
     *
     * @throws IllegalArgumentException if the name or key is malformed
     * @throws com.microblog.infrastructure.exception.ApiKeyInUseException if the key is taken
     */
    RegisteredUser registerUser(String name, String apiKey);

    record RegisteredUser(long id, String name, String apiKey) {}
}
