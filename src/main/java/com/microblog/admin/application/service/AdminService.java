package com.microblog.admin.application.service;

import com.microblog.admin.application.port.in.GetStatsUseCase;
import com.microblog.admin.application.port.in.RegisterUserUseCase;
import com.microblog.admin.application.port.out.AdminDataPort;
import com.microblog.admin.application.port.out.AdminDataPort.DataCounts;
import com.microblog.application.port.out.CredentialHasher;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.exception.ApiKeyInUseException;
import com.microblog.infrastructure.security.ApiKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

@Service
public class AdminService implements RegisterUserUseCase, GetStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private static final int GENERATED_KEY_BYTES = 32;
    private static final int MAX_API_KEY_LENGTH = 256;

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;
    private final AdminDataPort adminDataPort;
    private final SecureRandom random = new SecureRandom();

    public AdminService(UserRepository userRepository, CredentialHasher credentialHasher, AdminDataPort adminDataPort) {
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
        this.adminDataPort = adminDataPort;
    }

    @Override
    public RegisteredUser registerUser(String name, String apiKey) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        String trimmedName = name.trim();
        if (trimmedName.length() > User.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must be at most " + User.MAX_NAME_LENGTH + " characters");
        }
        if (apiKey != null && (apiKey.isBlank() || apiKey.length() > MAX_API_KEY_LENGTH)) {
            throw new IllegalArgumentException("apiKey must be 1 to " + MAX_API_KEY_LENGTH + " non-blank characters");
        }

        String key = apiKey != null ? apiKey : generateApiKey();
        User user;
        try {
            user = userRepository.create(trimmedName, credentialHasher.digest(key), credentialHasher.hash(key));
        } catch (DuplicateKeyException e) {
            log.warn("Registration of {} rejected, API key {} already in use", trimmedName, ApiKeys.mask(key));
            throw new ApiKeyInUseException();
        }

        log.info("User registered: id={}, name={}, apiKey={}", user.id(), user.name(), ApiKeys.mask(key));
        return new RegisteredUser(user.id().value(), user.name(), key);
    }

    @Override
    public DataCounts getStats() {
        return adminDataPort.getCounts();
    }

    private String generateApiKey() {
        byte[] bytes = new byte[GENERATED_KEY_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
