package com.microblog.application.service;

import com.microblog.application.port.in.VerifyCredentialUseCase;
import com.microblog.application.port.out.CredentialHasher;
import com.microblog.application.port.out.UserRepository;
import com.microblog.application.port.out.UserRepository.StoredCredential;
import com.microblog.domain.error.AuthError;
import com.microblog.domain.model.Result;
import com.microblog.domain.model.User;
import com.microblog.infrastructure.exception.StorageFailureException;
import com.microblog.infrastructure.security.ApiKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Two-stage API key check: the SHA-256 digest finds the candidate row through
 * an index, the Argon2id hash then confirms the key.
 */
@Service
public class CredentialService implements VerifyCredentialUseCase {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;

    public CredentialService(UserRepository userRepository, CredentialHasher credentialHasher) {
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
    }

    @Override
    public Result<User, AuthError> verifyCredential(String rawCredential) {
        if (rawCredential == null || rawCredential.isEmpty()) {
            return Result.failure(AuthError.AuthenticationRequired.INSTANCE);
        }

        String digest;
        try {
            digest = credentialHasher.digest(rawCredential);
        } catch (RuntimeException e) {
            log.error("Digest of API key {} failed", ApiKeys.mask(rawCredential), e);
            return Result.failure(AuthError.InvalidCredential.INSTANCE);
        }

        Optional<StoredCredential> stored;
        try {
            stored = userRepository.findByApiKeyDigest(digest);
        } catch (DataAccessException e) {
            log.error("Credential lookup failed for API key {}", ApiKeys.mask(rawCredential), e);
            throw new StorageFailureException("Failed to look up credential", e);
        }
        if (stored.isEmpty()) {
            log.debug("No user for API key {}", ApiKeys.mask(rawCredential));
            return Result.failure(AuthError.InvalidCredential.INSTANCE);
        }

        boolean verified;
        try {
            verified = credentialHasher.verify(rawCredential, stored.get().apiKeyHash());
        } catch (RuntimeException e) {
            log.error("Hash verification of API key {} failed", ApiKeys.mask(rawCredential), e);
            return Result.failure(AuthError.InvalidCredential.INSTANCE);
        }
        if (!verified) {
            log.warn("API key {} matched a digest but failed hash verification", ApiKeys.mask(rawCredential));
            return Result.failure(AuthError.InvalidCredential.INSTANCE);
        }
        return Result.success(stored.get().user());
    }
}
