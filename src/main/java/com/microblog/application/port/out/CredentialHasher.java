package com.microblog.application.port.out;

/**
 * Two-stage API key hashing: a deterministic digest for indexed lookup and a
 * salted slow hash for verification.
 */
public interface CredentialHasher {

    String digest(String rawCredential);

    String hash(String rawCredential);

    boolean verify(String rawCredential, String encodedHash);
}
