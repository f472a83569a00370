package com.microblog.infrastructure.security;

import com.microblog.application.port.out.CredentialHasher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 hex for the indexed lookup column, Argon2id for the verification column.
 */
@Component
public class Argon2CredentialHasher implements CredentialHasher {

    private final PasswordEncoder encoder;

    public Argon2CredentialHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    @Override
    public String digest(String rawCredential) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest(rawCredential.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String hash(String rawCredential) {
        return encoder.encode(rawCredential);
    }

    @Override
    public boolean verify(String rawCredential, String encodedHash) {
        return encoder.matches(rawCredential, encodedHash);
    }
}
