package com.microblog.infrastructure.security;

import com.microblog.infrastructure.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class CredentialHashingConfig {

    @Bean
    public PasswordEncoder apiKeyEncoder(AppProperties appProperties) {
        AppProperties.Argon2 argon2 = appProperties.getSecurity().getArgon2();
        return new Argon2PasswordEncoder(
            argon2.getSaltLength(),
            argon2.getHashLength(),
            argon2.getParallelism(),
            argon2.getMemoryKib(),
            argon2.getIterations()
        );
    }
}
