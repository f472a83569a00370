package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> USER_ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.of(rs.getLong("id")),
        rs.getString("name")
    );

    private static final RowMapper<StoredCredential> CREDENTIAL_ROW_MAPPER = (rs, rowNum) -> new StoredCredential(
        USER_ROW_MAPPER.mapRow(rs, rowNum),
        rs.getString("api_key_hash")
    );

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public User create(String name, String apiKeyDigest, String apiKeyHash) {
        Long id = jdbc.queryForObject("""
            INSERT INTO users (name, api_key_digest, api_key_hash)
            VALUES (?, ?, ?)
            RETURNING id
            """,
            Long.class,
            name,
            apiKeyDigest,
            apiKeyHash
        );
        return new User(UserId.of(id), name);
    }

    @Override
    public Optional<User> findById(UserId userId) {
        return jdbc.query(
            "SELECT id, name FROM users WHERE id = ?",
            USER_ROW_MAPPER,
            userId.value()
        ).stream().findFirst();
    }

    @Override
    public boolean exists(UserId userId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM users WHERE id = ?",
            Integer.class,
            userId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public Optional<StoredCredential> findByApiKeyDigest(String apiKeyDigest) {
        return jdbc.query(
            "SELECT id, name, api_key_hash FROM users WHERE api_key_digest = ?",
            CREDENTIAL_ROW_MAPPER,
            apiKeyDigest
        ).stream().findFirst();
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count != null ? count : 0;
    }
}
