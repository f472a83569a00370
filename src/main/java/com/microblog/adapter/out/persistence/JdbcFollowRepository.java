package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.FollowRepository;
import com.microblog.domain.model.Follow;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Repository
public class JdbcFollowRepository implements FollowRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> USER_ROW_MAPPER = (rs, rowNum) -> new User(
        UserId.of(rs.getLong("id")),
        rs.getString("name")
    );

    public JdbcFollowRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean save(Follow follow) {
        int inserted = jdbc.update("""
            INSERT INTO follows (follower_id, followee_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (follower_id, followee_id) DO NOTHING
            """,
            follow.followerId().value(),
            follow.followeeId().value(),
            Timestamp.from(follow.createdAt())
        );
        return inserted > 0;
    }

    @Override
    public boolean delete(UserId followerId, UserId followeeId) {
        int deleted = jdbc.update(
            "DELETE FROM follows WHERE follower_id = ? AND followee_id = ?",
            followerId.value(),
            followeeId.value()
        );
        return deleted > 0;
    }

    @Override
    public boolean exists(UserId followerId, UserId followeeId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE follower_id = ? AND followee_id = ?",
            Integer.class,
            followerId.value(),
            followeeId.value()
        );
        return count != null && count > 0;
    }

    @Override
    public Set<UserId> findFolloweeIds(UserId followerId) {
        List<Long> ids = jdbc.queryForList(
            "SELECT followee_id FROM follows WHERE follower_id = ?",
            Long.class,
            followerId.value()
        );
        Set<UserId> followees = new LinkedHashSet<>();
        ids.forEach(id -> followees.add(UserId.of(id)));
        return followees;
    }

    @Override
    public List<User> findFollowers(UserId userId) {
        return jdbc.query("""
            SELECT u.id, u.name
            FROM follows f
            JOIN users u ON f.follower_id = u.id
            WHERE f.followee_id = ?
            ORDER BY f.created_at DESC, u.id
            """,
            USER_ROW_MAPPER,
            userId.value()
        );
    }

    @Override
    public List<User> findFollowing(UserId userId) {
        return jdbc.query("""
            SELECT u.id, u.name
            FROM follows f
            JOIN users u ON f.followee_id = u.id
            WHERE f.follower_id = ?
            ORDER BY f.created_at DESC, u.id
            """,
            USER_ROW_MAPPER,
            userId.value()
        );
    }

    @Override
    public long countFollowers(UserId userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE followee_id = ?",
            Long.class,
            userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public long countFollowing(UserId userId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM follows WHERE follower_id = ?",
            Long.class,
            userId.value()
        );
        return count != null ? count : 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM follows", Long.class);
        return count != null ? count : 0;
    }
}
