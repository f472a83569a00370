package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.LikeRepository;
import com.microblog.domain.model.Like;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;

@Repository
public class JdbcLikeRepository implements LikeRepository {

    private final JdbcTemplate jdbc;

    public JdbcLikeRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean save(Like like) {
        int inserted = jdbc.update("""
            INSERT INTO likes (user_id, tweet_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, tweet_id) DO NOTHING
            """,
            like.userId().value(),
            like.tweetId(),
            Timestamp.from(like.createdAt())
        );
        return inserted > 0;
    }

    @Override
    public boolean delete(UserId userId, long tweetId) {
        return jdbc.update(
            "DELETE FROM likes WHERE user_id = ? AND tweet_id = ?",
            userId.value(),
            tweetId
        ) > 0;
    }

    @Override
    public boolean exists(UserId userId, long tweetId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM likes WHERE user_id = ? AND tweet_id = ?",
            Integer.class,
            userId.value(),
            tweetId
        );
        return count != null && count > 0;
    }

    @Override
    public long countForTweet(long tweetId) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM likes WHERE tweet_id = ?",
            Long.class,
            tweetId
        );
        return count != null ? count : 0;
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM likes", Long.class);
        return count != null ? count : 0;
    }
}
