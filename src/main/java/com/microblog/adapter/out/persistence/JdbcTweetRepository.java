package com.microblog.adapter.out.persistence;

import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.model.Media;
import com.microblog.domain.model.Tweet;
import com.microblog.domain.model.TweetDetails;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Repository
public class JdbcTweetRepository implements TweetRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Tweet> TWEET_ROW_MAPPER = (rs, rowNum) -> new Tweet(
        rs.getLong("id"),
        UserId.of(rs.getLong("author_id")),
        rs.getString("content"),
        rs.getTimestamp("created_at").toInstant()
    );

    private static final RowMapper<AuthoredTweet> AUTHORED_TWEET_ROW_MAPPER = (rs, rowNum) -> new AuthoredTweet(
        TWEET_ROW_MAPPER.mapRow(rs, rowNum),
        new User(UserId.of(rs.getLong("author_id")), rs.getString("author_name"))
    );

    private static final RowMapper<TweetLiker> TWEET_LIKER_ROW_MAPPER = (rs, rowNum) -> new TweetLiker(
        rs.getLong("tweet_id"),
        new User(UserId.of(rs.getLong("user_id")), rs.getString("user_name"))
    );

    public JdbcTweetRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Tweet save(Tweet tweet) {
        Long id = jdbc.queryForObject("""
            INSERT INTO tweets (author_id, content, created_at)
            VALUES (?, ?, ?)
            RETURNING id
            """,
            Long.class,
            tweet.authorId().value(),
            tweet.content(),
            Timestamp.from(tweet.createdAt())
        );
        return tweet.withId(id);
    }

    @Override
    public Optional<Tweet> findById(long tweetId) {
        return jdbc.query(
            "SELECT id, author_id, content, created_at FROM tweets WHERE id = ?",
            TWEET_ROW_MAPPER,
            tweetId
        ).stream().findFirst();
    }

    @Override
    public boolean exists(long tweetId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM tweets WHERE id = ?",
            Integer.class,
            tweetId
        );
        return count != null && count > 0;
    }

    @Override
    public boolean deleteById(long tweetId) {
        return jdbc.update("DELETE FROM tweets WHERE id = ?", tweetId) > 0;
    }

    @Override
    public List<TweetDetails> findWithRelationsByAuthors(Set<UserId> authorIds) {
        if (authorIds.isEmpty()) {
            return List.of();
        }
        // One array parameter, so the author set size never hits the bind parameter limit
        Long[] ids = authorIds.stream().map(UserId::value).toArray(Long[]::new);

        List<AuthoredTweet> tweets = jdbc.query(byAuthors("""
            SELECT t.id, t.author_id, t.content, t.created_at, u.name AS author_name,
                   (SELECT COUNT(*) FROM likes l WHERE l.tweet_id = t.id) AS like_count
            FROM tweets t
            JOIN users u ON u.id = t.author_id
            WHERE t.author_id = ANY(?)
            ORDER BY like_count DESC, t.id DESC
            """, ids),
            AUTHORED_TWEET_ROW_MAPPER
        );
        if (tweets.isEmpty()) {
            return List.of();
        }

        Map<Long, List<User>> likersByTweet = new HashMap<>();
        jdbc.query(byAuthors("""
            SELECT l.tweet_id, u.id AS user_id, u.name AS user_name
            FROM likes l
            JOIN users u ON u.id = l.user_id
            WHERE l.tweet_id IN (SELECT id FROM tweets WHERE author_id = ANY(?))
            ORDER BY l.created_at, u.id
            """, ids),
            TWEET_LIKER_ROW_MAPPER
        ).forEach(liker -> likersByTweet.computeIfAbsent(liker.tweetId(), k -> new ArrayList<>()).add(liker.user()));

        Map<Long, List<Media>> mediaByTweet = new HashMap<>();
        jdbc.query(byAuthors("""
            SELECT id, storage_key, tweet_id
            FROM media
            WHERE tweet_id IN (SELECT id FROM tweets WHERE author_id = ANY(?))
            ORDER BY id
            """, ids),
            JdbcMediaRepository.MEDIA_ROW_MAPPER
        ).forEach(media -> mediaByTweet.computeIfAbsent(media.tweetId(), k -> new ArrayList<>()).add(media));

        return tweets.stream()
            .map(row -> new TweetDetails(
                row.tweet(),
                row.author(),
                likersByTweet.getOrDefault(row.tweet().id(), List.of()),
                mediaByTweet.getOrDefault(row.tweet().id(), List.of())
            ))
            .toList();
    }

    private static PreparedStatementCreator byAuthors(String sql, Long[] authorIds) {
        return connection -> {
            PreparedStatement statement = connection.prepareStatement(sql);
            statement.setArray(1, connection.createArrayOf("bigint", authorIds));
            return statement;
        };
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM tweets", Long.class);
        return count != null ? count : 0;
    }

    private record AuthoredTweet(Tweet tweet, User author) {}

    private record TweetLiker(long tweetId, User user) {}
}
