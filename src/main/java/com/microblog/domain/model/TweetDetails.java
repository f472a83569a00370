package com.microblog.domain.model;

import java.util.List;

/**
 * A tweet loaded together with its author, the users who liked it and its attachments.
 */
public record TweetDetails(
    Tweet tweet,
    User author,
    List<User> likedBy,
    List<Media> attachments
) {
    public TweetDetails {
        likedBy = List.copyOf(likedBy);
        attachments = List.copyOf(attachments);
    }

    public int likeCount() {
        return likedBy.size();
    }
}
