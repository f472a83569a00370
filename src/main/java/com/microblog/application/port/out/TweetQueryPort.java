package com.microblog.application.port.out;

import com.microblog.domain.model.TweetDetails;
import com.microblog.domain.model.UserId;

import java.util.List;
import java.util.Set;

/**
 * Read access to tweets and their relations for feed assembly.
 */
public interface TweetQueryPort {

    /**
     * Fully loaded tweets of the given authors. An empty author set yields an empty list.
     */
    List<TweetDetails> findFeedCandidates(Set<UserId> authorIds);
}
