package com.microblog.adapter.out.query;

import com.microblog.application.port.out.TweetQueryPort;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.domain.model.TweetDetails;
import com.microblog.domain.model.UserId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

@Component
public class TweetQueryAdapter implements TweetQueryPort {

    private final TweetRepository tweetRepository;

    public TweetQueryAdapter(TweetRepository tweetRepository) {
        this.tweetRepository = tweetRepository;
    }

    @Override
    public List<TweetDetails> findFeedCandidates(Set<UserId> authorIds) {
        return tweetRepository.findWithRelationsByAuthors(authorIds);
    }
}
