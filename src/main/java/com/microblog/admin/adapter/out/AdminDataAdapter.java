package com.microblog.admin.adapter.out;

import com.microblog.admin.application.port.out.AdminDataPort;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.LikeRepository;
import com.microblog.application.port.out.MediaRepository;
import com.microblog.application.port.out.TweetRepository;
import com.microblog.application.port.out.UserRepository;
import org.springframework.stereotype.Component;

@Component
public class AdminDataAdapter implements AdminDataPort {

    private final UserRepository userRepository;
    private final TweetRepository tweetRepository;
    private final FollowRepository followRepository;
    private final LikeRepository likeRepository;
    private final MediaRepository mediaRepository;

    public AdminDataAdapter(
            UserRepository userRepository,
            TweetRepository tweetRepository,
            FollowRepository followRepository,
            LikeRepository likeRepository,
            MediaRepository mediaRepository) {
        this.userRepository = userRepository;
        this.tweetRepository = tweetRepository;
        this.followRepository = followRepository;
        this.likeRepository = likeRepository;
        this.mediaRepository = mediaRepository;
    }

    @Override
    public DataCounts getCounts() {
        return new DataCounts(
            userRepository.count(),
            tweetRepository.count(),
            followRepository.count(),
            likeRepository.count(),
            mediaRepository.count()
        );
    }
}
