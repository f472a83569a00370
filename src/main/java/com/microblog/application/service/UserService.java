package com.microblog.application.service;

import com.microblog.application.port.in.GetUserProfileUseCase;
import com.microblog.application.port.out.FollowRepository;
import com.microblog.application.port.out.UserRepository;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import com.microblog.domain.model.UserProfile;
import com.microblog.infrastructure.exception.UserNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService implements GetUserProfileUseCase {

    private final UserRepository userRepository;
    private final FollowRepository followRepository;

    public UserService(UserRepository userRepository, FollowRepository followRepository) {
        this.userRepository = userRepository;
        this.followRepository = followRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public UserProfile getProfile(UserId userId) {
        User user = userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId));
        return new UserProfile(
            user,
            followRepository.findFollowers(userId),
            followRepository.findFollowing(userId)
        );
    }
}
