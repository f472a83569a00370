package com.microblog.admin.adapter.in.seed;

import com.microblog.admin.application.port.in.RegisterUserUseCase;
import com.microblog.application.port.out.CredentialHasher;
import com.microblog.application.port.out.UserRepository;
import com.microblog.application.port.out.UserRepository.StoredCredential;
import com.microblog.domain.model.User;
import com.microblog.domain.model.UserId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DemoDataSeederTest {

    @Mock
    private RegisterUserUseCase registerUserUseCase;

    @Mock
    private UserRepository userRepository;

    @Mock
    private CredentialHasher credentialHasher;

    @InjectMocks
    private DemoDataSeeder seeder;

    @Test
    void shouldRegisterDemoUsersInOrder() {
        when(credentialHasher.digest(anyString())).thenAnswer(inv -> "digest-" + inv.getArgument(0));
        when(userRepository.findByApiKeyDigest(anyString())).thenReturn(Optional.empty());

        seeder.run(new DefaultApplicationArguments());

        InOrder inOrder = inOrder(registerUserUseCase);
        inOrder.verify(registerUserUseCase).registerUser("Nick", "test");
        inOrder.verify(registerUserUseCase).registerUser("Alice", "alice_key");
        inOrder.verify(registerUserUseCase).registerUser("Bob", "bob_key");
        inOrder.verify(registerUserUseCase).registerUser("Charlie", "charlie_key");
        inOrder.verify(registerUserUseCase).registerUser("David", "david_key");
    }

    @Test
    void shouldSkipKeysAlreadyRegistered() {
        when(credentialHasher.digest(anyString())).thenAnswer(inv -> "digest-" + inv.getArgument(0));
        when(userRepository.findByApiKeyDigest(anyString())).thenReturn(Optional.empty());
        when(userRepository.findByApiKeyDigest("digest-test"))
            .thenReturn(Optional.of(new StoredCredential(new User(UserId.of(1), "Nick"), "hash")));

        seeder.run(new DefaultApplicationArguments());

        verify(registerUserUseCase, never()).registerUser("Nick", "test");
        verify(registerUserUseCase, times(4)).registerUser(anyString(), anyString());
    }

    @Test
    void shouldExposeFiveDemoAccounts() {
        assertEquals(List.of("Nick", "Alice", "Bob", "Charlie", "David"), List.copyOf(DemoDataSeeder.DEMO_USERS.keySet()));
    }
}
