package com.microblog.admin.adapter.in.seed;

import com.microblog.admin.application.port.in.RegisterUserUseCase;
import com.microblog.application.port.out.CredentialHasher;
import com.microblog.application.port.out.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registers the demo accounts at startup when {@code app.demo.seed-enabled} is set.
 * Accounts whose key is already registered are left alone.
 */
@Component
@ConditionalOnProperty(prefix = "app.demo", name = "seed-enabled", havingValue = "true")
public class DemoDataSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoDataSeeder.class);

    static final Map<String, String> DEMO_USERS = demoUsers();

    private final RegisterUserUseCase registerUserUseCase;
    private final UserRepository userRepository;
    private final CredentialHasher credentialHasher;

    public DemoDataSeeder(
            RegisterUserUseCase registerUserUseCase,
            UserRepository userRepository,
            CredentialHasher credentialHasher) {
        this.registerUserUseCase = registerUserUseCase;
        this.userRepository = userRepository;
        this.credentialHasher = credentialHasher;
    }

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        for (Map.Entry<String, String> user : DEMO_USERS.entrySet()) {
            if (userRepository.findByApiKeyDigest(credentialHasher.digest(user.getValue())).isPresent()) {
                continue;
            }
            registerUserUseCase.registerUser(user.getKey(), user.getValue());
            created++;
        }
        log.info("Demo seeding finished: {} users created, {} already present", created, DEMO_USERS.size() - created);
    }

    private static Map<String, String> demoUsers() {
        Map<String, String> users = new LinkedHashMap<>();
        users.put("Nick", "test");
        users.put("Alice", "alice_key");
        users.put("Bob", "bob_key");
        users.put("Charlie", "charlie_key");
        users.put("David", "david_key");
        return Collections.unmodifiableMap(users);
    }
}
