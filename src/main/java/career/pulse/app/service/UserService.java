package career.pulse.app.service;

import career.pulse.app.entity.User;
import career.pulse.app.repository.UserRepository;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
public class UserService {
    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional
    public User getOrCreateUser(Authentication authentication) {
        OAuth2User oauth2User = (OAuth2User) authentication.getPrincipal();
        String userId = oauth2User.getName(); // Google subject
        String email = oauth2User.getAttribute("email");
        String name = oauth2User.getAttribute("name");

        Optional<User> existingUser = userRepository.findById(userId);
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (email != null && !email.equals(user.getPrimaryEmail())) {
                user.setPrimaryEmail(email);
                userRepository.save(user);
            }
            return user;
        }

        User user = new User();
        user.setId(userId);
        user.setPrimaryEmail(email);
        user.setName(name);
        user.setCreatedAt(Instant.now(clock));
        return userRepository.save(user);
    }

    /**
     * Id of the signed-in user without touching the store.
     */
    public String currentUserId(Authentication authentication) {
        return authentication.getName();
    }
}
