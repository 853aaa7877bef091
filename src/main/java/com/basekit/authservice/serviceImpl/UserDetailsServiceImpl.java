package com.basekit.authservice.serviceImpl;

import com.basekit.authservice.entity.User;
import com.basekit.authservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Resolves the token subject (user id) to a live identity. Deliberately uncached:
 * deactivation must take effect on the very next request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserDetailsServiceImpl implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String userId) throws UsernameNotFoundException {
        final UUID id = parseId(userId);

        User user = userRepository.findById(id)
                .orElseThrow(() -> new UsernameNotFoundException("User not found"));

        // Generic error for unusable accounts (no enumeration)
        if (!user.isActive()) {
            log.debug("Rejected token for inactive userId={}", id);
            throw new UsernameNotFoundException("User not found");
        }
        return user;
    }

    private UUID parseId(String userId) {
        if (userId == null) throw new UsernameNotFoundException("User not found");
        try {
            return UUID.fromString(userId.trim());
        } catch (IllegalArgumentException e) {
            throw new UsernameNotFoundException("User not found", e);
        }
    }
}
