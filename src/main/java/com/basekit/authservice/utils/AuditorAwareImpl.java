package com.basekit.authservice.utils;

import com.basekit.authservice.entity.User;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Optional;

/**
 * Fills {@code created_by}/{@code modified_by}: {@code ADMIN:<id>}, {@code USER:<id>},
 * or {@code SYSTEM} for anonymous flows such as signup and password reset.
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    private static final String SYSTEM = "SYSTEM";
    private static final String ROLE_ADMIN = "ROLE_ADMIN";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        if (auth == null || !auth.isAuthenticated() || isAnonymous(auth)) {
            return Optional.of(SYSTEM);
        }

        String prefix = hasAdminRole(auth.getAuthorities()) ? "ADMIN" : "USER";
        return Optional.of(prefix + ":" + resolveIdentifier(auth));
    }

    private boolean isAnonymous(Authentication auth) {
        Object principal = auth.getPrincipal();
        return principal == null || "anonymousUser".equals(principal);
    }

    private boolean hasAdminRole(Collection<? extends GrantedAuthority> authorities) {
        if (authorities == null) return false;
        return authorities.stream().anyMatch(ga -> ROLE_ADMIN.equals(ga.getAuthority()));
    }

    private String resolveIdentifier(Authentication auth) {
        if (auth.getPrincipal() instanceof User user && user.getId() != null) {
            return user.getId().toString();
        }
        String name = auth.getName();
        return (name == null || name.isBlank()) ? "unknown" : name;
    }
}
