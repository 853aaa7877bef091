package com.basekit.authservice.SecurityConfig;

import com.basekit.authservice.exception.ApiException;
import com.basekit.authservice.exception.AuthExceptions;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <jwt>}.
 * The identity is re-read on every request, so a deactivated or deleted account
 * loses access immediately even while its token is unexpired.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilterConfig extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    /** Why a presented token was not accepted; read by {@link JwtAuthenticationEntryPoint}. */
    static final String REJECTION_ATTRIBUTE = JwtAuthFilterConfig.class.getName() + ".rejection";

    private final JwtTokenProviderConfig jwtService;
    private final UserDetailsService userDetailsService;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }
        final String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        try {
            // Signature, expiry and iss/aud are checked here
            final Claims claims = jwtService.validate(token);

            if (SecurityContextHolder.getContext().getAuthentication() == null) {
                UserDetails userDetails = userDetailsService.loadUserByUsername(claims.getSubject());
                if (!userDetails.isEnabled()) {
                    request.setAttribute(REJECTION_ATTRIBUTE, new AuthExceptions.Unauthorized("Account is no longer active"));
                } else {
                    SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                    UsernamePasswordAuthenticationToken authToken =
                            new UsernamePasswordAuthenticationToken(userDetails, null, userDetails.getAuthorities());
                    authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    securityContext.setAuthentication(authToken);
                    SecurityContextHolder.setContext(securityContext);
                }
            }
        } catch (ApiException ex) {
            // Bad token: stay anonymous; protected routes answer 401 via the entry point
            log.debug("JWT rejected: {}", ex.getMessage());
            request.setAttribute(REJECTION_ATTRIBUTE, ex);
        } catch (UsernameNotFoundException ex) {
            log.debug("JWT subject no longer valid: {}", ex.getMessage());
            request.setAttribute(REJECTION_ATTRIBUTE, new AuthExceptions.Unauthorized("Account is no longer active"));
        }

        filterChain.doFilter(request, response);
    }
}
