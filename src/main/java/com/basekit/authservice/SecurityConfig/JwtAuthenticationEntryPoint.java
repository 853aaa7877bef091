package com.basekit.authservice.SecurityConfig;

import com.basekit.authservice.exception.ApiException;
import com.basekit.authservice.exception.AuthExceptions;
import com.basekit.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized for unauthenticated requests. When a bearer token was
 * presented, the problem says why it was refused (expired, invalid, account
 * inactive) and the RFC 6750 {@code WWW-Authenticate} hint is added.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) {
        ApiException problem = request.getAttribute(JwtAuthFilterConfig.REJECTION_ATTRIBUTE) instanceof ApiException rejected
                ? rejected
                : new AuthExceptions.Unauthorized("Authentication is required to access this resource.");
        String ah = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (ah != null && ah.startsWith("Bearer ")) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }
        try {
            writer.write(request, response, problem);
        } catch (IOException e) {
            // client went away
            log.debug("Could not write 401 for {}: {}", request.getRequestURI(), e.getMessage());
        }
    }
}
