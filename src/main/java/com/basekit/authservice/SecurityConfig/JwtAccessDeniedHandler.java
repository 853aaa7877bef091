package com.basekit.authservice.SecurityConfig;

import com.basekit.authservice.exception.AuthExceptions;
import com.basekit.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 403 Forbidden for authenticated requests that lack the role,
 * e.g. a USER calling {@code /users} or {@code /notifications} admin routes.
 */
@Slf4j
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) {
        log.debug("Access denied to {} {}", request.getMethod(), request.getRequestURI());
        try {
            writer.write(request, response, new AuthExceptions.Forbidden("You do not have permission to access this resource."));
        } catch (IOException e) {
            log.debug("Could not write 403 for {}: {}", request.getRequestURI(), e.getMessage());
        }
    }
}
