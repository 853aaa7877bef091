package com.basekit.authservice.utils;

import com.basekit.authservice.exception.ApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;

/**
 * Renders an {@link ApiException} as RFC 7807 problem+json with {@code timestamp},
 * {@code path} and {@code requestId} extensions. Used by the MVC exception handler
 * and by the security entry point / access-denied handler, which run outside MVC.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private static final String FALLBACK_DETAIL = "Request could not be processed.";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull ApiException ex) throws IOException {
        if (resp.isCommitted()) {
            log.debug("Response already committed, dropping {} for {}", ex.getStatus(), req.getRequestURI());
            return;
        }
        String detail = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : FALLBACK_DETAIL;

        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatus(), detail);
        pd.setType(URI.create(ex.getType()));
        pd.setTitle(ex.getTitle());
        pd.setInstance(URI.create(req.getRequestURI()));
        pd.setProperty("timestamp", clock.instant());
        pd.setProperty("path", req.getRequestURI());
        pd.setProperty("requestId", RequestIdFilter.of(req));

        resp.setStatus(ex.getStatus().value());
        resp.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(resp.getOutputStream(), pd);
    }
}
