package com.basekit.authservice.exception;

import com.basekit.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Single exit for errors raised inside MVC. Framework exceptions are translated
 * into this service's {@link ApiException} types so every problem+json body has
 * a type URI from the same catalogue.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final int MAX_FIELD_ERRORS = 5;

    private final ErrorResponseWriter writer;

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex.getStatus().is5xxServerError()) {
            log.warn("{} on {}: {}", ex.getTitle(), req.getRequestURI(), ex.getMessage(), ex.getCause());
        } else {
            log.debug("{} on {}: {}", ex.getTitle(), req.getRequestURI(), ex.getMessage());
        }
        writer.write(req, resp, ex);
    }

    // ---------- request shape ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        writer.write(req, resp, validationFailed(ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        writer.write(req, resp, validationFailed(ex.getConstraintViolations().stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())));
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleUnreadable(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, new RequestExceptions.BadRequest("Malformed or missing request parameters."));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, new RequestExceptions.InvalidParameter("Parameter '" + ex.getName() + "' has invalid type."));
    }

    // ---------- routing ----------

    @ExceptionHandler(NoResourceFoundException.class)
    public void handleNoRoute(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull NoResourceFoundException ex) throws IOException {
        writer.write(req, resp, new ResourceExceptions.NotFound("No endpoint " + req.getMethod() + " " + req.getRequestURI()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, new RequestExceptions.MethodNotAllowed(
                "HTTP method " + ex.getMethod() + " is not supported for this endpoint."));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, new RequestExceptions.UnsupportedMediaType("Request body must be application/json."));
    }

    // ---------- persistence races ----------

    // unique phone/email index caught a duplicate that slipped past the service's own lookup
    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, new ResourceExceptions.Conflict("An account with these details already exists."));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public void handleOptimisticLock(@NonNull HttpServletRequest req,
                                     @NonNull HttpServletResponse resp,
                                     @NonNull ObjectOptimisticLockingFailureException ex) throws IOException {
        log.warn("Concurrent update rejected: entity={} id={}", ex.getPersistentClassName(), ex.getIdentifier());
        writer.write(req, resp, new ResourceExceptions.Conflict("The account was modified concurrently. Please retry."));
    }

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        writer.write(req, resp, new ExternalExceptions.Unexpected(ex));
    }

    private static RequestExceptions.ValidationFailed validationFailed(Stream<String> violations) {
        String details = violations.limit(MAX_FIELD_ERRORS).collect(Collectors.joining("; "));
        return new RequestExceptions.ValidationFailed(details.isBlank() ? "Request validation failed." : details);
    }
}
