package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exceptions representing problems with the incoming client request itself
 * (malformed input, unknown accounts in public flows, request budgets).
 *
 * Conventions:
 *  - type:  https://basekit.dev/problems/<slug>
 *  - title: short, human-readable summary
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – Request is syntactically incorrect or semantically invalid (generic). */
    public static final class BadRequest extends ApiException {
        public BadRequest(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/bad-request",
                    "Bad Request",
                    detail);
        }
    }

    /** 400 Bad Request – A parameter is present but cannot be interpreted (e.g. phone format). */
    public static final class InvalidParameter extends ApiException {
        public InvalidParameter(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/invalid-parameter",
                    "Invalid Parameter",
                    detail);
        }
    }

    /** 422 Unprocessable Entity – Body or parameters failed bean validation. */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.UNPROCESSABLE_ENTITY,
                    "https://basekit.dev/problems/validation-error",
                    "Validation Error",
                    detail);
        }
    }

    /** 405 Method Not Allowed – Route exists but not for this HTTP method. */
    public static final class MethodNotAllowed extends ApiException {
        public MethodNotAllowed(String detail) {
            super(HttpStatus.METHOD_NOT_ALLOWED,
                    "https://basekit.dev/problems/method-not-allowed",
                    "Method Not Allowed",
                    detail);
        }
    }

    /** 415 Unsupported Media Type – Body is not JSON. */
    public static final class UnsupportedMediaType extends ApiException {
        public UnsupportedMediaType(String detail) {
            super(HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                    "https://basekit.dev/problems/unsupported-media-type",
                    "Unsupported Media Type",
                    detail);
        }
    }

    /** 429 Too Many Requests – OTP interval or daily budget exhausted. */
    public static final class RateLimited extends ApiException {
        public RateLimited(String detail) {
            super(HttpStatus.TOO_MANY_REQUESTS,
                    "https://basekit.dev/problems/rate-limited",
                    "Too Many Requests",
                    detail);
        }
    }
}
