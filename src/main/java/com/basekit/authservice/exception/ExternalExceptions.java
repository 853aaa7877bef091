package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Typed exceptions for failures caused by external/third-party systems
 * (SMS gateway, SMTP relay), plus the catch-all for anything unexpected.
 *
 * Suggested usage:
 * - Throw from adapters that call external services.
 * - Wrap low-level provider exceptions, keeping them as the cause.
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /**
     * 502 Bad Gateway – A message could not be handed to the SMS or mail provider.
     * Any state persisted before the dispatch attempt stays in place.
     */
    public static final class DeliveryFailed extends ApiException {
        public DeliveryFailed(String detail) {
            super(HttpStatus.BAD_GATEWAY,
                    "https://basekit.dev/problems/delivery-failed",
                    "Delivery Failed",
                    detail);
        }

        public DeliveryFailed(String detail, Throwable cause) {
            super(HttpStatus.BAD_GATEWAY,
                    "https://basekit.dev/problems/delivery-failed",
                    "Delivery Failed",
                    detail,
                    cause);
        }
    }

    /** 500 Internal Server Error – Anything unexpected; the client only ever sees the generic detail. */
    public static final class Unexpected extends ApiException {
        public Unexpected(Throwable cause) {
            super(HttpStatus.INTERNAL_SERVER_ERROR,
                    "https://basekit.dev/problems/internal-error",
                    "Internal Server Error",
                    "An unexpected error occurred.",
                    cause);
        }
    }
}
