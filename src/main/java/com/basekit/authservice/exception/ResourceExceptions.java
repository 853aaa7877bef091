package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exceptions representing resource lifecycle errors (not found, state conflicts,
 * optimistic locking mismatches).
 *
 * Conventions:
 *  - type:  https://basekit.dev/problems/<slug>
 */
public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 Not Found – Target resource does not exist. */
    public static final class NotFound extends ApiException {
        public NotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://basekit.dev/problems/not-found",
                    "Resource Not Found",
                    detail);
        }
    }

    /** 409 Conflict – Duplicate unique key or a concurrent update won the race. */
    public static final class Conflict extends ApiException {
        public Conflict(String detail) {
            super(HttpStatus.CONFLICT,
                    "https://basekit.dev/problems/conflict",
                    "Conflict",
                    detail);
        }
    }
}
