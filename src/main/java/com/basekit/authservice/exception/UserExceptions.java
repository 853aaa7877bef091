package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * User-domain specific exceptions (registration and administration of identities).
 * Authentication failures live in {@link AuthExceptions}.
 */
public final class UserExceptions {

    private UserExceptions() {}

    /** 404 Not Found – User record not present. */
    public static final class UserNotFound extends ApiException {
        public UserNotFound(String detail) {
            super(HttpStatus.NOT_FOUND,
                    "https://basekit.dev/problems/user-not-found",
                    "User Not Found",
                    detail);
        }
    }

    /** 400 Bad Request – Phone or email already registered at signup. */
    public static final class UserAlreadyExists extends ApiException {
        public UserAlreadyExists(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/user-already-exists",
                    "User Already Exists",
                    detail);
        }
    }
}
