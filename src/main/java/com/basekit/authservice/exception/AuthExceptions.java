package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Authentication and authorization failures raised by the login flow and the
 * session token validator.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 Unauthorized – Unknown phone or wrong password; the detail never says which. */
    public static final class Unauthorized extends ApiException {
        public Unauthorized(String detail) {
            super(HttpStatus.UNAUTHORIZED,
                    "https://basekit.dev/problems/unauthorized",
                    "Unauthorized",
                    detail);
        }
    }

    /** 403 Forbidden – Credentials are right but the account may not sign in. */
    public static final class Forbidden extends ApiException {
        public Forbidden(String detail) {
            super(HttpStatus.FORBIDDEN,
                    "https://basekit.dev/problems/forbidden",
                    "Forbidden",
                    detail);
        }
    }

    /** 401 Unauthorized – Session token is past its expiry. */
    public static final class TokenExpired extends ApiException {
        public TokenExpired() {
            super(HttpStatus.UNAUTHORIZED,
                    "https://basekit.dev/problems/token-expired",
                    "Token Expired",
                    "Session token has expired");
        }
    }

    /** 401 Unauthorized – Signature, format or claim checks failed. */
    public static final class TokenInvalid extends ApiException {
        public TokenInvalid(String detail) {
            super(HttpStatus.UNAUTHORIZED,
                    "https://basekit.dev/problems/token-invalid",
                    "Token Invalid",
                    detail);
        }
    }
}
