package com.basekit.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * One-time-code failures. Each is a 400 with its own problem type so clients can
 * tell "request a new code" apart from "retype the code".
 */
public final class OtpExceptions {

    private OtpExceptions() {}

    public static final class AlreadyVerified extends ApiException {
        public AlreadyVerified(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/already-verified",
                    "Already Verified",
                    detail);
        }
    }

    public static final class OtpNotFound extends ApiException {
        public OtpNotFound() {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/otp-not-found",
                    "OTP Not Found",
                    "No OTP found. Please request a new one");
        }
    }

    public static final class OtpExpired extends ApiException {
        public OtpExpired() {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/otp-expired",
                    "OTP Expired",
                    "OTP has expired. Please request a new one");
        }
    }

    public static final class OtpMismatch extends ApiException {
        public OtpMismatch() {
            super(HttpStatus.BAD_REQUEST,
                    "https://basekit.dev/problems/otp-mismatch",
                    "Invalid OTP",
                    "Invalid OTP");
        }
    }
}
