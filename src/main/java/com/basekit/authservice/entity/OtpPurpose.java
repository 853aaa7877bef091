package com.basekit.authservice.entity;

import java.time.Instant;

/**
 * The three one-time-code slots on {@link User}. Each constant knows where its
 * code lives, which flag (if any) makes issuing pointless, what consuming it
 * changes and over which channel the code travels.
 */
public enum OtpPurpose {

    PHONE_VERIFICATION(OtpChannel.SMS, "Phone number is already verified") {
        @Override
        public String code(User user) {
            return user.getPhoneVerificationOtp();
        }

        @Override
        public Instant expiresAt(User user) {
            return user.getPhoneVerificationOtpExpires();
        }

        @Override
        public void store(User user, String code, Instant expiresAt) {
            user.setPhoneVerificationOtp(code);
            user.setPhoneVerificationOtpExpires(expiresAt);
        }

        @Override
        public boolean isAlreadyVerified(User user) {
            return user.isPhoneVerified();
        }

        @Override
        public void applyConsumed(User user) {
            user.setPhoneVerified(true);
        }
    },

    EMAIL_VERIFICATION(OtpChannel.EMAIL, "Email is already verified") {
        @Override
        public String code(User user) {
            return user.getEmailVerificationOtp();
        }

        @Override
        public Instant expiresAt(User user) {
            return user.getEmailVerificationOtpExpires();
        }

        @Override
        public void store(User user, String code, Instant expiresAt) {
            user.setEmailVerificationOtp(code);
            user.setEmailVerificationOtpExpires(expiresAt);
        }

        @Override
        public boolean isAlreadyVerified(User user) {
            return user.isEmailVerified();
        }

        @Override
        public void applyConsumed(User user) {
            user.setEmailVerified(true);
        }
    },

    /** Never blocked by a verification flag; consuming it only clears the slot. */
    PASSWORD_RESET(OtpChannel.SMS, null) {
        @Override
        public String code(User user) {
            return user.getResetPasswordOtp();
        }

        @Override
        public Instant expiresAt(User user) {
            return user.getResetPasswordOtpExpires();
        }

        @Override
        public void store(User user, String code, Instant expiresAt) {
            user.setResetPasswordOtp(code);
            user.setResetPasswordOtpExpires(expiresAt);
        }

        @Override
        public boolean isAlreadyVerified(User user) {
            return false;
        }

        @Override
        public void applyConsumed(User user) {
            // the password change itself is applied by the caller
        }
    };

    private final OtpChannel channel;
    private final String alreadyVerifiedMessage;

    OtpPurpose(OtpChannel channel, String alreadyVerifiedMessage) {
        this.channel = channel;
        this.alreadyVerifiedMessage = alreadyVerifiedMessage;
    }

    public abstract String code(User user);

    public abstract Instant expiresAt(User user);

    public abstract void store(User user, String code, Instant expiresAt);

    public abstract boolean isAlreadyVerified(User user);

    public abstract void applyConsumed(User user);

    public void clear(User user) {
        store(user, null, null);
    }

    public OtpChannel channel() {
        return channel;
    }

    public String alreadyVerifiedMessage() {
        return alreadyVerifiedMessage;
    }
}
