package com.basekit.authservice.dto;

/**
 * Outcome of phone normalisation. {@code formattedNumber} is E.164 when valid,
 * {@code error} is a client-safe reason otherwise.
 */
public record PhoneValidationResult(boolean valid, String formattedNumber, String error) {

    public static PhoneValidationResult valid(String formattedNumber) {
        return new PhoneValidationResult(true, formattedNumber, null);
    }

    public static PhoneValidationResult invalid(String error) {
        return new PhoneValidationResult(false, null, error);
    }
}
