package com.basekit.authservice.utils;

import com.basekit.authservice.dto.PhoneValidationResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns user-typed phone numbers into E.164.
 * <p>
 * Accepted shapes (default country 234, 10-digit national numbers):
 * {@code 08012345678}, {@code 8012345678}, {@code 2348012345678},
 * {@code +2348012345678}, {@code 002348012345678}; spaces, dashes, dots and
 * parentheses are ignored. Numbers with another country code must be written
 * with {@code +} or {@code 00}.
 */
@Component
public class PhoneNumberNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s().\\-]");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final int E164_MIN_DIGITS = 8;
    private static final int E164_MAX_DIGITS = 15;
    private static final String INVALID_FORMAT = "Invalid phone number format";

    private final String countryCode;
    private final int nationalNumberLength;

    public PhoneNumberNormalizer(@Value("${app.phone.default-country-code:234}") String countryCode,
                                 @Value("${app.phone.national-number-length:10}") int nationalNumberLength) {
        this.countryCode = countryCode;
        this.nationalNumberLength = nationalNumberLength;
    }

    public PhoneValidationResult validate(String raw) {
        if (!StringUtils.hasText(raw)) {
            return PhoneValidationResult.invalid("Phone number is required");
        }
        String s = SEPARATORS.matcher(raw.trim()).replaceAll("");

        boolean international = false;
        if (s.startsWith("+")) {
            s = s.substring(1);
            international = true;
        } else if (s.startsWith("00")) {
            s = s.substring(2);
            international = true;
        }
        if (!DIGITS.matcher(s).matches()) {
            return PhoneValidationResult.invalid(INVALID_FORMAT);
        }

        final String digits;
        if (international) {
            digits = s;
        } else if (s.startsWith("0") && s.length() == nationalNumberLength + 1) {
            digits = countryCode + s.substring(1);
        } else if (s.startsWith(countryCode) && s.length() == countryCode.length() + nationalNumberLength) {
            digits = s;
        } else if (s.length() == nationalNumberLength) {
            digits = countryCode + s;
        } else {
            return PhoneValidationResult.invalid(INVALID_FORMAT);
        }

        if (digits.startsWith("0") || digits.length() < E164_MIN_DIGITS || digits.length() > E164_MAX_DIGITS) {
            return PhoneValidationResult.invalid(INVALID_FORMAT);
        }
        // home-country numbers have a fixed national length and no trunk zero
        if (digits.startsWith(countryCode)) {
            String national = digits.substring(countryCode.length());
            if (national.length() != nationalNumberLength || national.startsWith("0")) {
                return PhoneValidationResult.invalid(INVALID_FORMAT);
            }
        }
        return PhoneValidationResult.valid("+" + digits);
    }

    public Optional<String> normalize(String raw) {
        PhoneValidationResult result = validate(raw);
        return result.valid() ? Optional.of(result.formattedNumber()) : Optional.empty();
    }
}
