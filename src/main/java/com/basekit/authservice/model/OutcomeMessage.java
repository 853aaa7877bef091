package com.basekit.authservice.model;

/**
 * Implemented by response bodies whose text depends on how the operation went,
 * such as signup with or without a delivered OTP. The envelope shows that text
 * instead of the endpoint's fixed {@code @ResponseMessage}.
 */
public interface OutcomeMessage {

    String message();
}
