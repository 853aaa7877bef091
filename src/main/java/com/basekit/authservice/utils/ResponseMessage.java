package com.basekit.authservice.utils;

import java.lang.annotation.*;

/**
 * Envelope message for a handler's successful response. Bodies implementing
 * {@link com.basekit.authservice.model.OutcomeMessage} override it.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResponseMessage {
    String value();
}
