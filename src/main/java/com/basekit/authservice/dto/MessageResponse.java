package com.basekit.authservice.dto;

import com.basekit.authservice.model.OutcomeMessage;

/** Body of operations whose whole result is a sentence; the envelope lifts it into {@code message}. */
public record MessageResponse(String message) implements OutcomeMessage {}
