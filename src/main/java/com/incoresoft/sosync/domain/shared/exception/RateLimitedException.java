package com.incoresoft.sosync.domain.shared.exception;

import lombok.Getter;

/**
 * The action is still cooling down. Never retried automatically.
 */
@Getter
public class RateLimitedException extends SafetyException {
    private final long remainingMinutes;

    public RateLimitedException(String message, long remainingMinutes) {
        super("rate_limited", message);
        this.remainingMinutes = remainingMinutes;
    }
}
