package com.incoresoft.sosync.domain.shared.dto;

/**
 * Outcome of a rate-limit check.
 *
 * @param remainingMinutes whole minutes, rounded up, until the action is allowed again; 0 when allowed
 */
public record CooldownDecision(boolean allowed, long remainingMinutes) {

    private static final CooldownDecision ALLOWED = new CooldownDecision(true, 0);

    public static CooldownDecision permit() {
        return ALLOWED;
    }

    public static CooldownDecision denied(long remainingMinutes) {
        return new CooldownDecision(false, remainingMinutes);
    }
}
