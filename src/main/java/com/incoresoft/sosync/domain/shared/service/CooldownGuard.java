package com.incoresoft.sosync.domain.shared.service;

import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.dto.CooldownDecision;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Rate limits for starting safety checks (per group) and sending direct SOS alerts
 * (per user and group). Pure predicates over the stored timestamps, evaluated against the
 * wall clock at call time. There is no locking: two racing callers may both be allowed.
 */
@Service
@RequiredArgsConstructor
public class CooldownGuard {
    private final RecordStore store;
    private final Clock clock;

    public CooldownDecision canStartSafetyCheck(SafetyGroup group) {
        return evaluate(group.getLastSafetyCheckAt(), group.getSafetyCheckIntervalMinutes());
    }

    public CooldownDecision canSendSos(String userId, SafetyGroup group) {
        Instant last = store.findLastSosAt(userId, group.getId()).orElse(null);
        return evaluate(last, group.getSosIntervalMinutesPerUser());
    }

    private CooldownDecision evaluate(Instant last, int intervalMinutes) {
        if (last == null || intervalMinutes <= 0) return CooldownDecision.permit();
        Duration interval = Duration.ofMinutes(intervalMinutes);
        Duration elapsed = Duration.between(last, clock.instant());
        if (elapsed.compareTo(interval) >= 0) return CooldownDecision.permit();
        return CooldownDecision.denied(ceilMinutes(interval.minus(elapsed)));
    }

    static long ceilMinutes(Duration remaining) {
        long seconds = remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
        return Math.max(1, (seconds + 59) / 60);
    }
}
