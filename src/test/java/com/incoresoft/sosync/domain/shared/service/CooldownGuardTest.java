package com.incoresoft.sosync.domain.shared.service;

import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.shared.dto.CooldownDecision;
import com.incoresoft.sosync.support.InMemoryRecordStore;
import com.incoresoft.sosync.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownGuardTest {

    private final MutableClock clock = MutableClock.at("2025-03-01T10:00:00Z");
    private final InMemoryRecordStore store = new InMemoryRecordStore();
    private final CooldownGuard guard = new CooldownGuard(store, clock);

    private SafetyGroup group(Instant lastCheck) {
        return SafetyGroup.builder()
                .id("g1")
                .adminId("u1")
                .members(Set.of("u1", "u2"))
                .safetyCheckIntervalMinutes(30)
                .sosIntervalMinutesPerUser(5)
                .lastSafetyCheckAt(lastCheck)
                .build();
    }

    @Test
    void neverCheckedGroupMayStartCheck() {
        assertThat(guard.canStartSafetyCheck(group(null)).allowed()).isTrue();
    }

    @Test
    void checkDeniedInsideIntervalWithRemainingMinutesRoundedUp() {
        SafetyGroup group = group(clock.instant().minus(Duration.ofMinutes(10).plusSeconds(30)));

        CooldownDecision decision = guard.canStartSafetyCheck(group);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.remainingMinutes()).isEqualTo(20);
    }

    @Test
    void checkAllowedExactlyAtInterval() {
        SafetyGroup group = group(clock.instant().minus(Duration.ofMinutes(30)));

        assertThat(guard.canStartSafetyCheck(group).allowed()).isTrue();
    }

    @Test
    void permittedDecisionCarriesNoRemainingMinutes() {
        CooldownDecision decision = guard.canSendSos("u1", group(null));

        assertThat(decision).isEqualTo(CooldownDecision.permit());
        assertThat(decision.allowed()).isTrue();
        assertThat(decision.remainingMinutes()).isZero();
    }

    @Test
    void secondSosTwoMinutesLaterWaitsThreeMore() {
        store.setLastSosAt("u1", "g1", clock.instant());
        clock.advance(Duration.ofMinutes(2));

        CooldownDecision decision = guard.canSendSos("u1", group(null));

        assertThat(decision).isEqualTo(CooldownDecision.denied(3));
    }

    @Test
    void sosCooldownIsPerUserAndGroup() {
        store.setLastSosAt("u1", "g1", clock.instant());
        store.setLastSosAt("u2", "other", clock.instant());

        assertThat(guard.canSendSos("u2", group(null)).allowed()).isTrue();
        assertThat(guard.canSendSos("u1", group(null)).allowed()).isFalse();
    }

    @Test
    void denialHoldsUntilRemainingElapsesThenAllows() {
        store.setLastSosAt("u1", "g1", clock.instant());
        clock.advance(Duration.ofSeconds(61));
        CooldownDecision first = guard.canSendSos("u1", group(null));
        assertThat(first.allowed()).isFalse();

        for (int i = 0; i < 23; i++) {
            clock.advance(Duration.ofSeconds(10));
            CooldownDecision later = guard.canSendSos("u1", group(null));
            assertThat(later.allowed()).isFalse();
            assertThat(later.remainingMinutes()).isLessThanOrEqualTo(first.remainingMinutes());
        }

        clock.set(Instant.parse("2025-03-01T10:05:00.001Z"));
        assertThat(guard.canSendSos("u1", group(null)).allowed()).isTrue();
    }

    @Test
    void ceilMinutesNeverReportsZeroWhileDenied() {
        assertThat(CooldownGuard.ceilMinutes(Duration.ofMillis(1))).isEqualTo(1);
        assertThat(CooldownGuard.ceilMinutes(Duration.ofSeconds(60))).isEqualTo(1);
        assertThat(CooldownGuard.ceilMinutes(Duration.ofSeconds(61))).isEqualTo(2);
    }
}
