package com.incoresoft.sosync.domain.check.service;

import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.check.dto.SafetyResponseStatus;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.shared.dto.LocationData;
import com.incoresoft.sosync.domain.shared.exception.InconsistentRecordException;
import com.incoresoft.sosync.domain.shared.exception.PermissionDeniedException;
import com.incoresoft.sosync.domain.shared.exception.RateLimitedException;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import com.incoresoft.sosync.support.CoordinationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SafetyCheckCoordinatorTest {

    private CoordinationFixture f;
    private SafetyCheckCoordinator coordinator;

    @BeforeEach
    void setUp() {
        f = new CoordinationFixture();
        coordinator = f.checks;
        f.group("g1", "u1", "u2", "u3");
    }

    @Test
    void everyoneSafeCompletesCheckAsAllSafeAndArmsReset() {
        SafetyCheck check = coordinator.initiate("g1", "u1");
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.CHECKING_STATUS);
        assertThat(f.store.findGroup("g1").orElseThrow().getLastSafetyCheckAt()).isEqualTo(f.now());

        coordinator.respond(check.getId(), "u1", SafetyResponseStatus.SAFE, null, null, null);
        coordinator.respond(check.getId(), "u2", SafetyResponseStatus.SAFE, null, null, null);
        assertThat(f.store.findCheck(check.getId()).orElseThrow().getStatus()).isEqualTo(SafetyCheckStatus.PENDING);
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.CHECKING_STATUS);

        SafetyCheck done = coordinator.respond(check.getId(), "u3", SafetyResponseStatus.SAFE, null, null, null);

        assertThat(done.getStatus()).isEqualTo(SafetyCheckStatus.ALL_SAFE);
        assertThat(done.getCompletedAt()).isEqualTo(f.now());
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.ALL_SAFE);
        verify(f.taskScheduler).schedule(any(Runnable.class), eq(f.now().plus(Duration.ofMinutes(60))));
    }

    @Test
    void sosAnswerEscalatesAtOnceAndCheckEndsInEmergency() {
        SafetyCheck check = coordinator.initiate("g1", "u1");

        SafetyCheck afterSos = coordinator.respond(check.getId(), "u1", SafetyResponseStatus.SOS,
                null, "fell down", null);

        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.EMERGENCY);
        assertThat(afterSos.getStatus()).isEqualTo(SafetyCheckStatus.PENDING);
        List<SosAlert> alerts = f.store.findAlertsByGroup("g1");
        assertThat(alerts).hasSize(1);
        SosAlert alert = alerts.get(0);
        assertThat(alert.getUserId()).isEqualTo("u1");
        assertThat(alert.isActive()).isTrue();
        assertThat(alert.getOriginSafetyCheckId()).isEqualTo(check.getId());
        assertThat(alert.getLocation()).isEqualTo(LocationData.unknown(f.props.getCheckResponseAddress()));
        assertThat(alert.getMessage()).isEqualTo("fell down");

        coordinator.respond(check.getId(), "u2", SafetyResponseStatus.SAFE, null, null, null);
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.EMERGENCY);
        SafetyCheck done = coordinator.respond(check.getId(), "u3", SafetyResponseStatus.SAFE, null, null, null);

        assertThat(done.getStatus()).isEqualTo(SafetyCheckStatus.EMERGENCY);
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.EMERGENCY);
        verify(f.taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void startingCheckDoesNotMaskActiveEmergency() {
        f.sos.sendDirect("u2", "g1", new LocationData(1, 2, null), null);

        coordinator.initiate("g1", "u1");

        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.EMERGENCY);
    }

    @Test
    void secondCheckInsideIntervalIsRateLimited() {
        coordinator.initiate("g1", "u1");
        f.clock.advance(Duration.ofMinutes(12));

        assertThatThrownBy(() -> coordinator.initiate("g1", "u2"))
                .isInstanceOf(RateLimitedException.class)
                .hasMessage("Wait 18 more minutes.")
                .extracting(ex -> ((RateLimitedException) ex).getRemainingMinutes())
                .isEqualTo(18L);
        assertThat(f.store.findChecksByGroup("g1")).hasSize(1);
    }

    @Test
    void outsiderCannotStartOrAnswer() {
        SafetyCheck check = coordinator.initiate("g1", "u1");

        assertThatThrownBy(() -> coordinator.initiate("g1", "stranger"))
                .isInstanceOf(PermissionDeniedException.class);
        assertThatThrownBy(() -> coordinator.respond(check.getId(), "stranger", SafetyResponseStatus.SAFE,
                null, null, null))
                .isInstanceOf(PermissionDeniedException.class);
    }

    @Test
    void lateAnswerDoesNotRevertCompletedCheck() {
        f.group("g2", "a", "b");
        SafetyCheck check = coordinator.initiate("g2", "a");
        coordinator.respond(check.getId(), "a", SafetyResponseStatus.SAFE, null, null, null);
        coordinator.respond(check.getId(), "b", SafetyResponseStatus.NO_RESPONSE, null, null, null);
        assertThat(f.store.findCheck(check.getId()).orElseThrow().getStatus()).isEqualTo(SafetyCheckStatus.ALL_SAFE);

        SafetyCheck after = coordinator.respond(check.getId(), "b", SafetyResponseStatus.SAFE, null, null, null);

        assertThat(after.getStatus()).isEqualTo(SafetyCheckStatus.ALL_SAFE);
    }

    @Test
    void safeAnswerSupersedesOlderAlertOfSameUser() {
        f.sos.sendDirect("u2", "g1", new LocationData(1, 2, null), null);
        f.clock.advance(Duration.ofMinutes(1));
        SafetyCheck check = coordinator.initiate("g1", "u1");

        coordinator.respond(check.getId(), "u2", SafetyResponseStatus.SAFE, null, null, null);

        SosAlert alert = f.store.findAlertsByGroup("g1").get(0);
        assertThat(alert.isActive()).isFalse();
        assertThat(alert.getResolvedReason()).isEqualTo("superseded by later Safe response");
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.CHECKING_STATUS);
    }

    @Test
    void overlappingChecksLeaveNoEmergencyWithoutCause() {
        SafetyCheck first = coordinator.initiate("g1", "u1");
        coordinator.respond(first.getId(), "u1", SafetyResponseStatus.SOS, null, null, null);
        f.clock.advance(Duration.ofMinutes(31));

        SafetyCheck second = coordinator.initiate("g1", "u2");
        coordinator.respond(second.getId(), "u1", SafetyResponseStatus.SAFE, null, null, null);
        coordinator.respond(second.getId(), "u2", SafetyResponseStatus.SAFE, null, null, null);
        coordinator.respond(second.getId(), "u3", SafetyResponseStatus.SAFE, null, null, null);
        assertThat(f.store.findAlertsByGroup("g1")).noneMatch(SosAlert::isActive);
        // the earlier check still holds an SOS answer
        assertThat(f.statusOf("g1")).isEqualTo(GroupStatus.EMERGENCY);

        f.clock.advance(Duration.ofMinutes(1));
        coordinator.respond(first.getId(), "u2", SafetyResponseStatus.SAFE, null, null, null);
        SafetyCheck done = coordinator.respond(first.getId(), "u3", SafetyResponseStatus.SAFE, null, null, null);

        assertThat(done.getStatus()).isEqualTo(SafetyCheckStatus.EMERGENCY);
        assertThat(f.store.findChecksByGroup("g1")).noneMatch(SafetyCheck::isPending);
        GroupStatus stored = f.statusOf("g1");
        assertThat(stored).isNotEqualTo(GroupStatus.EMERGENCY);
        assertThat(f.statusService.refresh("g1")).isEqualTo(stored);
        verify(f.taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void checkWithoutGroupIdUsesCallerGroup() {
        f.store.putRawCheck(SafetyCheck.builder().id("legacy").initiatedBy("u1").createdAt(f.now()).build());

        SafetyCheck result = coordinator.respond("legacy", "u1", SafetyResponseStatus.SAFE, null, null, "g1");

        assertThat(result.getResponses()).containsKey("u1");
        assertThat(result.getStatus()).isEqualTo(SafetyCheckStatus.PENDING);
    }

    @Test
    void checkWithoutGroupIdAndNoCallerGroupIsInconsistent() {
        f.store.putRawCheck(SafetyCheck.builder().id("legacy").initiatedBy("u1").createdAt(f.now()).build());

        assertThatThrownBy(() -> coordinator.respond("legacy", "u1", SafetyResponseStatus.SAFE, null, null, null))
                .isInstanceOf(InconsistentRecordException.class);
    }

    @Test
    void startNotifiesEveryoneButInitiator() {
        coordinator.initiate("g1", "u1");

        verify(f.dispatcher, times(1)).send(eq("g1"), eq("Safety Check"), eq("Please confirm if you are safe"),
                anyMap(), eq("u1"));
    }
}
