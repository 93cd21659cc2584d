package com.incoresoft.sosync.domain.group.service;

import com.incoresoft.sosync.config.SafetyProps;
import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.sos.dto.SosAlert;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives the one status a group should show from its current alerts and checks.
 * <p>
 * Total and side-effect free: the same records always give the same status, so any number
 * of racing writers converge once their writes are visible. Precedence follows
 * {@link GroupStatus#getPriority()}:
 * <ol>
 *     <li>an active SOS alert, or a pending check holding an SOS answer: Emergency</li>
 *     <li>any pending check: CheckingStatus</li>
 *     <li>the latest completed check is AllSafe and still inside the reset window: AllSafe</li>
 *     <li>otherwise Normal</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class GroupStatusResolver {
    private final SafetyProps props;

    public GroupStatus resolve(SafetyGroup group, Collection<SosAlert> alerts,
                               Collection<SafetyCheck> checks, Instant now) {
        boolean activeAlert = alerts.stream()
                .filter(a -> Objects.equals(a.getGroupId(), group.getId()))
                .anyMatch(SosAlert::isActive);
        boolean pendingSos = checks.stream()
                .filter(SafetyCheck::isPending)
                .anyMatch(SafetyCheck::hasSosResponse);
        if (activeAlert || pendingSos) return GroupStatus.EMERGENCY;

        if (checks.stream().anyMatch(SafetyCheck::isPending)) return GroupStatus.CHECKING_STATUS;

        Optional<SafetyCheck> latestCompleted = checks.stream()
                .filter(c -> c.getStatus().isTerminal())
                .max(Comparator.comparing(GroupStatusResolver::completionTime,
                        Comparator.nullsFirst(Comparator.naturalOrder())));
        if (latestCompleted.isPresent()
                && latestCompleted.get().getStatus() == SafetyCheckStatus.ALL_SAFE
                && withinResetWindow(latestCompleted.get(), now)) {
            return GroupStatus.ALL_SAFE;
        }
        return GroupStatus.NORMAL;
    }

    private boolean withinResetWindow(SafetyCheck check, Instant now) {
        Instant completed = completionTime(check);
        if (completed == null) return false;
        Duration window = props.getResetDelay();
        return Duration.between(completed, now).compareTo(window) < 0;
    }

    /** Older records carry no completedAt; their creation time stands in. */
    private static Instant completionTime(SafetyCheck check) {
        return check.getCompletedAt() != null ? check.getCompletedAt() : check.getCreatedAt();
    }
}
