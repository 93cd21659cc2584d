package com.incoresoft.sosync.domain.check.service;

import com.incoresoft.sosync.config.SafetyProps;
import com.incoresoft.sosync.domain.check.dto.SafetyCheck;
import com.incoresoft.sosync.domain.check.dto.SafetyCheckStatus;
import com.incoresoft.sosync.domain.group.dto.GroupStatus;
import com.incoresoft.sosync.domain.group.dto.SafetyGroup;
import com.incoresoft.sosync.domain.group.service.GroupStatusService;
import com.incoresoft.sosync.domain.group.service.StatusResetScheduler;
import com.incoresoft.sosync.domain.shared.exception.InconsistentRecordException;
import com.incoresoft.sosync.domain.shared.exception.NotFoundException;
import com.incoresoft.sosync.notification.GroupNotifications;
import com.incoresoft.sosync.repository.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides whether a safety check has heard from every member and finalizes it.
 * <p>
 * Evaluation reads the check and the group's current membership from the store each time,
 * so it can be repeated any number of times and by any number of callers. A check leaves
 * Pending exactly once; the store refuses to move a check that is already terminal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseAggregator {
    private final RecordStore store;
    private final GroupStatusService statusService;
    private final StatusResetScheduler resetScheduler;
    private final GroupNotifications notifications;
    private final SafetyProps props;
    private final Clock clock;
    private final RetryTemplate evaluationRetryTemplate;

    /**
     * Aggregate view of a check's answers against a member set.
     */
    public record Aggregate(boolean complete, boolean hasSos, Set<String> missingMembers) {
        public SafetyCheckStatus finalStatus() {
            if (!complete) return SafetyCheckStatus.PENDING;
            return hasSos ? SafetyCheckStatus.EMERGENCY : SafetyCheckStatus.ALL_SAFE;
        }
    }

    public Aggregate aggregate(SafetyCheck check, Collection<String> members) {
        Set<String> missing = new LinkedHashSet<>(members);
        missing.removeAll(check.getResponses().keySet());
        return new Aggregate(missing.isEmpty(), check.hasSosResponse(), missing);
    }

    /**
     * Waits for the settle delay, then evaluates. The wait only thins out redundant work
     * when several answers land together.
     */
    public SafetyCheck settleAndEvaluate(String checkId, String contextGroupId) {
        settle();
        return evaluate(checkId, contextGroupId);
    }

    /**
     * Evaluates completion, retrying the evaluation (never the write that triggered it) on
     * store failures.
     */
    public SafetyCheck evaluate(String checkId, String contextGroupId) {
        return evaluationRetryTemplate.execute(ctx -> {
            if (ctx.getRetryCount() > 0) {
                log.warn("[CHECK] evaluation of {} retried, attempt {}", checkId, ctx.getRetryCount() + 1);
            }
            return evaluateOnce(checkId, contextGroupId);
        });
    }

    /**
     * The group a check belongs to. Falls back to the group the caller is working in when the
     * record lacks one.
     */
    public String groupIdOf(SafetyCheck check, String contextGroupId) {
        if (StringUtils.isNotBlank(check.getGroupId())) return check.getGroupId();
        if (StringUtils.isNotBlank(contextGroupId)) {
            log.warn("[CHECK] check {} has no groupId, using caller group {}", check.getId(), contextGroupId);
            return contextGroupId;
        }
        throw new InconsistentRecordException("Safety check " + check.getId() + " has no groupId");
    }

    private SafetyCheck evaluateOnce(String checkId, String contextGroupId) {
        SafetyCheck check = store.findCheck(checkId)
                .orElseThrow(() -> new NotFoundException("Safety check", checkId));
        if (!check.isPending()) {
            log.debug("[CHECK] {} already {}", checkId, check.getStatus());
            return check;
        }
        String groupId = groupIdOf(check, contextGroupId);
        SafetyGroup group = store.findGroup(groupId)
                .orElseThrow(() -> new NotFoundException("Group", groupId));

        Aggregate aggregate = aggregate(check, group.getMembers());
        if (!aggregate.complete()) {
            store.markCheckStatus(checkId, SafetyCheckStatus.PENDING, null);
            statusService.refresh(groupId);
            log.info("[CHECK] {} pending, {}/{} answered, waiting for {}", checkId,
                    group.getMembers().size() - aggregate.missingMembers().size(),
                    group.getMembers().size(), aggregate.missingMembers());
            return reread(check);
        }

        SafetyCheckStatus finalStatus = aggregate.finalStatus();
        if (!store.markCheckStatus(checkId, finalStatus, clock.instant())) {
            log.info("[CHECK] {} was finalized concurrently", checkId);
            return reread(check);
        }
        log.info("[CHECK] {} completed as {}", checkId, finalStatus);

        // the alert behind an SOS answer may already be resolved
        GroupStatus status = statusService.refresh(groupId);
        if (finalStatus == SafetyCheckStatus.ALL_SAFE) {
            resetScheduler.schedule(groupId, props.getResetDelay());
        }
        notifications.checkCompleted(groupId, checkId, status);
        return reread(check);
    }

    private SafetyCheck reread(SafetyCheck fallback) {
        return store.findCheck(fallback.getId()).orElse(fallback);
    }

    private void settle() {
        Duration delay = props.getSettleDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[CHECK] settle delay interrupted, evaluating now");
        }
    }
}
