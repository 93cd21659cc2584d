package com.incoresoft.sosync.web;

import com.incoresoft.sosync.domain.group.service.GroupService;
import com.incoresoft.sosync.repository.RecordChange;
import com.incoresoft.sosync.repository.RecordKind;
import com.incoresoft.sosync.repository.RecordStore;
import com.incoresoft.sosync.repository.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.incoresoft.sosync.web.GroupController.USER_HEADER;

/**
 * Server-sent events with every change to a group, its checks and its alerts.
 * Event name is the record kind; data is the record, or only its id after a deletion.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GroupEventsController {
    private static final long TIMEOUT_MS = 30 * 60 * 1000L;

    private final GroupService groupService;
    private final RecordStore store;

    @GetMapping(path = "/groups/{groupId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@RequestHeader(USER_HEADER) String userId, @PathVariable String groupId) {
        groupService.getGroup(groupId, userId);

        SseEmitter emitter = new SseEmitter(TIMEOUT_MS);
        // a push may fail and unsubscribe on the bus thread while the loop below still subscribes
        List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
        Runnable unsubscribe = () -> subscriptions.forEach(Subscription::close);
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(ex -> unsubscribe.run());
        for (RecordKind kind : RecordKind.values()) {
            subscriptions.add(store.subscribe(kind, groupId, change -> push(emitter, change, unsubscribe)));
        }
        log.info("[GROUP] {} listening to events of {}", userId, groupId);
        return emitter;
    }

    private void push(SseEmitter emitter, RecordChange change, Runnable unsubscribe) {
        Object data = change.isDeletion() ? deletion(change) : change.record();
        try {
            emitter.send(SseEmitter.event()
                    .name(change.kind().name())
                    .id(change.recordId())
                    .data(data, MediaType.APPLICATION_JSON));
        } catch (IOException ex) {
            log.debug("Event stream closed by client: {}", ex.getMessage());
            unsubscribe.run();
            emitter.completeWithError(ex);
        }
    }

    private static Map<String, Object> deletion(RecordChange change) {
        Map<String, Object> body = new HashMap<>();
        body.put("id", change.recordId());
        body.put("deleted", true);
        return body;
    }
}
