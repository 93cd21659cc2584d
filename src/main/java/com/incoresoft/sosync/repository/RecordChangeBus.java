package com.incoresoft.sosync.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed change channel per (record kind, group). Store implementations publish every
 * write here; listeners get the new value pushed instead of re-reading whole tables.
 */
@Slf4j
@Component
public class RecordChangeBus {
    private final Map<ChannelKey, List<Consumer<RecordChange>>> channels = new ConcurrentHashMap<>();

    public Subscription subscribe(RecordKind kind, String groupId, Consumer<RecordChange> listener) {
        Objects.requireNonNull(listener, "listener");
        ChannelKey key = new ChannelKey(kind, groupId);
        channels.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("[BUS] subscribed to {}/{}", kind, groupId);
        return () -> {
            List<Consumer<RecordChange>> listeners = channels.get(key);
            if (listeners != null) {
                listeners.remove(listener);
                channels.computeIfPresent(key, (k, l) -> l.isEmpty() ? null : l);
            }
        };
    }

    public void publish(RecordChange change) {
        List<Consumer<RecordChange>> listeners = channels.get(new ChannelKey(change.kind(), change.groupId()));
        if (listeners == null) return;
        for (Consumer<RecordChange> listener : listeners) {
            try {
                listener.accept(change);
            } catch (Exception ex) {
                log.warn("[BUS] listener failed for {} {}: {}", change.kind(), change.recordId(), ex.getMessage(), ex);
            }
        }
    }

    public int subscriberCount(RecordKind kind, String groupId) {
        List<Consumer<RecordChange>> listeners = channels.get(new ChannelKey(kind, groupId));
        return listeners == null ? 0 : listeners.size();
    }

    private record ChannelKey(RecordKind kind, String groupId) {
    }
}
