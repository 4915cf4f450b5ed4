package com.example.omnichat.realtime;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.event.ConversationEventPublisher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ephemeral online state of widget customers, kept per node and never persisted. A record is online
 * while its last heartbeat is no older than the configured timeout.
 */
@Slf4j
@Component
public class PresenceTracker {

    private final ConcurrentMap<PresenceKey, Instant> lastHeartbeats = new ConcurrentHashMap<>();
    private final ConversationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration timeout;

    public PresenceTracker(ConversationEventPublisher eventPublisher, OmnichatProperties properties, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.timeout = properties.getPresence().getTimeout();
    }

    public void connect(String conversationId, String sessionId) {
        Instant now = clock.instant();
        lastHeartbeats.put(new PresenceKey(conversationId, sessionId), now);
        log.debug("Customer session {} online in conversation {}", sessionId, conversationId);
        eventPublisher.customerOnline(conversationId, sessionId, now);
    }

    /**
     * Refreshes the record. A heartbeat for a missing or expired record counts as a reconnect and
     * announces the customer online again before the heartbeat itself.
     */
    public void heartbeat(String conversationId, String sessionId) {
        Instant now = clock.instant();
        Instant previous = lastHeartbeats.put(new PresenceKey(conversationId, sessionId), now);
        if (previous == null || isExpired(previous, now)) {
            eventPublisher.customerOnline(conversationId, sessionId, now);
        }
        eventPublisher.customerHeartbeat(conversationId, sessionId, now);
    }

    public void disconnect(String conversationId, String sessionId) {
        if (lastHeartbeats.remove(new PresenceKey(conversationId, sessionId)) != null) {
            log.debug("Customer session {} left conversation {}", sessionId, conversationId);
            eventPublisher.customerOffline(conversationId, sessionId, clock.instant());
        }
    }

    public boolean isOnline(String conversationId, String sessionId) {
        Instant last = lastHeartbeats.get(new PresenceKey(conversationId, sessionId));
        return last != null && !isExpired(last, clock.instant());
    }

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${omnichat.presence.sweep-interval:PT10S}').toMillis()}")
    public void sweep() {
        Instant now = clock.instant();
        int expired = 0;
        for (Map.Entry<PresenceKey, Instant> entry : lastHeartbeats.entrySet()) {
            if (isExpired(entry.getValue(), now) && lastHeartbeats.remove(entry.getKey(), entry.getValue())) {
                expired++;
                eventPublisher.customerOffline(entry.getKey().conversationId(), entry.getKey().sessionId(), now);
            }
        }
        if (expired > 0) {
            log.debug("Presence sweep marked {} customer sessions offline", expired);
        }
    }

    private boolean isExpired(Instant last, Instant now) {
        return Duration.between(last, now).compareTo(timeout) > 0;
    }

    private record PresenceKey(String conversationId, String sessionId) {}
}
