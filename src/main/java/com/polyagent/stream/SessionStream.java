package com.polyagent.stream;

import static com.polyagent.orchestration.OrchestrationConstants.TERMINAL_EVENTS;

import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event log of one collaboration session: a bounded replay window plus its live subscribers.
 * The log closes on the first terminal event, so a session never reports two outcomes.
 */
class SessionStream {
    private final String sessionId;
    private final int capacity;
    private final AtomicLong sequence = new AtomicLong();
    private final Deque<StreamEvent> window = new ArrayDeque<>();
    private final Map<String, WebSocketSession> subscribers = new ConcurrentHashMap<>();
    private volatile String outcome;
    private volatile Instant lastUpdated = Instant.now();

    SessionStream(String sessionId, int capacity) {
        this.sessionId = sessionId;
        this.capacity = capacity;
    }

    String sessionId() {
        return sessionId;
    }

    Map<String, WebSocketSession> subscribers() {
        return subscribers;
    }

    /**
     * Appends an event, dropping the oldest once the window is full.
     *
     * @return the event, or {@code null} when the session already ended
     */
    @Nullable
    synchronized StreamEvent append(String type, Object data) {
        if (outcome != null) {
            return null;
        }
        StreamEvent event = new StreamEvent(sequence.incrementAndGet(), Instant.now(), type, data);
        window.addLast(event);
        while (window.size() > capacity) {
            window.removeFirst();
        }
        if (TERMINAL_EVENTS.contains(type)) {
            outcome = type;
        }
        lastUpdated = event.timestamp();
        return event;
    }

    synchronized List<StreamEvent> since(long sinceId) {
        return window.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    boolean ended() {
        return outcome != null;
    }

    /**
     * Ended, unwatched and idle since before {@code cutoff}.
     */
    boolean expired(Instant cutoff) {
        return ended() && subscribers.isEmpty() && lastUpdated.isBefore(cutoff);
    }
}
