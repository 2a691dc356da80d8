package com.polyagent.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyagent.config.PolyAgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Buffers collaboration events per session id and fans them out to WebSocket subscribers.
 * Late subscribers replay everything after the last event id they saw.
 */
@Component
public class CollaborationStreamHub {
    private static final Logger log = LoggerFactory.getLogger(CollaborationStreamHub.class);
    static final String SESSION_ATTRIBUTE = "collaborationSessionId";

    private final ObjectMapper objectMapper;
    private final int bufferSize;
    private final Duration retention;
    private final Map<String, SessionStream> streams = new ConcurrentHashMap<>();

    public CollaborationStreamHub(ObjectMapper objectMapper, PolyAgentProperties properties) {
        this.objectMapper = objectMapper;
        this.bufferSize = properties.getSessions().getStreamBufferSize();
        this.retention = properties.getSessions().getStreamRetention();
    }

    /**
     * Starts a fresh stream for a collaboration run, replacing a finished one with the same id.
     */
    public void open(String sessionId) {
        cleanupExpiredStreams();
        streams.compute(sessionId, (id, existing) ->
                existing == null || existing.ended() ? new SessionStream(id, bufferSize) : existing);
    }

    public void discard(String sessionId) {
        SessionStream stream = streams.remove(sessionId);
        if (stream == null) {
            return;
        }
        stream.subscribers().values().forEach(this::closeQuietly);
    }

    public boolean exists(String sessionId) {
        return streams.containsKey(sessionId);
    }

    public void registerSubscriber(String sessionId, WebSocketSession subscriber, long sinceId) throws IOException {
        SessionStream stream = streams.get(sessionId);
        if (stream == null) {
            subscriber.close();
            return;
        }
        cleanupExpiredStreams();
        stream.subscribers().put(subscriber.getId(), subscriber);
        subscriber.getAttributes().put(SESSION_ATTRIBUTE, sessionId);
        for (StreamEvent event : stream.since(sinceId)) {
            send(subscriber, event);
        }
    }

    public void removeSubscriber(WebSocketSession subscriber) {
        Object sessionIdObj = subscriber.getAttributes().get(SESSION_ATTRIBUTE);
        if (sessionIdObj == null) {
            return;
        }
        SessionStream stream = streams.get(sessionIdObj.toString());
        if (stream == null) {
            return;
        }
        stream.subscribers().remove(subscriber.getId());
        pruneIfExpired(stream);
    }

    public void emit(String sessionId, String type, Object data) {
        SessionStream stream = streams.get(sessionId);
        if (stream == null) {
            return;
        }
        StreamEvent event = stream.append(type, data);
        if (event == null) {
            return;
        }
        stream.subscribers().values().forEach(subscriber -> send(subscriber, event));
        if (stream.ended()) {
            pruneIfExpired(stream);
        }
    }

    public List<StreamEvent> eventsSince(String sessionId, long sinceId) {
        SessionStream stream = streams.get(sessionId);
        return stream != null ? stream.since(sinceId) : List.of();
    }

    private void send(WebSocketSession subscriber, StreamEvent event) {
        if (!subscriber.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (subscriber) {
                subscriber.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream event: {}", ex.getMessage());
        }
    }

    private void closeQuietly(WebSocketSession subscriber) {
        try {
            subscriber.close();
        } catch (IOException ex) {
            log.debug("Failed to close stream subscriber {}: {}", subscriber.getId(), ex.getMessage());
        }
    }

    private void pruneIfExpired(SessionStream stream) {
        if (stream.expired(Instant.now().minus(retention))) {
            streams.remove(stream.sessionId(), stream);
        }
    }

    private void cleanupExpiredStreams() {
        Instant cutoff = Instant.now().minus(retention);
        streams.values().removeIf(stream -> stream.expired(cutoff));
    }
}
