package com.polyagent.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@Component
public class CollaborationStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(CollaborationStreamWebSocketHandler.class);

    private final CollaborationStreamHub hub;

    public CollaborationStreamWebSocketHandler(CollaborationStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        Map<String, String> queryParams = UriComponentsBuilder.fromUri(uri).build().getQueryParams().toSingleValueMap();
        String rawSessionId = queryParams.get("sessionId");
        if (rawSessionId == null || rawSessionId.isBlank()) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        long since = parseLong(queryParams.get("since"), 0L);
        hub.registerSubscriber(UriUtils.decode(rawSessionId, StandardCharsets.UTF_8), session, since);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // No-op: server push only.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSubscriber(session);
    }

    private long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return fallback;
        }
    }
}
