package com.telesync.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telesync.auth.TokenService;
import com.telesync.notify.NotificationHub;
import com.telesync.notify.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Map;

/**
 * Pushes hub events to browser clients. The connection must carry a {@code token} query
 * parameter; the token decides which single user's events the connection receives.
 */
@Component
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(NotificationWebSocketHandler.class);
    private static final String SUBSCRIPTION = "telesync.subscription";
    private static final String OUTBOUND = "telesync.outbound";
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_LIMIT = 512 * 1024;

    private final TokenService tokens;
    private final NotificationHub hub;
    private final ObjectMapper mapper;

    public NotificationWebSocketHandler(TokenService tokens, NotificationHub hub, ObjectMapper mapper) {
        this.tokens = tokens;
        this.hub = hub;
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        var userId = tokens.consume(tokenOf(session));
        if (userId == null) {
            log.warn("Rejected WebSocket {} without a valid token", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("invalid token"));
            return;
        }
        var out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_LIMIT);
        var sub = hub.subscribe(userId, event -> out.sendMessage(new TextMessage(mapper.writeValueAsString(event))));
        session.getAttributes().put(OUTBOUND, out);
        session.getAttributes().put(SUBSCRIPTION, sub);
        out.sendMessage(json(Map.of("type", "connected", "userId", userId)));
        log.debug("WebSocket {} subscribed to user {}", session.getId(), userId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var node = mapper.readTree(message.getPayload());
        if ("ping".equals(node.path("type").asText())
                && session.getAttributes().get(OUTBOUND) instanceof WebSocketSession out) {
            out.sendMessage(json(Map.of("type", "pong")));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        if (session.getAttributes().remove(SUBSCRIPTION) instanceof Subscription sub) {
            sub.close();
            log.debug("WebSocket {} closed ({})", session.getId(), status);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.warn("WebSocket {} transport error: {}", session.getId(), exception.getMessage());
        session.close(CloseStatus.SERVER_ERROR);
    }

    private TextMessage json(Object value) throws IOException {
        return new TextMessage(mapper.writeValueAsString(value));
    }

    static String tokenOf(WebSocketSession session) {
        var uri = session.getUri();
        if (uri == null) return null;
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
    }
}
