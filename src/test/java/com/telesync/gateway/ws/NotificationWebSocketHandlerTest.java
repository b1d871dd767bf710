package com.telesync.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telesync.auth.TokenService;
import com.telesync.notify.NotificationHub;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class NotificationWebSocketHandlerTest {

    private final TokenService tokens = new TokenService();
    private final NotificationHub hub = new NotificationHub();
    private final NotificationWebSocketHandler handler =
            new NotificationWebSocketHandler(tokens, hub, new ObjectMapper());

    private static WebSocketSession session(String uri) {
        var session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(session.getUri()).thenReturn(URI.create(uri));
        when(session.getAttributes()).thenReturn(attributes);
        when(session.getId()).thenReturn("s1");
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void readsTokenFromQuery() {
        assertEquals("abc", NotificationWebSocketHandler.tokenOf(session("ws://localhost/ws?token=abc")));
        assertNull(NotificationWebSocketHandler.tokenOf(session("ws://localhost/ws")));
    }

    @Test
    void invalidTokenIsRejected() throws Exception {
        var session = session("ws://localhost/ws?token=forged");

        handler.afterConnectionEstablished(session);

        verify(session).close(argThat(status -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertEquals(0, hub.subscriberCount("u1"));
    }

    @Test
    void validTokenSubscribesAndAnswersPing() throws Exception {
        var session = session("ws://localhost/ws?token=" + tokens.generate("u1"));

        handler.afterConnectionEstablished(session);
        assertEquals(1, hub.subscriberCount("u1"));

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        var sent = ArgumentCaptor.forClass(WebSocketMessage.class);
        verify(session, times(2)).sendMessage(sent.capture());
        assertTrue(sent.getAllValues().get(0).getPayload().toString().contains("\"connected\""));
        assertTrue(sent.getAllValues().get(1).getPayload().toString().contains("\"pong\""));

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        assertEquals(0, hub.subscriberCount("u1"));
        verify(session, never()).close(any());
    }

    @Test
    void tokenCannotOpenSecondConnection() throws Exception {
        var token = tokens.generate("u1");
        var first = session("ws://localhost/ws?token=" + token);
        var second = session("ws://localhost/ws?token=" + token);

        handler.afterConnectionEstablished(first);
        handler.afterConnectionEstablished(second);

        verify(first, never()).close(any());
        verify(second).close(argThat(status -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertEquals(1, hub.subscriberCount("u1"));
    }
}
