package com.example.roomchat.websocket;

import com.example.roomchat.config.ChatProperties;
import com.example.roomchat.service.ChatSession;
import com.example.roomchat.service.ChatSessionFactory;
import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

/**
 * Entry point for {@code /ws/{username}}:
 * <ul>
 *   <li>connection established: validate the identity, create and open a {@link ChatSession};</li>
 *   <li>text frame: hand it to the session;</li>
 *   <li>transport error or close: run the session's disconnect path.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomChatWebSocketHandler extends TextWebSocketHandler {

    public static final String ENDPOINT_TEMPLATE = "/ws/{username}";

    private final UriTemplate template = new UriTemplate(ENDPOINT_TEMPLATE);
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    private final ChatSessionFactory chatSessionFactory;
    private final ChatProperties chatProperties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String username = extractUsername(session.getUri());
        if (!isAcceptable(username)) {
            log.warn("Rejecting connection {} with invalid identity {}", session.getId(), username);
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Invalid username"));
            return;
        }

        ChatProperties.Websocket websocket = chatProperties.getWebsocket();
        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(
                session, (int) websocket.getSendTimeLimit().toMillis(), websocket.getSendBufferSizeLimit());
        ChatSession chatSession = chatSessionFactory.create(username, handle);
        sessions.put(session.getId(), chatSession);

        try {
            chatSession.open();
        } catch (RuntimeException ex) {
            log.error("Failed to open chat session for {}", username, ex);
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChatSession chatSession = sessions.get(session.getId());
        if (chatSession == null) {
            log.debug("Dropping frame for unknown connection {}", session.getId());
            return;
        }
        chatSession.handle(message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws IOException {
        log.warn("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ChatSession chatSession = sessions.remove(session.getId());
        if (chatSession != null) {
            log.debug("Connection {} of {} closed with {}", session.getId(), chatSession.username(), status);
            chatSession.disconnect();
        }
    }

    private String extractUsername(URI uri) {
        if (uri == null || !template.matches(uri.getPath())) {
            return null;
        }
        return template.match(uri.getPath()).get("username");
    }

    private boolean isAcceptable(String username) {
        return StringUtils.hasText(username)
                && username.equals(username.strip())
                && username.length() <= chatProperties.getIdentity().getMaxLength();
    }
}
