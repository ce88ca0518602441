package com.example.roomchat.websocket;

import com.example.roomchat.service.ConnectionHandle;
import java.io.IOException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link ConnectionHandle} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator} because several sessions may broadcast to the same
 * connection at once.
 */
public class WebSocketConnectionHandle implements ConnectionHandle {

    private final WebSocketSession session;

    public WebSocketConnectionHandle(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Connection " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() throws IOException {
        if (session.isOpen()) {
            session.close(CloseStatus.NORMAL);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String toString() {
        return "WebSocketConnectionHandle[" + session.getId() + "]";
    }
}
