package com.example.roomchat.config;

import com.example.roomchat.websocket.RoomChatWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the chat endpoint {@code /ws/{username}}; the handler reads the identity from the path.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RoomChatWebSocketHandler roomChatWebSocketHandler;
    private final ChatProperties chatProperties;

    public WebSocketConfig(RoomChatWebSocketHandler roomChatWebSocketHandler, ChatProperties chatProperties) {
        this.roomChatWebSocketHandler = roomChatWebSocketHandler;
        this.chatProperties = chatProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(roomChatWebSocketHandler, "/ws/*")
                .setAllowedOriginPatterns(chatProperties.getWebsocket().getAllowedOrigins().toArray(String[]::new));
    }
}
