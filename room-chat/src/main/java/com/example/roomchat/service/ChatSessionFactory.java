package com.example.roomchat.service;

import com.example.roomchat.config.ChatProperties;
import com.example.roomchat.protocol.FrameCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ChatSessionFactory {

    private final RoomRegistry roomRegistry;
    private final BroadcastRouter broadcastRouter;
    private final RoomDirectoryService roomDirectoryService;
    private final ChatStore chatStore;
    private final FrameCodec frameCodec;
    private final ChatProperties chatProperties;

    public ChatSession create(String username, ConnectionHandle connection) {
        return new ChatSession(
                username,
                connection,
                roomRegistry,
                broadcastRouter,
                roomDirectoryService,
                chatStore,
                frameCodec,
                chatProperties.getHistory().getPageSize());
    }
}
