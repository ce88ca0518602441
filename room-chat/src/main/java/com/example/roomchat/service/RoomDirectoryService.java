package com.example.roomchat.service;

import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.protocol.ServerFrame;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Room lists shown in the lobby. Active rooms come from the {@link RoomRegistry}, existing rooms
 * from the {@link ChatStore}; the two lists may differ.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomDirectoryService {

    private final RoomRegistry roomRegistry;
    private final ChatStore chatStore;
    private final BroadcastRouter broadcastRouter;

    public List<String> activeRoomNames() {
        return roomRegistry.activeRoomNames();
    }

    public List<String> existingRoomNames() {
        return chatStore.findAllRooms().stream()
                .map(ChatRoom::getName)
                .toList();
    }

    /**
     * Sends both room lists to everyone in the lobby. A store failure skips the existing-room
     * list only.
     */
    public void publishRoomLists() {
        broadcastRouter.sendToLobby(ServerFrame.activeRoomList(activeRoomNames()));
        try {
            broadcastRouter.sendToLobby(ServerFrame.existingRoomList(existingRoomNames()));
        } catch (DataAccessException ex) {
            log.error("Unable to load persisted rooms for the lobby", ex);
        }
    }
}
