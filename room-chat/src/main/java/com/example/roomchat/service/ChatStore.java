package com.example.roomchat.service;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.domain.ChatUser;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for users, rooms and room history.
 *
 * <p>All calls are synchronous and may fail with a
 * {@link org.springframework.dao.DataAccessException}; callers must not hold the
 * {@link RoomRegistry} lock while calling into the store.
 */
public interface ChatStore {

    /**
     * Longest username the store accepts.
     */
    int USERNAME_MAX_LENGTH = 128;

    /**
     * Longest room name the store accepts.
     */
    int ROOM_NAME_MAX_LENGTH = 255;

    ChatUser getOrCreateUser(String username);

    Optional<ChatUser> findUserByUsername(String username);

    Optional<ChatRoom> findRoomByName(String roomName);

    Optional<ChatRoom> findRoomById(Long roomId);

    /**
     * Every persisted room, in creation order.
     */
    List<ChatRoom> findAllRooms();

    /**
     * Returns the room called {@code roomName}, creating it with {@code adminId} as its admin
     * when it does not exist yet. The admin of an existing room is never changed.
     */
    ChatRoom getOrCreateRoom(String roomName, Long adminId);

    /**
     * Messages of a room ordered oldest first. Returns an empty list for an unknown room.
     */
    List<ChatMessage> findMessages(String roomName, int offset, int limit);

    ChatMessage appendMessage(String text, Long authorId, Long roomId);

    void updateLastRoom(Long userId, Long roomId);

    void deleteMessages(String roomName);

    /**
     * Deletes the room together with its history and clears every user's last-room reference
     * to it. No-op for an unknown room.
     */
    void deleteRoom(String roomName);
}
