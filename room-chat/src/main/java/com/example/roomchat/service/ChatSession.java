package com.example.roomchat.service;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.domain.ChatUser;
import com.example.roomchat.protocol.ClientCommand;
import com.example.roomchat.protocol.CommandAction;
import com.example.roomchat.protocol.FrameCodec;
import com.example.roomchat.protocol.MalformedFrameException;
import com.example.roomchat.protocol.ServerFrame;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.util.StringUtils;

/**
 * Protocol state of one connection: {@link State#LOBBY} or {@link State#IN_ROOM}.
 *
 * <p>Lifecycle: {@link #open()} once the transport is accepted, {@link #handle(String)} for every
 * inbound frame, {@link #disconnect()} when the transport goes away. All three are serialized on
 * this instance; {@link #disconnect()} takes effect at most once.
 *
 * <p>Store calls happen before registry mutations, so a failed command leaves both the session
 * and the registry as they were and is answered with an {@code error} frame.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public class ChatSession {

    public enum State {
        LOBBY,
        IN_ROOM
    }

    static final String INVALID_JSON = "Invalid JSON format.";
    static final String UNSUPPORTED_ACTION = "Unsupported action.";
    static final String ROOM_REQUIRED = "A room name is required to join.";
    static final String ROOM_NAME_TOO_LONG =
            "A room name may be at most " + ChatStore.ROOM_NAME_MAX_LENGTH + " characters long.";
    static final String MESSAGE_REQUIRED = "A message text is required.";
    static final String STORAGE_FAILURE = "The request could not be completed, please try again.";

    private final String username;
    private final ConnectionHandle connection;
    private final RoomRegistry roomRegistry;
    private final BroadcastRouter broadcastRouter;
    private final RoomDirectoryService roomDirectory;
    private final ChatStore chatStore;
    private final FrameCodec frameCodec;
    private final int historyPageSize;

    private final AtomicBoolean terminated = new AtomicBoolean();

    private ChatUser user;
    private State state;
    private String currentRoom;

    /**
     * Resolves the durable user, registers the connection in the lobby, publishes the room
     * lists and auto-rejoins the last room when it still exists.
     *
     * @throws DataAccessException if the user record cannot be loaded or created; the caller is
     *     expected to drop the connection
     */
    public synchronized void open() {
        user = chatStore.getOrCreateUser(username);
        if (roomRegistry.isInLobby(username) || roomRegistry.roomOf(username).isPresent()) {
            log.warn("{} is already connected, the new connection {} replaces the previous one", username, connection.id());
        }
        roomRegistry.admitToLobby(username, connection);
        state = State.LOBBY;
        log.info("{} connected on {}", username, connection.id());
        roomDirectory.publishRoomLists();

        try {
            rejoinLastRoom();
        } catch (DataAccessException ex) {
            log.error("Auto-rejoin failed for {}", username, ex);
            sendToSelf(ServerFrame.error(STORAGE_FAILURE));
        }
    }

    public synchronized void handle(String payload) {
        if (terminated.get() || state == null) {
            return;
        }

        ClientCommand command;
        try {
            command = frameCodec.decode(payload);
        } catch (MalformedFrameException ex) {
            log.debug("Malformed frame from {}: {}", username, ex.getMessage());
            sendToSelf(ServerFrame.error(INVALID_JSON));
            return;
        }

        Optional<CommandAction> action = CommandAction.from(command.getAction());
        if (action.isEmpty()) {
            log.debug("Unsupported action {} from {}", command.getAction(), username);
            sendToSelf(ServerFrame.error(UNSUPPORTED_ACTION));
            return;
        }

        try {
            switch (action.get()) {
                case JOIN -> join(command.getRoom());
                case LEAVE -> leave();
                case MESSAGE -> message(command.getMessage());
                case CLOSE -> close();
            }
        } catch (DataAccessException ex) {
            log.error("Command {} from {} failed", action.get(), username, ex);
            sendToSelf(ServerFrame.error(STORAGE_FAILURE));
        }
    }

    /**
     * Removes the connection from the registry and tells the room and the lobby. Safe to call
     * repeatedly; only the first call has an effect.
     */
    public synchronized void disconnect() {
        if (!terminated.compareAndSet(false, true) || state == null) {
            return;
        }
        if (state == State.IN_ROOM) {
            String roomName = currentRoom;
            if (roomRegistry.removeFromRoom(username, roomName, connection)) {
                broadcastRouter.sendToRoom(roomName, ServerFrame.info(leftNotice(username)));
            }
        } else {
            roomRegistry.removeFromLobby(username, connection);
        }
        log.info("{} disconnected from {}", username, state == State.IN_ROOM ? "room " + currentRoom : "the lobby");
        roomDirectory.publishRoomLists();
    }

    public String username() {
        return username;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized Optional<String> currentRoom() {
        return Optional.ofNullable(currentRoom);
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    private void rejoinLastRoom() {
        Long lastRoomId = user.getLastRoomId();
        if (lastRoomId == null) {
            return;
        }
        Optional<ChatRoom> lastRoom = chatStore.findRoomById(lastRoomId);
        if (lastRoom.isEmpty()) {
            log.debug("Last room {} of {} no longer exists", lastRoomId, username);
            sendToSelf(ServerFrame.lastRoomClosed());
            return;
        }

        ChatRoom room = lastRoom.get();
        roomRegistry.moveToRoom(username, connection, room.getName());
        enterRoom(room.getName());
        log.info("{} rejoined room {}", username, room.getName());

        sendToSelf(ServerFrame.joinConfirm(room.isAdministeredBy(user.getId())));
        replayHistory(room.getName());
        broadcastRouter.sendToRoom(room.getName(), ServerFrame.info(reconnectedNotice(username)), username);
        roomDirectory.publishRoomLists();
    }

    private void join(String roomName) {
        if (!StringUtils.hasText(roomName)) {
            sendToSelf(ServerFrame.error(ROOM_REQUIRED));
            return;
        }
        if (roomName.length() > ChatStore.ROOM_NAME_MAX_LENGTH) {
            sendToSelf(ServerFrame.error(ROOM_NAME_TOO_LONG));
            return;
        }
        ChatRoom room = chatStore.getOrCreateRoom(roomName, user.getId());
        chatStore.updateLastRoom(user.getId(), room.getId());

        String previousRoom = currentRoom;
        roomRegistry.moveToRoom(username, connection, room.getName());
        enterRoom(room.getName());
        log.info("{} joined room {}", username, room.getName());

        if (previousRoom != null && !previousRoom.equals(room.getName())) {
            broadcastRouter.sendToRoom(previousRoom, ServerFrame.info(leftNotice(username)));
        }
        sendToSelf(ServerFrame.joinConfirm(room.isAdministeredBy(user.getId())));
        replayHistory(room.getName());
        broadcastRouter.sendToRoom(room.getName(), ServerFrame.info(joinedNotice(username, room.getName())), username);
        roomDirectory.publishRoomLists();
    }

    private void leave() {
        if (state != State.IN_ROOM) {
            log.debug("Ignoring leave from {} outside of a room", username);
            return;
        }
        String roomName = currentRoom;
        if (!roomRegistry.moveToLobby(username, roomName)) {
            roomRegistry.admitToLobby(username, connection);
        }
        enterLobby();
        log.info("{} left room {}", username, roomName);

        broadcastRouter.sendToRoom(roomName, ServerFrame.info(leftNotice(username)));
        roomDirectory.publishRoomLists();
    }

    private void message(String text) {
        if (state != State.IN_ROOM) {
            log.debug("Ignoring message from {} outside of a room", username);
            return;
        }
        if (text == null) {
            sendToSelf(ServerFrame.error(MESSAGE_REQUIRED));
            return;
        }
        Optional<ChatRoom> room = chatStore.findRoomByName(currentRoom);
        if (room.isPresent()) {
            chatStore.appendMessage(text, user.getId(), room.get().getId());
        } else {
            log.warn("Room {} is no longer stored, relaying message from {} without persisting it", currentRoom, username);
        }
        broadcastRouter.sendToRoom(currentRoom, ServerFrame.message(username, text));
    }

    private void close() {
        if (state != State.IN_ROOM) {
            log.debug("Ignoring close from {} outside of a room", username);
            return;
        }
        String roomName = currentRoom;
        Optional<ChatRoom> room = chatStore.findRoomByName(roomName);
        if (room.isEmpty() || !room.get().isAdministeredBy(user.getId())) {
            log.info("Ignoring close of room {} requested by {}, who is not its admin", roomName, username);
            return;
        }

        chatStore.deleteRoom(roomName);
        broadcastRouter.sendToRoom(roomName, ServerFrame.info(closedNotice(roomName)));
        // terminates every member, this connection included
        broadcastRouter.closeRoom(roomName);
        enterLobby();
        log.info("{} closed room {}", username, roomName);

        roomDirectory.publishRoomLists();
    }

    private void replayHistory(String roomName) {
        int offset = 0;
        List<ChatMessage> page;
        do {
            page = chatStore.findMessages(roomName, offset, historyPageSize);
            for (ChatMessage message : page) {
                sendToSelf(ServerFrame.message(message.getSender(), message.getText()));
            }
            offset += page.size();
        } while (page.size() == historyPageSize);
    }

    private void enterRoom(String roomName) {
        currentRoom = roomName;
        state = State.IN_ROOM;
    }

    private void enterLobby() {
        currentRoom = null;
        state = State.LOBBY;
    }

    private void sendToSelf(ServerFrame frame) {
        try {
            connection.send(frameCodec.encode(frame));
        } catch (IOException e) {
            log.warn("Send of {} to {} failed: {}", frame.getType(), username, e.getMessage());
        }
    }

    static String joinedNotice(String username, String roomName) {
        return "User '%s' has joined the room '%s'".formatted(username, roomName);
    }

    static String leftNotice(String username) {
        return "User '%s' has left the room".formatted(username);
    }

    static String reconnectedNotice(String username) {
        return "User '%s' has reconnected".formatted(username);
    }

    static String closedNotice(String roomName) {
        return "Room '%s' has been closed by the admin.".formatted(roomName);
    }
}
