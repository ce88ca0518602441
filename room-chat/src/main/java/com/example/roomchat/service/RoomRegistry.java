package com.example.roomchat.service;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * In-memory map of who is connected and where: the lobby, or exactly one room.
 *
 * <p>Every operation runs under a single lock and never performs I/O. Callers that need to send
 * to the members of a location take a snapshot ({@link #roomMembers}, {@link #lobbyMembers}) and
 * send after the call returns.
 *
 * <p>Invariants:
 * <ul>
 *   <li>an identity is registered in the lobby, in one room, or nowhere; never in two places;</li>
 *   <li>a room name is present only while it has at least one member.</li>
 * </ul>
 */
@Component
public class RoomRegistry {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, ConnectionHandle> lobby = new LinkedHashMap<>();
    private final Map<String, Map<String, ConnectionHandle>> rooms = new LinkedHashMap<>();
    private final Map<String, String> roomByIdentity = new HashMap<>();

    public void admitToLobby(String identity, ConnectionHandle handle) {
        withLock(() -> {
            detach(identity);
            lobby.put(identity, handle);
        });
    }

    public void moveToRoom(String identity, ConnectionHandle handle, String roomName) {
        withLock(() -> {
            detach(identity);
            rooms.computeIfAbsent(roomName, name -> new LinkedHashMap<>()).put(identity, handle);
            roomByIdentity.put(identity, roomName);
        });
    }

    /**
     * @return {@code true} if the identity was a member of {@code roomName}
     */
    public boolean moveToLobby(String identity, String roomName) {
        return withLock(() -> {
            Map<String, ConnectionHandle> members = rooms.get(roomName);
            if (members == null || !members.containsKey(identity)) {
                return false;
            }
            ConnectionHandle handle = removeMember(roomName, members, identity);
            lobby.put(identity, handle);
            return true;
        });
    }

    public void removeFromLobby(String identity) {
        withLock(() -> {
            lobby.remove(identity);
        });
    }

    /**
     * Removes the identity from the lobby only if it is registered with {@code handle}.
     */
    public boolean removeFromLobby(String identity, ConnectionHandle handle) {
        return withLock(() -> lobby.remove(identity, handle));
    }

    /**
     * @return {@code true} if the identity was a member of {@code roomName}
     */
    public boolean removeFromRoom(String identity, String roomName) {
        return withLock(() -> {
            Map<String, ConnectionHandle> members = rooms.get(roomName);
            if (members == null || !members.containsKey(identity)) {
                return false;
            }
            removeMember(roomName, members, identity);
            return true;
        });
    }

    /**
     * Removes the identity from {@code roomName} only if it is registered there with {@code handle}.
     */
    public boolean removeFromRoom(String identity, String roomName, ConnectionHandle handle) {
        return withLock(() -> {
            Map<String, ConnectionHandle> members = rooms.get(roomName);
            if (members == null || members.get(identity) != handle) {
                return false;
            }
            removeMember(roomName, members, identity);
            return true;
        });
    }

    /**
     * Removes the whole room in one step.
     *
     * @return the detached members, by identity
     */
    public Map<String, ConnectionHandle> detachRoom(String roomName) {
        return withLock(() -> {
            Map<String, ConnectionHandle> members = rooms.remove(roomName);
            if (members == null) {
                return Collections.<String, ConnectionHandle>emptyMap();
            }
            members.keySet().forEach(identity -> roomByIdentity.remove(identity, roomName));
            return Collections.unmodifiableMap(members);
        });
    }

    public List<String> activeRoomNames() {
        return withLock(() -> List.copyOf(rooms.keySet()));
    }

    public Map<String, ConnectionHandle> roomMembers(String roomName) {
        return withLock(() -> {
            Map<String, ConnectionHandle> members = rooms.get(roomName);
            return members == null
                    ? Collections.<String, ConnectionHandle>emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(members));
        });
    }

    public Map<String, ConnectionHandle> lobbyMembers() {
        return withLock(() -> Collections.unmodifiableMap(new LinkedHashMap<>(lobby)));
    }

    public Optional<String> roomOf(String identity) {
        return withLock(() -> Optional.ofNullable(roomByIdentity.get(identity)));
    }

    public boolean isInLobby(String identity) {
        return withLock(() -> lobby.containsKey(identity));
    }

    private void detach(String identity) {
        lobby.remove(identity);
        String previousRoom = roomByIdentity.get(identity);
        if (previousRoom != null) {
            Map<String, ConnectionHandle> members = rooms.get(previousRoom);
            if (members != null) {
                removeMember(previousRoom, members, identity);
            } else {
                roomByIdentity.remove(identity);
            }
        }
    }

    private ConnectionHandle removeMember(String roomName, Map<String, ConnectionHandle> members, String identity) {
        ConnectionHandle handle = members.remove(identity);
        roomByIdentity.remove(identity, roomName);
        if (members.isEmpty()) {
            rooms.remove(roomName);
        }
        return handle;
    }

    private void withLock(Runnable action) {
        withLock(() -> {
            action.run();
            return null;
        });
    }

    private <T> T withLock(Supplier<T> supplier) {
        lock.lock();
        try {
            return supplier.get();
        } finally {
            lock.unlock();
        }
    }
}
