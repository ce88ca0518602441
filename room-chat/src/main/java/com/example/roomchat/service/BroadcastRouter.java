package com.example.roomchat.service;

import com.example.roomchat.protocol.FrameCodec;
import com.example.roomchat.protocol.ServerFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fans frames out to the members of a room or of the lobby.
 *
 * <p>Recipients are snapshotted from the {@link RoomRegistry} and the sends happen after the
 * registry lock is released, so a stalled client only delays its own delivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastRouter {

    private final RoomRegistry roomRegistry;
    private final FrameCodec frameCodec;

    public DeliveryReport sendToRoom(String roomName, ServerFrame frame) {
        return sendToRoom(roomName, frame, null);
    }

    /**
     * Sends to every member of the room except {@code excludedIdentity} (may be {@code null}).
     */
    public DeliveryReport sendToRoom(String roomName, ServerFrame frame, String excludedIdentity) {
        Map<String, ConnectionHandle> members = roomRegistry.roomMembers(roomName);
        return deliver("room " + roomName, members, frame, excludedIdentity);
    }

    public DeliveryReport sendToLobby(ServerFrame frame) {
        return deliver("lobby", roomRegistry.lobbyMembers(), frame, null);
    }

    /**
     * Removes the room from the registry and terminates every member connection with a normal
     * closure.
     *
     * @return how many connections were terminated
     */
    public DeliveryReport closeRoom(String roomName) {
        Map<String, ConnectionHandle> detached = roomRegistry.detachRoom(roomName);
        if (detached.isEmpty()) {
            return DeliveryReport.empty();
        }
        int closed = 0;
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, ConnectionHandle> member : detached.entrySet()) {
            try {
                member.getValue().close();
                closed++;
            } catch (Exception e) {
                failed.add(member.getKey());
                log.warn("Failed to close connection of {} while closing room {}: {}",
                        member.getKey(), roomName, e.getMessage());
            }
        }
        log.info("Closed room {}: terminated={} failed={}", roomName, closed, failed.size());
        return DeliveryReport.builder().delivered(closed).failedIdentities(List.copyOf(failed)).build();
    }

    private DeliveryReport deliver(
            String target, Map<String, ConnectionHandle> recipients, ServerFrame frame, String excludedIdentity) {
        if (recipients.isEmpty()) {
            return DeliveryReport.empty();
        }
        String payload = frameCodec.encode(frame);
        int delivered = 0;
        List<String> failed = new ArrayList<>();
        for (Map.Entry<String, ConnectionHandle> recipient : recipients.entrySet()) {
            if (recipient.getKey().equals(excludedIdentity)) {
                continue;
            }
            ConnectionHandle handle = recipient.getValue();
            try {
                handle.send(payload);
                delivered++;
            } catch (Exception e) {
                failed.add(recipient.getKey());
                log.warn("Send to {} in {} failed: {}", recipient.getKey(), target, e.getMessage());
            }
        }
        log.debug("Broadcast {} to {}: delivered={} failed={}", frame.getType(), target, delivered, failed.size());
        return DeliveryReport.builder().delivered(delivered).failedIdentities(List.copyOf(failed)).build();
    }
}
