package com.example.roomchat.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outbound frame. Only the properties relevant to {@link #type} are set; the rest are omitted
 * from the JSON.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "rooms", "isAdmin", "sender", "message"})
public class ServerFrame {

    FrameType type;
    List<String> rooms;

    @JsonProperty("isAdmin")
    Boolean admin;

    String sender;
    String message;

    public static ServerFrame activeRoomList(List<String> rooms) {
        return ServerFrame.builder().type(FrameType.ACTIVE_ROOM_LIST).rooms(List.copyOf(rooms)).build();
    }

    public static ServerFrame existingRoomList(List<String> rooms) {
        return ServerFrame.builder().type(FrameType.EXISTING_ROOM_LIST).rooms(List.copyOf(rooms)).build();
    }

    public static ServerFrame joinConfirm(boolean admin) {
        return ServerFrame.builder().type(FrameType.JOIN_CONFIRM).admin(admin).build();
    }

    public static ServerFrame message(String sender, String text) {
        return ServerFrame.builder().type(FrameType.MESSAGE).sender(sender).message(text).build();
    }

    public static ServerFrame info(String text) {
        return ServerFrame.builder().type(FrameType.INFO).message(text).build();
    }

    public static ServerFrame lastRoomClosed() {
        return ServerFrame.builder().type(FrameType.LAST_ROOM_CLOSED).build();
    }

    public static ServerFrame error(String text) {
        return ServerFrame.builder().type(FrameType.ERROR).message(text).build();
    }
}
