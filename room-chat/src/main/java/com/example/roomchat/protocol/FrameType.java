package com.example.roomchat.protocol;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FrameType {
    ACTIVE_ROOM_LIST("active_room_list"),
    EXISTING_ROOM_LIST("existing_room_list"),
    JOIN_CONFIRM("join_confirm"),
    MESSAGE("message"),
    INFO("info"),
    LAST_ROOM_CLOSED("last_room_closed"),
    ERROR("error");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
