package com.example.roomchat.dto;

import com.example.roomchat.domain.ChatMessage;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoomMessageResponse {
    String sender;
    String message;
    Instant timestamp;

    public static RoomMessageResponse from(ChatMessage message) {
        return RoomMessageResponse.builder()
                .sender(message.getSender())
                .message(message.getText())
                .timestamp(message.getTimestamp())
                .build();
    }
}
