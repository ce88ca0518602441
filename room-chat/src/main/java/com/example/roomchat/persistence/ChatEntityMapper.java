package com.example.roomchat.persistence;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.domain.ChatUser;
import org.springframework.stereotype.Component;

@Component
public class ChatEntityMapper {

    public ChatUser toUser(UserEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatUser.builder()
                .id(entity.getId())
                .username(entity.getUsername())
                .lastRoomId(entity.getLastRoomId())
                .build();
    }

    public ChatRoom toRoom(RoomEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatRoom.builder()
                .id(entity.getId())
                .name(entity.getName())
                .adminId(entity.getAdminId())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public ChatMessage toMessage(MessageEntity entity, String sender) {
        if (entity == null) {
            return null;
        }
        return ChatMessage.builder()
                .id(entity.getId())
                .roomId(entity.getRoomId())
                .sender(sender)
                .text(entity.getText())
                .timestamp(entity.getSentAt())
                .build();
    }
}
