package com.example.roomchat.dto;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoomDirectoryResponse {
    List<String> activeRooms;
    List<String> existingRooms;
}
