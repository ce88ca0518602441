package com.example.roomchat.controller;

import com.example.roomchat.config.ChatProperties;
import com.example.roomchat.dto.RoomDirectoryResponse;
import com.example.roomchat.dto.RoomMessageResponse;
import com.example.roomchat.service.ChatStore;
import com.example.roomchat.service.RoomDirectoryService;
import com.example.roomchat.service.exception.ServiceException;
import jakarta.validation.constraints.Min;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomDirectoryService roomDirectoryService;
    private final ChatStore chatStore;
    private final ChatProperties chatProperties;

    public RoomController(
            RoomDirectoryService roomDirectoryService, ChatStore chatStore, ChatProperties chatProperties) {
        this.roomDirectoryService = roomDirectoryService;
        this.chatStore = chatStore;
        this.chatProperties = chatProperties;
    }

    @GetMapping
    public ResponseEntity<RoomDirectoryResponse> listRooms() {
        return ResponseEntity.ok(RoomDirectoryResponse.builder()
                .activeRooms(roomDirectoryService.activeRoomNames())
                .existingRooms(roomDirectoryService.existingRoomNames())
                .build());
    }

    @GetMapping("/{roomName}/messages")
    public ResponseEntity<List<RoomMessageResponse>> getMessages(
            @PathVariable String roomName,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @RequestParam(required = false) @Min(1) Integer limit) {
        if (chatStore.findRoomByName(roomName).isEmpty()) {
            throw ServiceException.roomNotFound(roomName);
        }
        int pageSize = chatProperties.getHistory().getPageSize();
        int resolvedLimit = limit != null ? Math.min(limit, pageSize) : pageSize;
        List<RoomMessageResponse> messages = chatStore.findMessages(roomName, offset, resolvedLimit).stream()
                .map(RoomMessageResponse::from)
                .toList();
        return ResponseEntity.ok(messages);
    }
}
