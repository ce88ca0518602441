package com.example.roomchat.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.roomchat.config.ChatModuleConfig;
import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.service.ChatStore;
import com.example.roomchat.service.RoomDirectoryService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RoomController.class)
@Import(ChatModuleConfig.class)
@TestPropertySource(properties = "chat.history.page-size=3")
class RoomControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RoomDirectoryService roomDirectoryService;

    @MockBean
    private ChatStore chatStore;

    @Test
    void listsActiveAndExistingRooms() throws Exception {
        when(roomDirectoryService.activeRoomNames()).thenReturn(List.of("general"));
        when(roomDirectoryService.existingRoomNames()).thenReturn(List.of("general", "archive"));

        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeRooms[0]").value("general"))
                .andExpect(jsonPath("$.existingRooms.length()").value(2))
                .andExpect(jsonPath("$.existingRooms[1]").value("archive"));
    }

    @Test
    void returnsHistoryPageCappedAtConfiguredSize() throws Exception {
        when(chatStore.findRoomByName("general"))
                .thenReturn(Optional.of(ChatRoom.builder().id(1L).name("general").adminId(7L).build()));
        when(chatStore.findMessages("general", 2, 3)).thenReturn(List.of(ChatMessage.builder()
                .id(10L)
                .roomId(1L)
                .sender("alice")
                .text("hello")
                .timestamp(Instant.parse("2024-05-01T10:15:30Z"))
                .build()));

        mockMvc.perform(get("/api/rooms/general/messages").param("offset", "2").param("limit", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sender").value("alice"))
                .andExpect(jsonPath("$[0].message").value("hello"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-05-01T10:15:30Z"));
        verify(chatStore).findMessages("general", 2, 3);
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        when(chatStore.findRoomByName("nowhere")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/rooms/nowhere/messages"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("room_not_found"));
        verify(chatStore, never()).findMessages(anyString(), anyInt(), anyInt());
    }

    @Test
    void negativeOffsetIsRejected() throws Exception {
        mockMvc.perform(get("/api/rooms/general/messages").param("offset", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
    }

    @Test
    void storeOutageIsReportedAsUnavailable() throws Exception {
        when(roomDirectoryService.activeRoomNames()).thenReturn(List.of());
        when(roomDirectoryService.existingRoomNames()).thenThrow(new DataAccessResourceFailureException("down"));

        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("store_unavailable"));
    }
}
