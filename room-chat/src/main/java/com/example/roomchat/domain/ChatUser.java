package com.example.roomchat.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatUser implements Serializable {

    private Long id;
    private String username;

    /**
     * Room the user joined most recently, or {@code null}. Drives auto-rejoin on reconnect.
     */
    private Long lastRoomId;
}
