package com.example.roomchat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRoom implements Serializable {

    private Long id;
    private String name;
    private Long adminId;
    private Instant createdAt;

    public boolean isAdministeredBy(Long userId) {
        return adminId != null && Objects.equals(adminId, userId);
    }
}
