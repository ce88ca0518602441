package com.example.roomchat.persistence;

import com.example.roomchat.service.ChatStore;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(name = "chat_rooms")
public class RoomEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = ChatStore.ROOM_NAME_MAX_LENGTH)
    private String name;

    @Column(name = "admin_id")
    private Long adminId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
