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
@Table(name = "chat_users")
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = ChatStore.USERNAME_MAX_LENGTH)
    private String username;

    @Column(name = "last_room_id")
    private Long lastRoomId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
