package com.example.roomchat.persistence;

import com.example.roomchat.domain.ChatMessage;
import com.example.roomchat.domain.ChatRoom;
import com.example.roomchat.domain.ChatUser;
import com.example.roomchat.service.ChatStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaChatStore implements ChatStore {

    private static final String UNKNOWN_SENDER = "unknown";

    private final UserJpaRepository userJpaRepository;
    private final RoomJpaRepository roomJpaRepository;
    private final MessageJpaRepository messageJpaRepository;
    private final ChatEntityMapper mapper;

    @PersistenceContext
    private EntityManager entityManager;

    // No outer transaction: a losing concurrent insert fails alone and the winner is re-read.
    @Override
    public ChatUser getOrCreateUser(String username) {
        requireText(username, "Username");
        return userJpaRepository.findByUsername(username)
                .or(() -> createUser(username))
                .map(mapper::toUser)
                .orElseThrow(() -> new IllegalStateException("User " + username + " could not be stored"));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatUser> findUserByUsername(String username) {
        if (!StringUtils.hasText(username)) {
            return Optional.empty();
        }
        return userJpaRepository.findByUsername(username).map(mapper::toUser);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatRoom> findRoomByName(String roomName) {
        if (!StringUtils.hasText(roomName)) {
            return Optional.empty();
        }
        return roomJpaRepository.findByName(roomName).map(mapper::toRoom);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatRoom> findRoomById(Long roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return roomJpaRepository.findById(roomId).map(mapper::toRoom);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatRoom> findAllRooms() {
        return roomJpaRepository.findAllByOrderByIdAsc().stream()
                .map(mapper::toRoom)
                .toList();
    }

    @Override
    public ChatRoom getOrCreateRoom(String roomName, Long adminId) {
        requireText(roomName, "Room name");
        return roomJpaRepository.findByName(roomName)
                .or(() -> createRoom(roomName, adminId))
                .map(mapper::toRoom)
                .orElseThrow(() -> new IllegalStateException("Room " + roomName + " could not be stored"));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> findMessages(String roomName, int offset, int limit) {
        if (!StringUtils.hasText(roomName) || limit <= 0) {
            return Collections.emptyList();
        }
        Optional<RoomEntity> room = roomJpaRepository.findByName(roomName);
        if (room.isEmpty()) {
            return Collections.emptyList();
        }

        TypedQuery<MessageEntity> query = entityManager.createQuery(
                "select m from MessageEntity m where m.roomId = :roomId order by m.sentAt asc, m.id asc",
                MessageEntity.class);
        query.setParameter("roomId", room.get().getId());
        query.setFirstResult(Math.max(offset, 0));
        query.setMaxResults(limit);
        List<MessageEntity> page = query.getResultList();
        if (page.isEmpty()) {
            return Collections.emptyList();
        }

        Map<Long, String> senders = userJpaRepository
                .findAllById(page.stream().map(MessageEntity::getAuthorId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(UserEntity::getId, UserEntity::getUsername, (left, right) -> left));
        return page.stream()
                .map(entity -> mapper.toMessage(entity, senders.getOrDefault(entity.getAuthorId(), UNKNOWN_SENDER)))
                .toList();
    }

    @Override
    @Transactional
    public ChatMessage appendMessage(String text, Long authorId, Long roomId) {
        if (authorId == null || roomId == null) {
            throw new IllegalArgumentException("Author and room are required to store a message");
        }
        MessageEntity entity = new MessageEntity();
        entity.setText(text != null ? text : "");
        entity.setAuthorId(authorId);
        entity.setRoomId(roomId);
        entity.setSentAt(Instant.now());
        messageJpaRepository.save(entity);

        String sender = userJpaRepository.findById(authorId)
                .map(UserEntity::getUsername)
                .orElse(UNKNOWN_SENDER);
        return mapper.toMessage(entity, sender);
    }

    @Override
    @Transactional
    public void updateLastRoom(Long userId, Long roomId) {
        if (userId == null) {
            return;
        }
        userJpaRepository.updateLastRoom(userId, roomId);
    }

    @Override
    @Transactional
    public void deleteMessages(String roomName) {
        roomJpaRepository.findByName(roomName)
                .ifPresent(room -> {
                    int removed = messageJpaRepository.deleteByRoomId(room.getId());
                    log.debug("Deleted {} messages of room {}", removed, roomName);
                });
    }

    @Override
    @Transactional
    public void deleteRoom(String roomName) {
        if (!StringUtils.hasText(roomName)) {
            return;
        }
        roomJpaRepository.findByName(roomName).ifPresent(room -> {
            int messages = messageJpaRepository.deleteByRoomId(room.getId());
            int users = userJpaRepository.clearLastRoom(room.getId());
            roomJpaRepository.deleteById(room.getId());
            log.info("Deleted room {} ({} messages, {} last-room references cleared)", roomName, messages, users);
        });
    }

    private Optional<UserEntity> createUser(String username) {
        UserEntity entity = new UserEntity();
        entity.setUsername(username);
        entity.setCreatedAt(Instant.now());
        return saveOrReload(entity, () -> userJpaRepository.findByUsername(username), userJpaRepository::save);
    }

    private Optional<RoomEntity> createRoom(String roomName, Long adminId) {
        RoomEntity entity = new RoomEntity();
        entity.setName(roomName);
        entity.setAdminId(adminId);
        entity.setCreatedAt(Instant.now());
        Optional<RoomEntity> created =
                saveOrReload(entity, () -> roomJpaRepository.findByName(roomName), roomJpaRepository::save);
        created.ifPresent(room -> log.info("Created room {} with admin {}", room.getName(), room.getAdminId()));
        return created;
    }

    private <E> Optional<E> saveOrReload(E entity, Supplier<Optional<E>> reload, Function<E, E> save) {
        try {
            return Optional.of(save.apply(entity));
        } catch (DataIntegrityViolationException ex) {
            Optional<E> stored = reload.get();
            if (stored.isEmpty()) {
                throw ex;
            }
            log.debug("Concurrent insert detected, using the stored row", ex);
            return stored;
        }
    }

    private static void requireText(String value, String label) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(label + " is required");
        }
    }
}
