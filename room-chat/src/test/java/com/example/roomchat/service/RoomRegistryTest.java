package com.example.roomchat.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RoomRegistryTest {

    private RoomRegistry registry;
    private RecordingConnection alice;
    private RecordingConnection bob;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
        alice = new RecordingConnection("c-alice");
        bob = new RecordingConnection("c-bob");
    }

    @Test
    void admittedIdentityIsOnlyInTheLobby() {
        registry.admitToLobby("alice", alice);

        assertThat(registry.isInLobby("alice")).isTrue();
        assertThat(registry.roomOf("alice")).isEmpty();
        assertThat(registry.lobbyMembers()).containsOnlyKeys("alice");
        assertThat(registry.activeRoomNames()).isEmpty();
    }

    @Test
    void movingToRoomRemovesFromLobbyAndActivatesRoom() {
        registry.admitToLobby("alice", alice);

        registry.moveToRoom("alice", alice, "general");

        assertThat(registry.isInLobby("alice")).isFalse();
        assertThat(registry.roomOf("alice")).contains("general");
        assertThat(registry.roomMembers("general")).containsEntry("alice", alice);
        assertThat(registry.activeRoomNames()).containsExactly("general");
    }

    @Test
    void switchingRoomsLeavesPreviousRoomAndPrunesIt() {
        registry.moveToRoom("alice", alice, "general");
        registry.moveToRoom("alice", alice, "random");

        assertThat(registry.roomMembers("general")).isEmpty();
        assertThat(registry.activeRoomNames()).containsExactly("random");
        assertThat(registry.roomOf("alice")).contains("random");
    }

    @Test
    void moveToLobbyRequiresMembership() {
        registry.moveToRoom("alice", alice, "general");

        assertThat(registry.moveToLobby("alice", "random")).isFalse();
        assertThat(registry.moveToLobby("alice", "general")).isTrue();

        assertThat(registry.lobbyMembers()).containsEntry("alice", alice);
        assertThat(registry.activeRoomNames()).isEmpty();
    }

    @Test
    void roomStaysActiveWhileAnyMemberRemains() {
        registry.moveToRoom("alice", alice, "general");
        registry.moveToRoom("bob", bob, "general");

        assertThat(registry.removeFromRoom("alice", "general")).isTrue();

        assertThat(registry.activeRoomNames()).containsExactly("general");
        assertThat(registry.roomMembers("general")).containsOnlyKeys("bob");
    }

    @Test
    void removalWithStaleHandleKeepsNewerConnection() {
        RecordingConnection aliceAgain = new RecordingConnection("c-alice-2");
        registry.moveToRoom("alice", alice, "general");
        registry.moveToRoom("alice", aliceAgain, "general");

        assertThat(registry.removeFromRoom("alice", "general", alice)).isFalse();
        assertThat(registry.roomMembers("general")).containsEntry("alice", aliceAgain);

        registry.admitToLobby("bob", bob);
        assertThat(registry.removeFromLobby("bob", new RecordingConnection("other"))).isFalse();
        assertThat(registry.removeFromLobby("bob", bob)).isTrue();
        assertThat(registry.lobbyMembers()).isEmpty();
    }

    @Test
    void detachRoomReturnsEveryMemberAndLeavesThemNowhere() {
        RecordingConnection carol = new RecordingConnection("c-carol");
        registry.moveToRoom("alice", alice, "general");
        registry.moveToRoom("bob", bob, "general");
        registry.moveToRoom("carol", carol, "random");

        Map<String, ConnectionHandle> detached = registry.detachRoom("general");

        assertThat(detached).containsOnlyKeys("alice", "bob");
        assertThat(registry.roomOf("alice")).isEmpty();
        assertThat(registry.isInLobby("alice")).isFalse();
        assertThat(registry.roomOf("bob")).isEmpty();
        assertThat(registry.removeFromRoom("bob", "general", bob)).isFalse();
        assertThat(registry.activeRoomNames()).containsExactly("random");
    }

    @Test
    void detachUnknownRoomIsEmpty() {
        assertThat(registry.detachRoom("nowhere")).isEmpty();
    }

    @Test
    void snapshotsAreNotLiveViews() {
        registry.moveToRoom("alice", alice, "general");
        Map<String, ConnectionHandle> snapshot = registry.roomMembers("general");
        List<String> active = registry.activeRoomNames();

        registry.moveToRoom("bob", bob, "general");
        registry.moveToRoom("bob", bob, "random");

        assertThat(snapshot).containsOnlyKeys("alice");
        assertThat(active).containsExactly("general");
    }

    @Test
    void concurrentMovesKeepEveryIdentityInExactlyOnePlace() throws Exception {
        int identities = 16;
        int iterations = 500;
        List<String> roomNames = List.of("a", "b", "c");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < identities; i++) {
                String identity = "user-" + i;
                RecordingConnection handle = new RecordingConnection("c-" + i);
                futures.add(executor.submit(() -> {
                    start.await();
                    ThreadLocalRandom random = ThreadLocalRandom.current();
                    for (int n = 0; n < iterations; n++) {
                        String room = roomNames.get(random.nextInt(roomNames.size()));
                        switch (random.nextInt(4)) {
                            case 0 -> registry.admitToLobby(identity, handle);
                            case 1 -> registry.moveToRoom(identity, handle, room);
                            case 2 -> registry.moveToLobby(identity, room);
                            default -> registry.removeFromRoom(identity, room, handle);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int i = 0; i < identities; i++) {
            String identity = "user-" + i;
            boolean inLobby = registry.isInLobby(identity);
            long roomsContaining = roomNames.stream()
                    .filter(room -> registry.roomMembers(room).containsKey(identity))
                    .count();
            assertThat(roomsContaining).isLessThanOrEqualTo(1);
            assertThat(inLobby && roomsContaining > 0).isFalse();
            assertThat(registry.roomOf(identity).isPresent()).isEqualTo(roomsContaining == 1);
        }
        for (String active : registry.activeRoomNames()) {
            assertThat(registry.roomMembers(active)).isNotEmpty();
        }
    }
}
