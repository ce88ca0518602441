package com.example.roomchat.service;

import java.io.IOException;

/**
 * A live, send-capable client connection. Owned by the {@link ChatSession} that accepted it;
 * the {@link RoomRegistry} only keeps references.
 */
public interface ConnectionHandle {

    String id();

    void send(String payload) throws IOException;

    /**
     * Terminates the connection with a normal-closure status.
     */
    void close() throws IOException;

    boolean isOpen();
}
