package com.example.roomchat.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ConnectionHandle} that keeps every payload it is given.
 */
class RecordingConnection implements ConnectionHandle {

    private final String id;
    private final List<String> sent = new ArrayList<>();
    private boolean open = true;
    private boolean failSends;
    private boolean failClose;

    RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public synchronized void send(String payload) throws IOException {
        if (failSends || !open) {
            throw new IOException("send failed on " + id);
        }
        sent.add(payload);
    }

    @Override
    public synchronized void close() throws IOException {
        if (failClose) {
            throw new IOException("close failed on " + id);
        }
        open = false;
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    synchronized List<String> sent() {
        return List.copyOf(sent);
    }

    synchronized void clear() {
        sent.clear();
    }

    synchronized void failSends() {
        failSends = true;
    }

    synchronized void failClose() {
        failClose = true;
    }
}
