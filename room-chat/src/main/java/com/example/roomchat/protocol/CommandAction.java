package com.example.roomchat.protocol;

import java.util.Locale;
import java.util.Optional;

public enum CommandAction {
    JOIN,
    LEAVE,
    MESSAGE,
    CLOSE;

    public static Optional<CommandAction> from(String action) {
        if (action == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(action.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
