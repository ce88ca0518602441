package com.example.roomchat.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Translates between JSON text frames and {@link ClientCommand} / {@link ServerFrame}.
 */
@Component
@RequiredArgsConstructor
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public ClientCommand decode(String payload) {
        if (payload == null) {
            throw new MalformedFrameException("Empty frame");
        }
        ClientCommand command;
        try {
            command = objectMapper.readValue(payload, ClientCommand.class);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Frame is not a JSON object", e);
        }
        if (command == null) {
            throw new MalformedFrameException("Frame is not a JSON object");
        }
        return command;
    }

    public String encode(ServerFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize frame " + frame.getType(), e);
        }
    }
}
