package com.example.roomchat.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class FrameCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FrameCodec codec = new FrameCodec(objectMapper);

    @Test
    void decodesJoinCommandAndIgnoresUnknownProperties() {
        ClientCommand command = codec.decode("{\"action\":\"join\",\"room\":\"general\",\"client\":\"web\"}");

        assertThat(command.getAction()).isEqualTo("join");
        assertThat(command.getRoom()).isEqualTo("general");
        assertThat(command.getMessage()).isNull();
    }

    @Test
    void rejectsTextThatIsNotJson() {
        assertThatThrownBy(() -> codec.decode("hello there"))
                .isInstanceOf(MalformedFrameException.class);
        assertThatThrownBy(() -> codec.decode("{\"action\":"))
                .isInstanceOf(MalformedFrameException.class);
        assertThatThrownBy(() -> codec.decode(null))
                .isInstanceOf(MalformedFrameException.class);
    }

    @Test
    void rejectsJsonThatIsNotAnObject() {
        assertThatThrownBy(() -> codec.decode("null")).isInstanceOf(MalformedFrameException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(MalformedFrameException.class);
    }

    @Test
    void encodesJoinConfirmWithIsAdminFlag() throws Exception {
        JsonNode json = objectMapper.readTree(codec.encode(ServerFrame.joinConfirm(true)));

        assertThat(json.get("type").asText()).isEqualTo("join_confirm");
        assertThat(json.get("isAdmin").asBoolean()).isTrue();
        assertThat(json.has("admin")).isFalse();
        assertThat(json.has("message")).isFalse();
    }

    @Test
    void encodesRoomListsAndNoticesWithoutUnusedFields() {
        assertThat(codec.encode(ServerFrame.existingRoomList(List.of("general", "random"))))
                .isEqualTo("{\"type\":\"existing_room_list\",\"rooms\":[\"general\",\"random\"]}");
        assertThat(codec.encode(ServerFrame.info("User 'bob' has reconnected")))
                .isEqualTo("{\"type\":\"info\",\"message\":\"User 'bob' has reconnected\"}");
        assertThat(codec.encode(ServerFrame.lastRoomClosed()))
                .isEqualTo("{\"type\":\"last_room_closed\"}");
    }

    @Test
    void actionNamesAreCaseInsensitive() {
        assertThat(CommandAction.from(" Message ")).contains(CommandAction.MESSAGE);
        assertThat(CommandAction.from("shout")).isEmpty();
        assertThat(CommandAction.from(null)).isEmpty();
    }
}
