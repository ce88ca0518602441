package com.example.roomchat.config;

import com.example.roomchat.service.ChatStore;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @NestedConfigurationProperty
    private final Websocket websocket = new Websocket();

    @NestedConfigurationProperty
    private final History history = new History();

    @NestedConfigurationProperty
    private final Identity identity = new Identity();

    public Websocket getWebsocket() {
        return websocket;
    }

    public History getHistory() {
        return history;
    }

    public Identity getIdentity() {
        return identity;
    }

    @Validated
    public static class Websocket {

        /**
         * Origin patterns accepted during the WebSocket handshake.
         */
        @NotEmpty
        private List<String> allowedOrigins = List.of("*");

        /**
         * Maximum time a single send may take before the connection is considered stalled.
         */
        private Duration sendTimeLimit = Duration.ofSeconds(10);

        /**
         * Maximum number of bytes buffered for a slow connection before it is dropped.
         */
        @Min(1024)
        private int sendBufferSizeLimit = 512 * 1024;

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public Duration getSendTimeLimit() {
            return sendTimeLimit;
        }

        public void setSendTimeLimit(Duration sendTimeLimit) {
            this.sendTimeLimit = sendTimeLimit;
        }

        public int getSendBufferSizeLimit() {
            return sendBufferSizeLimit;
        }

        public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
            this.sendBufferSizeLimit = sendBufferSizeLimit;
        }
    }

    @Validated
    public static class History {

        /**
         * Number of messages loaded per query when replaying a room's history.
         */
        @Min(1)
        private int pageSize = 100;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    @Validated
    public static class Identity {

        /**
         * Longest display name accepted on the connection endpoint.
         */
        @Min(1)
        @Max(ChatStore.USERNAME_MAX_LENGTH)
        private int maxLength = 64;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }
}
