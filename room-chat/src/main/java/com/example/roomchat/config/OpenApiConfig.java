package com.example.roomchat.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Room Chat Relay API",
                        version = "1.0",
                        description = "Read-only view of live rooms, persisted rooms and room history. "
                                + "Chat traffic itself flows over the /ws/{username} WebSocket endpoint."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi roomApi() {
        return GroupedOpenApi.builder()
                .group("rooms")
                .pathsToMatch("/api/**")
                .build();
    }
}
