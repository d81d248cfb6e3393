package com.virusbot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import tools.jackson.databind.json.JsonMapper;

/**
 * Beans of the server connection: the JSR-356 WebSocket client and the JSON mapper
 * used by the protocol codec.
 */
@Configuration
public class ClientConfiguration {

    @Bean
    public WebSocketClient webSocketClient() {
        return new StandardWebSocketClient();
    }

    @Bean
    public JsonMapper jsonMapper() {
        return JsonMapper.builder().build();
    }
}
