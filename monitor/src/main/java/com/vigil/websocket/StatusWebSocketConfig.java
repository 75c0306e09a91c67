package com.vigil.websocket;

import com.vigil.config.VigilProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class StatusWebSocketConfig implements WebSocketConfigurer {

    private final StatusWebSocketHandler statusHandler;
    private final VigilProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        VigilProperties.Websocket websocket = properties.getWebsocket();
        String[] origins = websocket.getAllowedOrigins().toArray(String[]::new);

        registry.addHandler(statusHandler, websocket.getStatusPath())
                .setAllowedOrigins(origins);

        log.info("Status push registered at {} (origins: {})", websocket.getStatusPath(), websocket.getAllowedOrigins());
    }
}
