package com.rebenew.musicParty.queuesync.config;

import com.rebenew.musicParty.queuesync.websocket.SyncWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SyncWebSocketHandler syncWebSocketHandler;
    private final SessionProperties sessionProperties;

    public WebSocketConfig(SyncWebSocketHandler syncWebSocketHandler, SessionProperties sessionProperties) {
        this.syncWebSocketHandler = syncWebSocketHandler;
        this.sessionProperties = sessionProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(syncWebSocketHandler, "/ws/music-sync")
                .setAllowedOriginPatterns(sessionProperties.getAllowedOrigins().toArray(new String[0]));
    }
}
