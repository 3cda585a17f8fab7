package com.rebenew.musicParty.queuesync.websocket;

import com.rebenew.musicParty.queuesync.core.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Conexión WebSocket de un miembro ya unido a una sesión.
 * Se construye sobre el decorador concurrente para que un cliente lento no bloquee la difusión.
 */
public class WebSocketEventSink implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketEventSink.class);

    private final WebSocketSession session;
    private final String memberId;

    public WebSocketEventSink(WebSocketSession session, String memberId) {
        this.session = session;
        this.memberId = memberId;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public String memberId() {
        return memberId;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String json) throws IOException {
        session.sendMessage(new TextMessage(json));
    }

    @Override
    public void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            logger.debug("Error cerrando conexión {}: {}", session.getId(), e.getMessage());
        }
    }
}
