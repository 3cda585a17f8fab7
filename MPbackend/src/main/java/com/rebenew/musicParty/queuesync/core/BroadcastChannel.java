package com.rebenew.musicParty.queuesync.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.musicParty.queuesync.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Difusión de eventos de UNA sesión. El estado de conexiones vive aquí, no hay mapa global de sockets.
 * Las entregas fallidas se registran y no se reintentan: el cliente se resincroniza al volver a unirse.
 */
public class BroadcastChannel {
    private static final Logger logger = LoggerFactory.getLogger(BroadcastChannel.class);

    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final Map<String, EventSink> sinks = new ConcurrentHashMap<>();

    public BroadcastChannel(String sessionId, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.objectMapper = objectMapper;
    }

    public void subscribe(EventSink sink) {
        sinks.put(sink.id(), sink);
    }

    public EventSink unsubscribe(String sinkId) {
        return sinkId == null ? null : sinks.remove(sinkId);
    }

    public boolean isSubscribed(String sinkId) {
        return sinkId != null && sinks.containsKey(sinkId);
    }

    /**
     * Envía a todas las conexiones, incluida la del autor del cambio.
     */
    public void publish(SyncMsg message) {
        publishExcept(message, null);
    }

    public void publishExcept(SyncMsg message, String excludedSinkId) {
        publishWhere(message, sink -> excludedSinkId == null || !excludedSinkId.equals(sink.id()));
    }

    public void publishWhere(SyncMsg message, Predicate<EventSink> filter) {
        String json = serialize(message);
        if (json == null) {
            return;
        }
        sinks.values().forEach(sink -> {
            if (filter.test(sink)) {
                deliver(sink, json);
            }
        });
        logger.debug("📡 {} difundido en sesión {} (v{})", message.getSubType(), sessionId, message.getVersion());
    }

    public void unicast(String sinkId, SyncMsg message) {
        EventSink sink = sinks.get(sinkId);
        if (sink == null) {
            logger.debug("Unicast a conexión desconocida {} en sesión {}", sinkId, sessionId);
            return;
        }
        send(sink, message);
    }

    /**
     * Envío directo a un sink, esté o no suscrito (respuestas a comandos).
     */
    public void send(EventSink sink, SyncMsg message) {
        String json = serialize(message);
        if (json != null) {
            deliver(sink, json);
        }
    }

    public void closeAll(CloseStatus status) {
        List<EventSink> snapshot = new ArrayList<>(sinks.values());
        sinks.clear();
        for (EventSink sink : snapshot) {
            try {
                if (sink.isOpen()) {
                    sink.close(status);
                }
            } catch (Exception e) {
                logger.debug("Error cerrando conexión {}: {}", sink.id(), e.getMessage());
            }
        }
    }

    public int size() {
        return sinks.size();
    }

    private String serialize(SyncMsg message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializando mensaje para sesión {}: {}", sessionId, e.getMessage(), e);
            return null;
        }
    }

    private void deliver(EventSink sink, String json) {
        if (!sink.isOpen()) {
            return;
        }
        try {
            sink.send(json);
        } catch (IOException | RuntimeException e) {
            logger.warn("⚠️ Error enviando a conexión {} (miembro {}) en sesión {}: {}",
                    sink.id(), sink.memberId(), sessionId, e.getMessage());
        }
    }
}
