package com.rebenew.musicParty.queuesync.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.musicParty.queuesync.config.SessionProperties;
import com.rebenew.musicParty.queuesync.core.AdvanceOutcome;
import com.rebenew.musicParty.queuesync.error.ErrorCode;
import com.rebenew.musicParty.queuesync.error.SessionException;
import com.rebenew.musicParty.queuesync.model.*;
import com.rebenew.musicParty.queuesync.service.CommandGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Protocolo de comandos sobre {@code /ws/music-sync}.
 *
 * Cada conexión se une a una única sesión con {@code session/join}; a partir de ahí
 * todos sus mensajes deben llevar el mismo {@code sessionId} y {@code senderId}.
 * Cada comando recibe un {@code ack} o un {@code error} con el mismo {@code correlationId}.
 */
@Component
public class SyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final CommandGateway gateway;
    private final ObjectMapper objectMapper;
    private final SessionProperties properties;

    // Conexiones abiertas, por id de WebSocketSession
    private final ConcurrentMap<String, UserSession> userSessions = new ConcurrentHashMap<>();

    public SyncWebSocketHandler(CommandGateway gateway,
                                ObjectMapper objectMapper,
                                SessionProperties properties,
                                ScheduledExecutorService scheduler) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.properties = properties;
        startSweeper(scheduler);
        logger.info("✅ SyncWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        logger.info("🔄 Nueva conexión WebSocket: {}", session.getId());
        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session,
                properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit());
        userSessions.put(session.getId(), new UserSession(out));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        UserSession userSession = userSessions.get(session.getId());
        if (userSession == null) {
            logger.warn("⚠️ Mensaje de conexión no registrada: {}", session.getId());
            return;
        }
        userSession.updateActivity();

        SyncMsg msg;
        try {
            msg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
        } catch (JsonProcessingException e) {
            logger.warn("❌ Mensaje malformado en {}: {}", session.getId(), e.getOriginalMessage());
            reply(userSession, SyncMsg.error(ErrorCode.BAD_REQUEST.wireName(), "invalid_message", null));
            return;
        }
        processMessage(userSession, msg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        UserSession userSession = userSessions.remove(session.getId());
        if (userSession != null && userSession.sink != null) {
            gateway.leave(userSession.sessionId, userSession.sink);
            logger.info("🔌 Conexión cerrada: {} - Sesión: {} ({})", session.getId(), userSession.sessionId, status);
        } else {
            logger.info("🔌 Conexión cerrada: {}", session.getId());
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    void processMessage(UserSession userSession, SyncMsg msg) {
        String type = msg.getType();
        String correlationId = msg.getCorrelationId();

        if (type == null) {
            reply(userSession, SyncMsg.error(ErrorCode.BAD_REQUEST.wireName(), "missing_type", correlationId));
            return;
        }
        if ("heartbeat".equals(type)) {
            reply(userSession, SyncMsg.ack("heartbeat", correlationId, null));
            return;
        }
        if (msg.getSessionId() == null || msg.getSenderId() == null) {
            reply(userSession, SyncMsg.error(ErrorCode.BAD_REQUEST.wireName(), "missing_required_fields", correlationId));
            return;
        }

        boolean joining = "session".equals(type) && "join".equals(msg.getSubType());
        if (!joining && !validateSession(userSession, msg)) {
            reply(userSession, SyncMsg.error(ErrorCode.NOT_AUTHORIZED.wireName(), "invalid_session", correlationId));
            return;
        }

        try {
            switch (type) {
                case "session":
                    handleSession(userSession, msg);
                    break;
                case "queue":
                    handleQueue(userSession, msg);
                    break;
                case "playback":
                    handlePlayback(userSession, msg);
                    break;
                case "roster":
                    handleRoster(userSession, msg);
                    break;
                default:
                    reply(userSession, SyncMsg.error(ErrorCode.BAD_REQUEST.wireName(), "unknown_message_type", correlationId));
            }
        } catch (SessionException e) {
            logger.warn("⛔ {}/{} de {} rechazado: {}", type, msg.getSubType(), msg.getSenderId(), e.getMessage());
            reply(userSession, SyncMsg.error(e.getCode().wireName(), e.getMessage(), correlationId));
        } catch (IllegalArgumentException e) {
            logger.warn("❌ {}/{} inválido de {}: {}", type, msg.getSubType(), msg.getSenderId(), e.getMessage());
            reply(userSession, SyncMsg.error(ErrorCode.BAD_REQUEST.wireName(), e.getMessage(), correlationId));
        } catch (RuntimeException e) {
            logger.error("❌ Error procesando {}/{}: {}", type, msg.getSubType(), e.getMessage(), e);
            reply(userSession, SyncMsg.error(ErrorCode.INTERNAL_ERROR.wireName(), "internal_error", correlationId));
        }
    }

    // ==================== SESIÓN ====================

    private void handleSession(UserSession userSession, SyncMsg msg) {
        String subType = requireSubType(msg);
        switch (subType) {
            case "join":
                handleJoin(userSession, msg);
                break;
            case "leave":
                gateway.leave(userSession.sessionId, userSession.sink);
                userSession.unbind();
                reply(userSession, SyncMsg.ack("left", msg.getCorrelationId(), null));
                break;
            case "sync":
                SessionSnapshot snapshot = gateway.snapshotFor(userSession.sessionId, userSession.memberId);
                reply(userSession, SyncMsg.snapshot(snapshot, msg.getCorrelationId()));
                break;
            default:
                throw new IllegalArgumentException("unknown_session_action: " + subType);
        }
    }

    private void handleJoin(UserSession userSession, SyncMsg msg) {
        if (userSession.sink != null) {
            if (userSession.sessionId.equals(msg.getSessionId()) && userSession.memberId.equals(msg.getSenderId())) {
                // reenvío del join: solo se repite el snapshot
                SessionSnapshot snapshot = gateway.snapshotFor(userSession.sessionId, userSession.memberId);
                reply(userSession, SyncMsg.snapshot(snapshot, msg.getCorrelationId()));
                return;
            }
            throw new IllegalArgumentException("already_joined: " + userSession.sessionId);
        }

        WebSocketEventSink sink = new WebSocketEventSink(userSession.session, msg.getSenderId());
        // el snapshot de respuesta lo envía el gateway por unicast
        gateway.join(msg.getSessionId(), sink, msg.getCorrelationId());
        userSession.bind(msg.getSessionId(), msg.getSenderId(), sink);
    }

    // ==================== COLA ====================

    private void handleQueue(UserSession userSession, SyncMsg msg) {
        String sessionId = userSession.sessionId;
        String memberId = userSession.memberId;
        String correlationId = msg.getCorrelationId();
        String subType = requireSubType(msg);

        switch (subType) {
            case "propose": {
                Suggestion s = gateway.propose(sessionId, memberId, hints(msg));
                reply(userSession, SyncMsg.ack("proposed", correlationId, result("suggestionId", s.id())));
                break;
            }
            case "approve": {
                TrackRecord t = gateway.approve(sessionId, memberId, requireString(msg, "suggestionId"));
                reply(userSession, SyncMsg.ack("approved", correlationId, result("trackId", t.id())));
                break;
            }
            case "reject": {
                Suggestion s = gateway.reject(sessionId, memberId, requireString(msg, "suggestionId"));
                reply(userSession, SyncMsg.ack("rejected", correlationId, result("suggestionId", s.id())));
                break;
            }
            case "add": {
                TrackRecord t = gateway.addTrack(sessionId, memberId, hints(msg));
                reply(userSession, SyncMsg.ack("added", correlationId, result("trackId", t.id())));
                break;
            }
            case "remove": {
                TrackRecord t = gateway.removeTrack(sessionId, memberId, requireString(msg, "trackId"));
                reply(userSession, SyncMsg.ack("removed", correlationId, result("trackId", t.id())));
                break;
            }
            case "vote": {
                VoteDirection direction = VoteDirection.fromWire(requireString(msg, "direction"));
                Tally tally = gateway.vote(sessionId, memberId, requireString(msg, "trackId"), direction);
                reply(userSession, SyncMsg.ack("voted", correlationId, tallyResult(tally)));
                break;
            }
            case "clear-vote": {
                Tally tally = gateway.clearVote(sessionId, memberId, requireString(msg, "trackId"));
                reply(userSession, SyncMsg.ack("vote_cleared", correlationId, tallyResult(tally)));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown_queue_action: " + subType);
        }
    }

    // ==================== REPRODUCCIÓN ====================

    private void handlePlayback(UserSession userSession, SyncMsg msg) {
        String correlationId = msg.getCorrelationId();
        String subType = requireSubType(msg);

        switch (subType) {
            case "advance": {
                Long observed = msg.getLongData("observedVersion");
                if (observed == null) {
                    observed = msg.getVersion();
                }
                if (observed == null) {
                    throw new IllegalArgumentException("observedVersion is required");
                }
                AdvanceOutcome outcome = gateway.advance(userSession.sessionId, userSession.memberId, observed);
                Map<String, Object> data = result("applied", outcome.applied());
                data.put("version", outcome.version());
                data.put("currentTrackId", outcome.currentTrackId());
                reply(userSession, SyncMsg.ack(outcome.applied() ? "advanced" : "stale_version", correlationId, data));
                break;
            }
            case "set": {
                Boolean playing = msg.getBoolData("isPlaying");
                if (playing == null) {
                    throw new IllegalArgumentException("isPlaying is required");
                }
                Transport transport = gateway.setPlayback(userSession.sessionId, userSession.memberId,
                        playing, msg.getLongData("positionMs"));
                Map<String, Object> data = result("isPlaying", transport.playing());
                data.put("positionMs", transport.positionMs());
                reply(userSession, SyncMsg.ack("playback_set", correlationId, data));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown_playback_action: " + subType);
        }
    }

    // ==================== ROSTER ====================

    private void handleRoster(UserSession userSession, SyncMsg msg) {
        String subType = requireSubType(msg);
        String target = requireString(msg, "memberId");
        Member updated;
        switch (subType) {
            case "grant-delegate":
                updated = gateway.grantDelegate(userSession.sessionId, userSession.memberId, target);
                break;
            case "revoke-delegate":
                updated = gateway.revokeDelegate(userSession.sessionId, userSession.memberId, target);
                break;
            default:
                throw new IllegalArgumentException("unknown_roster_action: " + subType);
        }
        Map<String, Object> data = result("memberId", updated.memberId());
        data.put("role", updated.role());
        reply(userSession, SyncMsg.ack("role_changed", msg.getCorrelationId(), data));
    }

    // ==================== UTILIDADES ====================

    private boolean validateSession(UserSession userSession, SyncMsg msg) {
        if (userSession.sink == null) {
            logger.warn("❌ Comando {} antes de unirse a una sesión ({})", msg.getType(), msg.getSenderId());
            return false;
        }
        if (!userSession.sessionId.equals(msg.getSessionId())) {
            logger.warn("❌ sessionId no coincide. Conexión: {} vs Msg: {}", userSession.sessionId, msg.getSessionId());
            return false;
        }
        if (!userSession.memberId.equals(msg.getSenderId())) {
            logger.warn("❌ senderId no coincide. Conexión: {} vs Msg: {}", userSession.memberId, msg.getSenderId());
            return false;
        }
        return true;
    }

    private static String requireSubType(SyncMsg msg) {
        if (msg.getSubType() == null) {
            throw new IllegalArgumentException("missing_subType");
        }
        return msg.getSubType();
    }

    private static String requireString(SyncMsg msg, String key) {
        String value = msg.getStringData(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    private static TrackMetadata hints(SyncMsg msg) {
        Long duration = msg.getLongData("durationMs");
        return new TrackMetadata(requireString(msg, "sourceRef"),
                msg.getStringData("title"),
                msg.getStringData("artist"),
                duration != null ? duration : 0L,
                msg.getStringData("artworkUrl"));
    }

    private static Map<String, Object> result(String key, Object value) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(key, value);
        return data;
    }

    private static Map<String, Object> tallyResult(Tally tally) {
        Map<String, Object> data = result("trackId", tally.trackId());
        data.put("likes", tally.likes());
        data.put("dislikes", tally.dislikes());
        return data;
    }

    private void reply(UserSession userSession, SyncMsg msg) {
        if (!userSession.session.isOpen()) {
            return;
        }
        try {
            userSession.session.sendMessage(new TextMessage(objectMapper.writeValueAsString(msg)));
        } catch (IOException | RuntimeException e) {
            logger.warn("⚠️ Error enviando respuesta a {}: {}", userSession.session.getId(), e.getMessage());
        }
    }

    // ==================== LIMPIEZA DE CONEXIONES INACTIVAS ====================

    private void startSweeper(ScheduledExecutorService scheduler) {
        long interval = properties.getSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::cleanupInactiveSessions, interval, interval, TimeUnit.MILLISECONDS);
        logger.info("🧹 Sweeper iniciado cada {} ms", interval);
    }

    void cleanupInactiveSessions() {
        long now = System.currentTimeMillis();
        long timeout = properties.getClientIdleTimeout().toMillis();
        userSessions.values().forEach(userSession -> {
            if (now - userSession.lastActivity > timeout && userSession.session.isOpen()) {
                logger.info("🧹 Cerrando conexión inactiva {} ({})", userSession.session.getId(), userSession.memberId);
                try {
                    // afterConnectionClosed hace el leave
                    userSession.session.close(CloseStatus.SESSION_NOT_RELIABLE.withReason("idle_timeout"));
                } catch (IOException e) {
                    logger.debug("Error cerrando conexión inactiva {}: {}", userSession.session.getId(), e.getMessage());
                }
            }
        });
    }

    // ==================== CLASE INTERNA ====================

    static class UserSession {
        final WebSocketSession session;
        volatile String sessionId;
        volatile String memberId;
        volatile WebSocketEventSink sink;
        volatile long lastActivity;

        UserSession(WebSocketSession session) {
            this.session = session;
            this.lastActivity = System.currentTimeMillis();
        }

        void updateActivity() {
            this.lastActivity = System.currentTimeMillis();
        }

        void bind(String sessionId, String memberId, WebSocketEventSink sink) {
            this.sessionId = sessionId;
            this.memberId = memberId;
            this.sink = sink;
        }

        void unbind() {
            this.sink = null;
            this.sessionId = null;
            this.memberId = null;
        }
    }
}
