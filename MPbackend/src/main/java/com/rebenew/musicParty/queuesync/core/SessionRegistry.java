package com.rebenew.musicParty.queuesync.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.musicParty.queuesync.authority.HostDirectory;
import com.rebenew.musicParty.queuesync.config.SessionProperties;
import com.rebenew.musicParty.queuesync.error.SessionNotFoundException;
import com.rebenew.musicParty.queuesync.history.SessionHistory;
import com.rebenew.musicParty.queuesync.model.SessionSnapshot;
import com.rebenew.musicParty.queuesync.model.TrackState;
import com.rebenew.musicParty.queuesync.model.TrackView;
import com.rebenew.musicParty.queuesync.service.SessionLifecycleSystem;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tabla de sesiones vivas del proceso. Crea la sesión con la primera unión y la
 * desmonta cuando lleva vacía el periodo de gracia configurado.
 */
@Service
public class SessionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final HostDirectory hostDirectory;
    private final SessionProperties properties;
    private final ApplicationEventPublisher publisher;

    public SessionRegistry(ObjectMapper objectMapper,
                           ScheduledExecutorService scheduler,
                           HostDirectory hostDirectory,
                           SessionProperties properties,
                           ApplicationEventPublisher publisher) {
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.hostDirectory = hostDirectory;
        this.properties = properties;
        this.publisher = publisher;
        logger.info("SessionRegistry inicializado (teardown tras {} s)", properties.getTeardownGrace().toSeconds());
    }

    // ====================
    // BÚSQUEDA / CREACIÓN
    // ====================

    /**
     * Devuelve la sesión viva o la crea. Si nadie ha reclamado la sesión, quien se une primero es el host.
     */
    public LiveSession acquire(String sessionId, String memberId) {
        validateSessionId(sessionId);
        validateMemberId(memberId);
        if (shuttingDown.get()) {
            throw new SessionNotFoundException(sessionId);
        }
        return sessions.computeIfAbsent(sessionId, id -> create(id, memberId));
    }

    /**
     * Reclama la sesión para un host y la deja creada y vacía. Si nadie se une dentro
     * del periodo de gracia, el teardown la desmonta y libera el reclamo.
     *
     * @return el host efectivo; distinto de {@code hostId} si otro la reclamó antes
     */
    public String open(String sessionId, String hostId) {
        validateSessionId(sessionId);
        validateMemberId(hostId);
        if (shuttingDown.get()) {
            throw new SessionNotFoundException(sessionId);
        }
        String owner = hostDirectory.claim(sessionId, hostId);
        if (!owner.equals(hostId)) {
            return owner;
        }
        LiveSession live = sessions.computeIfAbsent(sessionId, id -> create(id, hostId));
        live.execute(l -> {
            if (l.state().isEmpty()) {
                scheduleTeardown(l);
            }
            return null;
        });
        return owner;
    }

    private LiveSession create(String sessionId, String firstMemberId) {
        String hostId = hostDirectory.claim(sessionId, firstMemberId);
        LiveSession live = new LiveSession(new SessionState(sessionId, hostId),
                new BroadcastChannel(sessionId, objectMapper));
        logger.info("🎵 Sesión creada: {} (host: {})", sessionId, hostId);
        publisher.publishEvent(SessionLifecycleSystem.Event.created(this, sessionId));
        return live;
    }

    public LiveSession require(String sessionId) {
        LiveSession live = sessionId == null ? null : sessions.get(sessionId);
        if (live == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return live;
    }

    public Optional<LiveSession> find(String sessionId) {
        return Optional.ofNullable(sessionId == null ? null : sessions.get(sessionId));
    }

    public SessionSnapshot snapshot(String sessionId) {
        return require(sessionId).latestSnapshot();
    }

    public boolean exists(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public Collection<LiveSession> all() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    // ====================
    // TEARDOWN
    // ====================

    /**
     * Arma el teardown de una sesión que se ha quedado sin miembros. Se llama con el lock de la sesión tomado.
     */
    public void scheduleTeardown(LiveSession live) {
        long graceMs = properties.getTeardownGrace().toMillis();
        ScheduledFuture<?> task = scheduler.schedule(() -> {
            try {
                teardown(live);
            } catch (RuntimeException e) {
                logger.error("❌ Error desmontando sesión {}: {}", live.sessionId(), e.getMessage(), e);
            }
        }, graceMs, TimeUnit.MILLISECONDS);
        live.armTeardown(task);
        logger.info("⏳ Sesión {} vacía, teardown en {} ms", live.sessionId(), graceMs);
        publisher.publishEvent(SessionLifecycleSystem.Event.emptied(this, live.sessionId()));
    }

    /**
     * Cancela un teardown pendiente. Se llama con el lock de la sesión tomado.
     */
    public void cancelTeardown(LiveSession live) {
        if (live.cancelTeardown()) {
            logger.info("🔄 Sesión {} reanudada antes del teardown", live.sessionId());
            publisher.publishEvent(SessionLifecycleSystem.Event.resumed(this, live.sessionId()));
        }
    }

    /**
     * Desmonta la sesión si sigue vacía. Una unión posterior crea una sesión nueva.
     */
    public boolean teardown(LiveSession live) {
        if (!live.closeIf(SessionState::isEmpty) || !live.markDismantled()) {
            return false;
        }
        SessionHistory history = dismantle(live, CloseStatus.NORMAL, "empty");
        logger.info("🗑️ Sesión desmontada: {}", live.sessionId());
        publisher.publishEvent(SessionLifecycleSystem.Event.tornDown(this, history));
        return true;
    }

    /**
     * Descarta una sesión cuyo estado ya no es confiable. Las conexiones se cierran
     * con SERVER_ERROR y la siguiente unión reconstruye la sesión desde cero.
     */
    public void discard(LiveSession live, String reason) {
        live.forceClose();
        if (!live.markDismantled()) {
            return;
        }
        SessionHistory history = dismantle(live, CloseStatus.SERVER_ERROR, reason);
        logger.error("🚨 Sesión {} descartada: {}", live.sessionId(), reason);
        publisher.publishEvent(SessionLifecycleSystem.Event.failed(this, history));
    }

    private SessionHistory dismantle(LiveSession live, CloseStatus status, String reason) {
        String sessionId = live.sessionId();
        sessions.remove(sessionId, live);
        live.channel().closeAll(status);
        hostDirectory.release(sessionId);

        List<TrackView> played = new ArrayList<>();
        for (TrackView t : live.latestSnapshot().tracks()) {
            if (t.state() == TrackState.PLAYED || t.state() == TrackState.CURRENT) {
                played.add(t);
            }
        }
        return new SessionHistory(sessionId, live.state().getHostId(), played,
                live.getCreatedAt(), System.currentTimeMillis(), reason);
    }

    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("🛑 Cerrando {} sesiones", sessions.size());
        for (LiveSession live : new ArrayList<>(sessions.values())) {
            live.forceClose();
            if (live.markDismantled()) {
                SessionHistory history = dismantle(live, CloseStatus.GOING_AWAY, "shutdown");
                publisher.publishEvent(SessionLifecycleSystem.Event.tornDown(this, history));
            }
        }
    }

    // ==================== ESTADÍSTICAS ====================

    public Map<String, Object> getServiceStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalSessions", sessions.size());
        stats.put("totalMembers", sessions.values().stream()
                .mapToInt(s -> s.latestSnapshot().roster().size()).sum());
        stats.put("totalConnections", sessions.values().stream()
                .mapToInt(s -> s.channel().size()).sum());
        stats.put("totalQueuedTracks", sessions.values().stream()
                .mapToInt(s -> s.latestSnapshot().queue().size()).sum());
        stats.put("activePlayingSessions", sessions.values().stream()
                .filter(s -> s.latestSnapshot().transport().playing()).count());
        stats.put("timestamp", System.currentTimeMillis());
        return stats;
    }

    public Map<String, Object> getHealthStats() {
        Map<String, Object> stats = getServiceStats();
        stats.put("emptySessions", sessions.values().stream()
                .filter(s -> s.latestSnapshot().roster().isEmpty()).count());
        stats.put("status", shuttingDown.get() ? "SHUTTING_DOWN" : "ACTIVE");
        stats.put("teardownGraceMs", properties.getTeardownGrace().toMillis());
        stats.put("autoAdvance", properties.isAutoAdvance());
        return stats;
    }

    // ==================== VALIDACIONES ====================

    private void validateSessionId(String sessionId) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("sessionId no puede ser nulo o vacío");
        }
    }

    private void validateMemberId(String memberId) {
        if (memberId == null || memberId.trim().isEmpty()) {
            throw new IllegalArgumentException("memberId no puede ser nulo o vacío");
        }
    }
}
