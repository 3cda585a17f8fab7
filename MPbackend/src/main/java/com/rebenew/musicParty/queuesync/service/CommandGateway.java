package com.rebenew.musicParty.queuesync.service;

import com.rebenew.musicParty.queuesync.catalog.TrackCatalog;
import com.rebenew.musicParty.queuesync.config.SessionProperties;
import com.rebenew.musicParty.queuesync.core.AdvanceOutcome;
import com.rebenew.musicParty.queuesync.core.EventSink;
import com.rebenew.musicParty.queuesync.core.LiveSession;
import com.rebenew.musicParty.queuesync.core.SessionRegistry;
import com.rebenew.musicParty.queuesync.core.SessionState;
import com.rebenew.musicParty.queuesync.error.InvalidTargetException;
import com.rebenew.musicParty.queuesync.error.NotAuthorizedException;
import com.rebenew.musicParty.queuesync.error.SessionNotFoundException;
import com.rebenew.musicParty.queuesync.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Punto de entrada de todas las acciones de los miembros sobre una sesión.
 *
 * Cada comando se autoriza, se aplica al {@link SessionState} con el lock de la sesión
 * tomado y su evento se difunde a todas las conexiones (incluida la del llamador) antes
 * de soltar el lock. Las consultas al catálogo se hacen antes de tomarlo.
 */
@Service
public class CommandGateway {
    private static final Logger logger = LoggerFactory.getLogger(CommandGateway.class);
    private static final int JOIN_ATTEMPTS = 3;

    enum Permission {
        MEMBER,      // cualquier miembro del roster
        CONTROLLER,  // host o delegado
        HOST
    }

    private final SessionRegistry registry;
    private final TrackCatalog catalog;
    private final ScheduledExecutorService scheduler;
    private final SessionProperties properties;

    public CommandGateway(SessionRegistry registry,
                          TrackCatalog catalog,
                          ScheduledExecutorService scheduler,
                          SessionProperties properties) {
        this.registry = registry;
        this.catalog = catalog;
        this.scheduler = scheduler;
        this.properties = properties;
    }

    // ==================== MIEMBROS ====================

    /**
     * Añade la conexión a la sesión (creándola en la primera unión), le envía el snapshot
     * completo y anuncia al miembro al resto.
     */
    public SessionSnapshot join(String sessionId, EventSink sink, String correlationId) {
        for (int attempt = 1; ; attempt++) {
            LiveSession live = registry.acquire(sessionId, sink.memberId());
            try {
                return run(live, l -> applyJoin(l, sink, correlationId));
            } catch (SessionNotFoundException e) {
                // desmontada entre la búsqueda y el lock; el siguiente acquire crea una nueva
                if (attempt >= JOIN_ATTEMPTS) {
                    throw e;
                }
                logger.debug("Session {} closed during join of {}, retrying", sessionId, sink.memberId());
            }
        }
    }

    private SessionSnapshot applyJoin(LiveSession live, EventSink sink, String correlationId) {
        SessionState state = live.state();
        registry.cancelTeardown(live);

        boolean newMember = false;
        if (!live.channel().isSubscribed(sink.id())) {
            live.channel().subscribe(sink);
            newMember = state.addConnection(sink.memberId());
        }

        MemberRole role = state.roleOf(sink.memberId());
        SessionSnapshot snapshot = state.snapshot().forRole(role);
        live.channel().unicast(sink.id(), SyncMsg.snapshot(snapshot, correlationId));

        if (newMember) {
            live.channel().publishExcept(event(live, EventType.MEMBER_JOINED,
                    payload("memberId", sink.memberId(), "role", role)), sink.id());
            logger.info("👋 {} joined session {} as {}", sink.memberId(), live.sessionId(), role.wireName());
        } else {
            logger.debug("{} opened another connection to session {}", sink.memberId(), live.sessionId());
        }
        return snapshot;
    }

    /**
     * Quita una conexión. El miembro sale del roster con su última conexión; un roster
     * vacío arma el teardown.
     */
    public boolean leave(String sessionId, EventSink sink) {
        Optional<LiveSession> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        try {
            return run(found.get(), live -> {
                if (live.channel().unsubscribe(sink.id()) == null) {
                    return false;
                }
                SessionState state = live.state();
                boolean left = state.removeConnection(sink.memberId());
                if (left) {
                    live.channel().publish(event(live, EventType.MEMBER_LEFT, payload("memberId", sink.memberId())));
                    logger.info("🚪 {} left session {}", sink.memberId(), sessionId);
                }
                if (state.isEmpty()) {
                    registry.scheduleTeardown(live);
                }
                return left;
            });
        } catch (SessionNotFoundException e) {
            logger.debug("Leave on closed session {} ignored", sessionId);
            return false;
        }
    }

    /**
     * Snapshot actual para un miembro, leído sin tomar el lock de la sesión.
     */
    public SessionSnapshot snapshotFor(String sessionId, String memberId) {
        SessionSnapshot snapshot = registry.snapshot(sessionId);
        MemberRole role = snapshot.roster().stream()
                .filter(m -> m.memberId().equals(memberId))
                .map(Member::role)
                .findFirst()
                .orElseThrow(() -> new NotAuthorizedException(memberId + " is not a member of session " + sessionId));
        return snapshot.forRole(role).at(System.currentTimeMillis());
    }

    // ==================== COLA ====================

    public Suggestion propose(String sessionId, String memberId, TrackMetadata hints) {
        TrackMetadata metadata = resolve(hints);
        return execute(sessionId, memberId, Permission.MEMBER, live -> {
            Suggestion suggestion = live.state().propose(metadata, memberId);
            SyncMsg msg = event(live, EventType.SUGGESTION_ADDED, payload("suggestion", suggestion));
            publishToControllersAnd(live, msg, memberId);
            logger.info("💡 {} proposed {} in session {}", memberId, metadata.sourceRef(), sessionId);
            return suggestion;
        });
    }

    public TrackRecord approve(String sessionId, String memberId, String suggestionId) {
        return execute(sessionId, memberId, Permission.CONTROLLER, live -> {
            TrackRecord track = live.state().approve(suggestionId);
            publishTrackAdded(live, track, memberId);
            logger.info("✅ Suggestion {} approved by {} in session {} as {}", suggestionId, memberId, sessionId, track.id());
            return track;
        });
    }

    public Suggestion reject(String sessionId, String memberId, String suggestionId) {
        return execute(sessionId, memberId, Permission.CONTROLLER, live -> {
            Suggestion suggestion = live.state().reject(suggestionId);
            SyncMsg msg = event(live, EventType.SUGGESTION_REJECTED,
                    payload("suggestionId", suggestionId, "rejectedBy", memberId));
            publishToControllersAnd(live, msg, suggestion.proposedBy());
            logger.info("❌ Suggestion {} rejected by {} in session {}", suggestionId, memberId, sessionId);
            return suggestion;
        });
    }

    public TrackRecord addTrack(String sessionId, String memberId, TrackMetadata hints) {
        TrackMetadata metadata = resolve(hints);
        return execute(sessionId, memberId, Permission.MEMBER, live -> {
            TrackRecord track = live.state().addTrack(metadata, memberId);
            publishTrackAdded(live, track, memberId);
            logger.info("➕ Track {} ({}) added by {} in session {}", track.id(), track.title(), memberId, sessionId);
            return track;
        });
    }

    /**
     * Eliminar el current promueve además el siguiente del ranking: dos eventos,
     * {@code track-removed} y luego {@code now-playing}.
     */
    public TrackRecord removeTrack(String sessionId, String memberId, String trackId) {
        return execute(sessionId, memberId, Permission.CONTROLLER, live -> {
            SessionState state = live.state();
            boolean wasCurrent = trackId != null && trackId.equals(state.getCurrentTrackId());
            TrackRecord removed = state.removeTrack(trackId);
            live.channel().publish(event(live, EventType.TRACK_REMOVED,
                    payload("trackId", trackId, "removedBy", memberId)));
            logger.info("🗑️ Track {} removed by {} in session {}", trackId, memberId, sessionId);

            if (wasCurrent) {
                AdvanceOutcome outcome = state.promoteAfterRemoval();
                publishNowPlaying(live, outcome, "removed");
                rearmTrackEnd(live);
            }
            return removed;
        });
    }

    public Tally vote(String sessionId, String memberId, String trackId, VoteDirection direction) {
        if (direction == null) {
            throw new IllegalArgumentException("direction is required");
        }
        return execute(sessionId, memberId, Permission.MEMBER, live -> {
            Tally tally = live.state().vote(trackId, memberId, direction);
            publishTally(live, tally);
            logger.debug("🗳️ {} voted {} on {} in session {} ({}/{})",
                    memberId, direction.wireName(), trackId, sessionId, tally.likes(), tally.dislikes());
            return tally;
        });
    }

    public Tally clearVote(String sessionId, String memberId, String trackId) {
        return execute(sessionId, memberId, Permission.MEMBER, live -> {
            Tally tally = live.state().clearVote(trackId, memberId);
            publishTally(live, tally);
            logger.debug("{} cleared vote on {} in session {}", memberId, trackId, sessionId);
            return tally;
        });
    }

    // ==================== REPRODUCCIÓN ====================

    /**
     * Promueve el primer track del ranking. Un reenvío cuya {@code observedVersion} es
     * anterior al último avance aplicado no hace nada.
     */
    public AdvanceOutcome advance(String sessionId, String memberId, long observedVersion) {
        return execute(sessionId, memberId, Permission.CONTROLLER, live -> {
            AdvanceOutcome outcome = live.state().advance(observedVersion);
            if (!outcome.applied()) {
                logger.info("↩️ Advance from {} in session {} ignored (observed v{}, now v{})",
                        memberId, sessionId, observedVersion, outcome.version());
                return outcome;
            }
            publishNowPlaying(live, outcome, "advance");
            rearmTrackEnd(live);
            logger.info("⏭️ Session {} advanced by {} to {}", sessionId, memberId, outcome.currentTrackId());
            return outcome;
        });
    }

    public Transport setPlayback(String sessionId, String memberId, boolean playing, Long positionMs) {
        return execute(sessionId, memberId, Permission.CONTROLLER, live -> {
            Transport transport = live.state().setPlayback(playing, positionMs);
            publishTransport(live, transport);
            rearmTrackEnd(live);
            logger.info("{} Playback {} in session {} by {} at {}ms", playing ? "▶️" : "⏸️",
                    playing ? "started" : "paused", sessionId, memberId, transport.positionMs());
            return transport;
        });
    }

    // Lo dispara el timer de fin de track
    void advanceOnTrackEnd(LiveSession live, long armedVersion, long generation) {
        if (live.isClosed()) {
            return;
        }
        try {
            run(live, l -> {
                SessionState state = l.state();
                // rearmado o cancelado (pausa, seek, avance) mientras esperaba el lock
                if (!l.isTrackEndCurrent(generation) || !state.getTransport().playing()) {
                    logger.debug("Outdated track end ignored in session {}", l.sessionId());
                    return AdvanceOutcome.stale(state.getVersion(), state.getCurrentTrackId());
                }
                AdvanceOutcome outcome = state.advance(armedVersion);
                if (!outcome.applied()) {
                    return outcome;
                }
                publishNowPlaying(l, outcome, "track-ended");
                if (outcome.currentTrackId() != null) {
                    publishTransport(l, state.setPlayback(true, 0L));
                }
                rearmTrackEnd(l);
                logger.info("🔚 Track ended in session {}, now playing {}", l.sessionId(), outcome.currentTrackId());
                return outcome;
            });
        } catch (SessionNotFoundException e) {
            logger.debug("Track end on closed session {} ignored", live.sessionId());
        } catch (RuntimeException e) {
            logger.error("❌ Auto-advance failed in session {}: {}", live.sessionId(), e.getMessage(), e);
        }
    }

    // ==================== ROSTER ====================

    public Member grantDelegate(String sessionId, String memberId, String targetId) {
        return changeRole(sessionId, memberId, targetId, MemberRole.DELEGATE);
    }

    public Member revokeDelegate(String sessionId, String memberId, String targetId) {
        return changeRole(sessionId, memberId, targetId, MemberRole.PARTICIPANT);
    }

    private Member changeRole(String sessionId, String memberId, String targetId, MemberRole role) {
        return execute(sessionId, memberId, Permission.HOST, live -> {
            long before = live.state().getVersion();
            Member updated = live.state().setRole(targetId, role);
            if (live.state().getVersion() != before) {
                live.channel().publish(event(live, EventType.DELEGATE_CHANGED,
                        payload("memberId", targetId, "role", updated.role())));
                logger.info("🎛️ {} is now {} in session {}", targetId, role.wireName(), sessionId);
            }
            return updated;
        });
    }

    // ==================== INTERNOS ====================

    private <T> T execute(String sessionId, String memberId, Permission permission,
                          Function<LiveSession, T> operation) {
        LiveSession live = registry.require(sessionId);
        return run(live, l -> {
            authorize(l.state(), memberId, permission);
            return operation.apply(l);
        });
    }

    private <T> T run(LiveSession live, Function<LiveSession, T> operation) {
        try {
            return live.execute(operation);
        } catch (IllegalStateException e) {
            logger.error("🚨 Invariant violated in session {}: {}", live.sessionId(), e.getMessage(), e);
            registry.discard(live, e.getMessage());
            throw e;
        }
    }

    private void authorize(SessionState state, String memberId, Permission permission) {
        MemberRole role = state.roleOf(memberId);
        if (role == null) {
            throw new NotAuthorizedException(memberId + " is not a member of session " + state.getSessionId());
        }
        if (permission == Permission.CONTROLLER && !role.canControl()) {
            throw new NotAuthorizedException("Only the host or a delegate can do this");
        }
        if (permission == Permission.HOST && role != MemberRole.HOST) {
            throw new NotAuthorizedException("Only the host can do this");
        }
    }

    /**
     * Manda el catálogo; las pistas del cliente completan los huecos. Sin ninguno no hay nada que encolar.
     */
    TrackMetadata resolve(TrackMetadata hints) {
        if (hints == null) {
            throw new IllegalArgumentException("sourceRef is required");
        }
        Optional<TrackMetadata> found = catalog.lookup(hints.sourceRef());
        if (found.isPresent()) {
            TrackMetadata m = found.get();
            return new TrackMetadata(hints.sourceRef(),
                    m.title() != null ? m.title() : hints.title(),
                    m.artist() != null ? m.artist() : hints.artist(),
                    m.durationMs() > 0 ? m.durationMs() : hints.durationMs(),
                    m.artworkUrl() != null ? m.artworkUrl() : hints.artworkUrl());
        }
        if (hints.title() == null || hints.title().isBlank()) {
            throw new InvalidTargetException("Unknown track: " + hints.sourceRef());
        }
        return hints;
    }

    private void rearmTrackEnd(LiveSession live) {
        long generation = live.rearmTrackEnd();
        if (!properties.isAutoAdvance()) {
            return;
        }
        SessionState state = live.state();
        TrackRecord current = state.currentTrack();
        Transport transport = state.getTransport();
        if (current == null || !transport.playing() || !current.hasKnownDuration()) {
            return;
        }
        long remaining = Math.max(0L,
                current.durationMs() - transport.positionAt(System.currentTimeMillis(), current.durationMs()));
        long armedVersion = state.getVersion();
        live.scheduleTrackEnd(scheduler.schedule(() -> advanceOnTrackEnd(live, armedVersion, generation),
                remaining, TimeUnit.MILLISECONDS));
        logger.debug("⏱️ Track end for {} in session {} in {} ms", current.id(), live.sessionId(), remaining);
    }

    private void publishTrackAdded(LiveSession live, TrackRecord track, String addedBy) {
        TrackView view = TrackView.of(track, Tally.empty(track.id()));
        live.channel().publish(event(live, EventType.TRACK_ADDED, payload("track", view, "addedBy", addedBy)));
    }

    private void publishTally(LiveSession live, Tally tally) {
        live.channel().publish(event(live, EventType.VOTE_UPDATED,
                payload("trackId", tally.trackId(), "likes", tally.likes(), "dislikes", tally.dislikes())));
    }

    private void publishNowPlaying(LiveSession live, AdvanceOutcome outcome, String reason) {
        Transport transport = live.state().getTransport();
        Map<String, Object> data = payload(
                "trackId", outcome.currentTrackId(),
                "previousTrackId", outcome.previousTrackId(),
                "reason", reason,
                "isPlaying", transport.playing(),
                "positionMs", transport.positionMs());
        live.channel().publish(SyncMsg.event(EventType.NOW_PLAYING, live.sessionId(), outcome.version(), data));
    }

    private void publishTransport(LiveSession live, Transport transport) {
        live.channel().publish(event(live, EventType.PLAYBACK_STATE_CHANGED, payload(
                "trackId", live.state().getCurrentTrackId(),
                "isPlaying", transport.playing(),
                "positionMs", transport.positionMs(),
                "updatedAt", transport.updatedAtMs())));
    }

    // Las sugerencias pendientes solo las ven el host, los delegados y quien las propuso
    private void publishToControllersAnd(LiveSession live, SyncMsg msg, String memberId) {
        SessionState state = live.state();
        live.channel().publishWhere(msg, sink -> {
            MemberRole role = state.roleOf(sink.memberId());
            return (role != null && role.canControl()) || sink.memberId().equals(memberId);
        });
    }

    private static SyncMsg event(LiveSession live, EventType type, Map<String, Object> data) {
        return SyncMsg.event(type, live.sessionId(), live.state().getVersion(), data);
    }

    // Map.of no admite nulls y trackId puede ser null (cola vacía)
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }
}
