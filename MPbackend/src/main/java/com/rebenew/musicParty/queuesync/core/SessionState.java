package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.error.InvalidTargetException;
import com.rebenew.musicParty.queuesync.model.*;

import java.util.*;

/**
 * Agregado autoritativo de una sesión: roster, tracks, historial, transporte,
 * sugerencias y versión.
 *
 * No es thread-safe. Todos los métodos se invocan con el lock de
 * {@link LiveSession} tomado. Cada mutación aplicada incrementa {@code version}.
 */
public class SessionState {
    private final String sessionId;
    private final String hostId;

    private final Map<String, Member> roster = new LinkedHashMap<>();
    private final Map<String, Integer> connections = new HashMap<>();

    private final Map<String, TrackRecord> tracks = new LinkedHashMap<>();
    private final List<String> history = new ArrayList<>(); // ids en el orden en que fueron current
    private final Map<String, Suggestion> suggestions = new LinkedHashMap<>();
    private final VoteLedger ledger = new VoteLedger();

    private String currentTrackId;
    private Transport transport;

    private long version = 0L;
    private long lastAdvanceVersion = 0L;
    private long trackSeq = 0L;
    private long suggestionSeq = 0L;

    public SessionState(String sessionId, String hostId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId no puede ser nulo o vacío");
        }
        if (hostId == null || hostId.isBlank()) {
            throw new IllegalArgumentException("hostId no puede ser nulo o vacío");
        }
        this.sessionId = sessionId;
        this.hostId = hostId;
        this.transport = Transport.pausedAtStart(System.currentTimeMillis());
    }

    // ==================== ROSTER ====================

    /**
     * Registra una conexión del miembro. Devuelve true si el miembro es nuevo en el roster
     * (solo entonces cambia la versión).
     */
    public boolean addConnection(String memberId) {
        int count = connections.merge(memberId, 1, Integer::sum);
        if (count > 1) {
            return false;
        }
        MemberRole role = hostId.equals(memberId) ? MemberRole.HOST : MemberRole.PARTICIPANT;
        roster.put(memberId, new Member(memberId, role, System.currentTimeMillis()));
        bump();
        return true;
    }

    /**
     * Quita una conexión. Devuelve true si era la última y el miembro sale del roster.
     */
    public boolean removeConnection(String memberId) {
        Integer count = connections.get(memberId);
        if (count == null) {
            return false;
        }
        if (count > 1) {
            connections.put(memberId, count - 1);
            return false;
        }
        connections.remove(memberId);
        roster.remove(memberId);
        bump();
        return true;
    }

    public MemberRole roleOf(String memberId) {
        Member m = memberId == null ? null : roster.get(memberId);
        return m == null ? null : m.role();
    }

    public boolean isMember(String memberId) {
        return memberId != null && roster.containsKey(memberId);
    }

    public boolean isEmpty() {
        return roster.isEmpty();
    }

    public Member setRole(String memberId, MemberRole role) {
        Member m = roster.get(memberId);
        if (m == null) {
            throw new InvalidTargetException("El miembro no está en la sesión: " + memberId);
        }
        if (m.role() == MemberRole.HOST) {
            throw new InvalidTargetException("El rol del host no se puede cambiar");
        }
        if (role == MemberRole.HOST) {
            throw new InvalidTargetException("Solo puede haber un host");
        }
        if (m.role() == role) {
            return m;
        }
        Member updated = m.withRole(role);
        roster.put(memberId, updated);
        bump();
        return updated;
    }

    // ==================== SUGERENCIAS ====================

    public Suggestion propose(TrackMetadata metadata, String memberId) {
        Suggestion s = new Suggestion("s-" + (++suggestionSeq), metadata, memberId, System.currentTimeMillis());
        suggestions.put(s.id(), s);
        bump();
        return s;
    }

    public TrackRecord approve(String suggestionId) {
        Suggestion s = takeSuggestion(suggestionId);
        return enqueue(s.track(), s.proposedBy());
    }

    public Suggestion reject(String suggestionId) {
        Suggestion s = takeSuggestion(suggestionId);
        bump();
        return s;
    }

    private Suggestion takeSuggestion(String suggestionId) {
        Suggestion s = suggestionId == null ? null : suggestions.remove(suggestionId);
        if (s == null) {
            throw new InvalidTargetException("Sugerencia no encontrada: " + suggestionId);
        }
        return s;
    }

    // ==================== COLA ====================

    public TrackRecord addTrack(TrackMetadata metadata, String memberId) {
        return enqueue(metadata, memberId);
    }

    private TrackRecord enqueue(TrackMetadata metadata, String addedBy) {
        long seq = ++trackSeq;
        TrackRecord t = TrackRecord.queued("t-" + seq, metadata, addedBy, seq);
        tracks.put(t.id(), t);
        bump();
        return t;
    }

    /**
     * Marca el track como eliminado. Si era el current, el llamador debe promover
     * el siguiente con {@link #promoteAfterRemoval()}.
     */
    public TrackRecord removeTrack(String trackId) {
        TrackRecord t = requireTrack(trackId);
        if (!t.state().isRemovable()) {
            throw new InvalidTargetException("El track no se puede eliminar en estado " + t.state().wireName());
        }
        TrackRecord removed = t.withState(TrackState.REMOVED);
        tracks.put(trackId, removed);
        ledger.discard(trackId);
        if (trackId.equals(currentTrackId)) {
            currentTrackId = null;
            transport = Transport.pausedAtStart(System.currentTimeMillis());
        }
        bump();
        return removed;
    }

    // ==================== VOTOS ====================

    public Tally vote(String trackId, String memberId, VoteDirection direction) {
        requireVotable(trackId);
        Tally tally = ledger.cast(trackId, memberId, direction);
        bump();
        return tally;
    }

    public Tally clearVote(String trackId, String memberId) {
        requireVotable(trackId);
        Tally tally = ledger.clear(trackId, memberId);
        bump();
        return tally;
    }

    private void requireVotable(String trackId) {
        TrackRecord t = requireTrack(trackId);
        if (!t.state().isVotable()) {
            throw new InvalidTargetException("No se puede votar un track en estado " + t.state().wireName());
        }
    }

    // ==================== TRANSPORTE ====================

    /**
     * Avanza al siguiente track del ranking.
     * Es un no-op si ya se aplicó un avance después de la versión observada por el llamador.
     */
    public AdvanceOutcome advance(long observedVersion) {
        if (observedVersion < 0 || observedVersion > version) {
            throw new InvalidTargetException("observedVersion fuera de rango: " + observedVersion
                    + " (versión actual " + version + ")");
        }
        if (lastAdvanceVersion > observedVersion) {
            return AdvanceOutcome.stale(version, currentTrackId);
        }
        // Idle y sin cola: no hay nada que promover
        if (currentTrackId == null && RankingEngine.rankQueue(tracks.values(), ledger::tally).isEmpty()) {
            return AdvanceOutcome.stale(version, null);
        }
        return promoteNext();
    }

    public AdvanceOutcome promoteAfterRemoval() {
        return promoteNext();
    }

    private AdvanceOutcome promoteNext() {
        String previous = currentTrackId;
        if (previous != null) {
            tracks.put(previous, tracks.get(previous).withState(TrackState.PLAYED));
        }
        List<TrackView> queue = RankingEngine.rankQueue(tracks.values(), ledger::tally);
        if (queue.isEmpty()) {
            currentTrackId = null;
        } else {
            String next = queue.get(0).id();
            tracks.put(next, tracks.get(next).withState(TrackState.CURRENT));
            history.add(next);
            currentTrackId = next;
        }
        transport = Transport.pausedAtStart(System.currentTimeMillis());
        bump();
        lastAdvanceVersion = version;
        return new AdvanceOutcome(true, version, previous, currentTrackId);
    }

    /**
     * Cambia play/pausa y, opcionalmente, la posición. Sin posición se conserva la extrapolada.
     */
    public Transport setPlayback(boolean playing, Long positionMs) {
        TrackRecord current = currentTrack();
        if (current == null) {
            throw new InvalidTargetException("No hay track sonando");
        }
        long now = System.currentTimeMillis();
        long position = positionMs != null ? positionMs : transport.positionAt(now, current.durationMs());
        if (position < 0 || (current.hasKnownDuration() && position > current.durationMs())) {
            throw new InvalidTargetException("positionMs fuera de rango: " + position);
        }
        transport = new Transport(playing, position, now);
        bump();
        return transport;
    }

    // ==================== CONSULTAS ====================

    public TrackRecord currentTrack() {
        return currentTrackId == null ? null : tracks.get(currentTrackId);
    }

    public TrackRecord track(String trackId) {
        return trackId == null ? null : tracks.get(trackId);
    }

    private TrackRecord requireTrack(String trackId) {
        TrackRecord t = track(trackId);
        if (t == null) {
            throw new InvalidTargetException("Track no encontrado: " + trackId);
        }
        return t;
    }

    public List<TrackView> rankedTracks() {
        List<TrackRecord> played = new ArrayList<>(history.size());
        for (String id : history) {
            played.add(tracks.get(id));
        }
        return RankingEngine.rank(played, tracks.values(), ledger::tally);
    }

    public List<String> playHistory() {
        return List.copyOf(history);
    }

    /**
     * Vista completa (incluye sugerencias). Quien la envíe debe recortarla con
     * {@link SessionSnapshot#forRole(MemberRole)}.
     */
    public SessionSnapshot snapshot() {
        return new SessionSnapshot(sessionId, version, hostId, new ArrayList<>(roster.values()),
                rankedTracks(), currentTrackId, transport, new ArrayList<>(suggestions.values()));
    }

    /**
     * Comprueba las invariantes estructurales. Una violación invalida la sesión entera.
     */
    public void verifyInvariants() {
        long currents = tracks.values().stream().filter(t -> t.state() == TrackState.CURRENT).count();
        if (currents > 1) {
            throw new IllegalStateException("Más de un track current en la sesión " + sessionId);
        }
        if (currentTrackId == null && currents != 0) {
            throw new IllegalStateException("Track current sin currentTrackId en la sesión " + sessionId);
        }
        if (currentTrackId != null) {
            TrackRecord current = tracks.get(currentTrackId);
            if (current == null || current.state() != TrackState.CURRENT) {
                throw new IllegalStateException("currentTrackId inconsistente en la sesión " + sessionId);
            }
        }
        if (lastAdvanceVersion > version) {
            throw new IllegalStateException("lastAdvanceVersion por delante de version en la sesión " + sessionId);
        }
    }

    private void bump() {
        version++;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getHostId() {
        return hostId;
    }

    public long getVersion() {
        return version;
    }

    public long getLastAdvanceVersion() {
        return lastAdvanceVersion;
    }

    public String getCurrentTrackId() {
        return currentTrackId;
    }

    public Transport getTransport() {
        return transport;
    }

    public int getMemberCount() {
        return roster.size();
    }

    public int getConnectionCount() {
        return connections.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getQueueSize() {
        return (int) tracks.values().stream().filter(t -> t.state() == TrackState.QUEUED).count();
    }
}
