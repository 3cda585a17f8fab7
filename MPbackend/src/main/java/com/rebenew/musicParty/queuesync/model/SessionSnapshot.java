package com.rebenew.musicParty.queuesync.model;

import java.util.List;

/**
 * Vista completa e inmutable de una sesión en una versión concreta.
 * Es lo que recibe un cliente al unirse o al pedir resync.
 *
 * @param tracks historial de reproducción seguido de la cola ordenada por votos
 * @param pendingSuggestions solo presente en la vista de host/delegado
 */
public record SessionSnapshot(
        String sessionId,
        long version,
        String hostId,
        List<Member> roster,
        List<TrackView> tracks,
        String currentTrackId,
        Transport transport,
        List<Suggestion> pendingSuggestions
) {
    public SessionSnapshot {
        roster = List.copyOf(roster);
        tracks = List.copyOf(tracks);
        pendingSuggestions = pendingSuggestions == null ? null : List.copyOf(pendingSuggestions);
    }

    /**
     * Recorta la vista según el rol: los participantes no ven sugerencias pendientes.
     */
    public SessionSnapshot forRole(MemberRole role) {
        if (role != null && role.canControl()) {
            return this;
        }
        return new SessionSnapshot(sessionId, version, hostId, roster, tracks, currentTrackId, transport, null);
    }

    /**
     * Solo los tracks en cola, en orden de ranking.
     */
    public List<TrackView> queue() {
        return tracks.stream()
                .filter(t -> t.state() == TrackState.QUEUED)
                .toList();
    }

    /**
     * Copia con la posición de transporte extrapolada al instante dado.
     */
    public SessionSnapshot at(long now) {
        if (transport == null || !transport.playing()) {
            return this;
        }
        long duration = tracks.stream()
                .filter(t -> t.id().equals(currentTrackId))
                .mapToLong(TrackView::durationMs)
                .findFirst()
                .orElse(0L);
        return new SessionSnapshot(sessionId, version, hostId, roster, tracks, currentTrackId,
                transport.extrapolatedTo(now, duration), pendingSuggestions);
    }
}
