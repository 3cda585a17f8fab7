package com.rebenew.musicParty.queuesync.model;

/**
 * Proyección de un {@link TrackRecord} con su recuento de votos, tal como la ven los clientes.
 */
public record TrackView(
        String id,
        String sourceRef,
        String title,
        String artist,
        long durationMs,
        String artworkUrl,
        String addedBy,
        long enqueuedSeq,
        long addedAt,
        int likes,
        int dislikes,
        TrackState state
) {
    public static TrackView of(TrackRecord track, Tally tally) {
        return new TrackView(track.id(), track.sourceRef(), track.title(), track.artist(),
                track.durationMs(), track.artworkUrl(), track.addedBy(), track.enqueuedSeq(),
                track.addedAt(), tally.likes(), tally.dislikes(), track.state());
    }

    public int score() {
        return likes - dislikes;
    }
}
