package com.rebenew.musicParty.queuesync.model;

/**
 * Una instancia de canción colocada en la cola de una sesión.
 * Inmutable: cada transición de estado produce una copia nueva.
 * Los votos no viven aquí, se derivan del ledger (ver {@link TrackView}).
 */
public record TrackRecord(
        String id,
        String sourceRef,
        String title,
        String artist,
        long durationMs,   // 0 = desconocida
        String artworkUrl, // nullable
        String addedBy,
        long enqueuedSeq,
        long addedAt,
        TrackState state
) {
    public TrackRecord {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id no puede ser nulo o vacío");
        }
        if (sourceRef == null || sourceRef.trim().isEmpty()) {
            throw new IllegalArgumentException("sourceRef no puede ser nulo o vacío");
        }
        if (addedBy == null || addedBy.trim().isEmpty()) {
            throw new IllegalArgumentException("addedBy no puede ser nulo o vacío");
        }
        if (enqueuedSeq <= 0) {
            throw new IllegalArgumentException("enqueuedSeq debe ser positivo");
        }
        if (state == null) {
            state = TrackState.QUEUED;
        }
        if (title == null || title.isBlank()) {
            title = "Unknown Track";
        }
        if (artist == null || artist.isBlank()) {
            artist = "Unknown Artist";
        }
        if (durationMs < 0) {
            durationMs = 0L;
        }
        if (addedAt <= 0) {
            addedAt = System.currentTimeMillis();
        }
    }

    public static TrackRecord queued(String id, TrackMetadata metadata, String addedBy, long enqueuedSeq) {
        return new TrackRecord(id, metadata.sourceRef(), metadata.title(), metadata.artist(),
                metadata.durationMs(), metadata.artworkUrl(), addedBy, enqueuedSeq,
                System.currentTimeMillis(), TrackState.QUEUED);
    }

    public TrackRecord withState(TrackState newState) {
        return new TrackRecord(id, sourceRef, title, artist, durationMs, artworkUrl, addedBy,
                enqueuedSeq, addedAt, newState);
    }

    public boolean hasKnownDuration() {
        return durationMs > 0;
    }
}
