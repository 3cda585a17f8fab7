package com.rebenew.musicParty.queuesync.model;

/**
 * Datos de catálogo de una referencia externa (título, artista, duración, carátula).
 */
public record TrackMetadata(
        String sourceRef,
        String title,
        String artist,
        long durationMs,
        String artworkUrl
) {
    public TrackMetadata {
        if (sourceRef == null || sourceRef.trim().isEmpty()) {
            throw new IllegalArgumentException("sourceRef no puede ser nulo o vacío");
        }
        if (durationMs < 0) {
            durationMs = 0L;
        }
    }
}
