package com.rebenew.musicParty.queuesync.model;

/**
 * Track propuesto pendiente de aprobación del host. No tiene votos ni posición.
 */
public record Suggestion(
        String id,
        TrackMetadata track,
        String proposedBy,
        long proposedAt
) {
    public Suggestion {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id no puede ser nulo o vacío");
        }
        if (track == null) {
            throw new IllegalArgumentException("track no puede ser nulo");
        }
        if (proposedBy == null || proposedBy.trim().isEmpty()) {
            throw new IllegalArgumentException("proposedBy no puede ser nulo o vacío");
        }
        if (proposedAt <= 0) {
            proposedAt = System.currentTimeMillis();
        }
    }
}
