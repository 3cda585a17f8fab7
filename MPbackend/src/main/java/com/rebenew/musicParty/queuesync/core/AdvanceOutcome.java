package com.rebenew.musicParty.queuesync.core;

/**
 * Resultado de un avance de cola.
 *
 * @param applied false si fue un no-op: reenvío ya consumido o sesión idle sin cola
 * @param previousTrackId el track que dejó de sonar, o null
 * @param currentTrackId el nuevo current, o null si la cola quedó vacía
 */
public record AdvanceOutcome(boolean applied, long version, String previousTrackId, String currentTrackId) {

    public static AdvanceOutcome stale(long version, String currentTrackId) {
        return new AdvanceOutcome(false, version, null, currentTrackId);
    }
}
