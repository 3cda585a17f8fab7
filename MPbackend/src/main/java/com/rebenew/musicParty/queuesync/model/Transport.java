package com.rebenew.musicParty.queuesync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estado de transporte de la sesión: reproduciendo/pausado y la posición
 * registrada en {@code updatedAtMs}. En JSON usa los mismos nombres que
 * {@code playback-state-changed}: {@code isPlaying}, {@code positionMs}, {@code updatedAt}.
 */
public record Transport(
        @JsonProperty("isPlaying") boolean playing,
        long positionMs,
        @JsonProperty("updatedAt") long updatedAtMs
) {

    public static Transport pausedAtStart(long now) {
        return new Transport(false, 0L, now);
    }

    /**
     * Posición extrapolada a {@code now}. Con duración conocida nunca pasa del final.
     */
    public long positionAt(long now, long durationMs) {
        if (!playing) {
            return positionMs;
        }
        long elapsed = Math.max(0L, now - updatedAtMs);
        long position = positionMs + elapsed;
        return durationMs > 0 ? Math.min(position, durationMs) : position;
    }

    public Transport extrapolatedTo(long now, long durationMs) {
        return new Transport(playing, positionAt(now, durationMs), now);
    }
}
