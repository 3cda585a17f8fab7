package com.rebenew.musicParty.queuesync.model;

/**
 * Recuento vivo de votos de un track. Se difunde completo (nunca como delta).
 */
public record Tally(String trackId, int likes, int dislikes) {

    public static Tally empty(String trackId) {
        return new Tally(trackId, 0, 0);
    }

    public int score() {
        return likes - dislikes;
    }
}
