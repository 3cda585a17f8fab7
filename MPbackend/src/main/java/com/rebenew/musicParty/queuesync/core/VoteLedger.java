package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.model.Tally;
import com.rebenew.musicParty.queuesync.model.VoteDirection;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registro de votos (trackId, memberId) → dirección.
 * Un miembro tiene como máximo un voto vivo por track: el último reemplaza al anterior.
 * No es thread-safe; se accede siempre bajo el lock de la sesión.
 */
public class VoteLedger {
    private final Map<String, Map<String, VoteDirection>> votes = new HashMap<>();

    public Tally cast(String trackId, String memberId, VoteDirection direction) {
        if (direction == null) {
            throw new IllegalArgumentException("direction no puede ser nulo");
        }
        votes.computeIfAbsent(trackId, k -> new LinkedHashMap<>()).put(memberId, direction);
        return tally(trackId);
    }

    public Tally clear(String trackId, String memberId) {
        Map<String, VoteDirection> byMember = votes.get(trackId);
        if (byMember != null) {
            byMember.remove(memberId);
            if (byMember.isEmpty()) {
                votes.remove(trackId);
            }
        }
        return tally(trackId);
    }

    public Tally tally(String trackId) {
        Map<String, VoteDirection> byMember = votes.get(trackId);
        if (byMember == null) {
            return Tally.empty(trackId);
        }
        int likes = 0;
        int dislikes = 0;
        for (VoteDirection d : byMember.values()) {
            if (d == VoteDirection.LIKE) {
                likes++;
            } else {
                dislikes++;
            }
        }
        return new Tally(trackId, likes, dislikes);
    }

    public VoteDirection voteOf(String trackId, String memberId) {
        Map<String, VoteDirection> byMember = votes.get(trackId);
        return byMember == null ? null : byMember.get(memberId);
    }

    // Se llama al eliminar un track: sus votos desaparecen con él
    public void discard(String trackId) {
        votes.remove(trackId);
    }
}
