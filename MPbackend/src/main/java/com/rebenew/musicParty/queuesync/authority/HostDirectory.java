package com.rebenew.musicParty.queuesync.authority;

import java.util.Optional;

/**
 * Quién es el host de cada sesión. La identidad real vive fuera de este servidor;
 * aquí solo se consulta.
 */
public interface HostDirectory {

    /**
     * Reclama la sesión para {@code memberId} si nadie la tiene.
     *
     * @return el host efectivo (el existente o el nuevo)
     */
    String claim(String sessionId, String memberId);

    Optional<String> hostOf(String sessionId);

    default boolean isHost(String sessionId, String memberId) {
        return memberId != null && hostOf(sessionId).map(memberId::equals).orElse(false);
    }

    void release(String sessionId);
}
