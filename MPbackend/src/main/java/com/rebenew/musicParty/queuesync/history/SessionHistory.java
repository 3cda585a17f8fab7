package com.rebenew.musicParty.queuesync.history;

import com.rebenew.musicParty.queuesync.model.TrackView;

import java.util.List;

/**
 * Lo que queda de una sesión al desmontarla: los tracks en el orden en que sonaron.
 */
public record SessionHistory(
        String sessionId,
        String hostId,
        List<TrackView> played,
        long startedAt,
        long endedAt,
        String reason
) {
    public SessionHistory {
        played = List.copyOf(played);
    }
}
