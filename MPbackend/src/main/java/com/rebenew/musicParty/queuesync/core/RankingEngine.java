package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.model.Tally;
import com.rebenew.musicParty.queuesync.model.TrackRecord;
import com.rebenew.musicParty.queuesync.model.TrackState;
import com.rebenew.musicParty.queuesync.model.TrackView;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Orden visible de la cola: historial de reproducción tal cual, seguido de los
 * tracks en cola ordenados por puntuación (likes - dislikes) descendente y, a
 * igual puntuación, por orden de llegada.
 * Función pura: mismas entradas, mismo resultado.
 */
public final class RankingEngine {

    static final Comparator<TrackView> QUEUE_ORDER = Comparator
            .comparingInt(TrackView::score).reversed()
            .thenComparingLong(TrackView::enqueuedSeq);

    private RankingEngine() {}

    public static List<TrackView> rank(List<TrackRecord> history,
                                       Collection<TrackRecord> candidates,
                                       Function<String, Tally> tallies) {
        List<TrackView> result = new ArrayList<>(history.size() + candidates.size());
        for (TrackRecord t : history) {
            if (t.state() != TrackState.REMOVED) {
                result.add(TrackView.of(t, tallies.apply(t.id())));
            }
        }
        result.addAll(rankQueue(candidates, tallies));
        return result;
    }

    /**
     * Solo la parte en cola. El primer elemento es el siguiente en sonar.
     */
    public static List<TrackView> rankQueue(Collection<TrackRecord> candidates, Function<String, Tally> tallies) {
        List<TrackView> queue = new ArrayList<>();
        for (TrackRecord t : candidates) {
            if (t.state() == TrackState.QUEUED) {
                queue.add(TrackView.of(t, tallies.apply(t.id())));
            }
        }
        queue.sort(QUEUE_ORDER);
        return queue;
    }
}
