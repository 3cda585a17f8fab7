package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.model.*;
import net.jqwik.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Propiedades del orden de la cola sobre entradas aleatorias.
 */
class RankingPropertyTests {

    record Input(List<TrackRecord> tracks, Map<String, Tally> tallies) {}

    @Provide
    Arbitrary<Input> inputs() {
        Arbitrary<Integer> likes = Arbitraries.integers().between(0, 5);
        Arbitrary<Integer> dislikes = Arbitraries.integers().between(0, 5);
        return Combinators.combine(likes, dislikes).as((l, d) -> l - d)
                .list().ofMinSize(0).ofMaxSize(25)
                .map(scores -> {
                    List<TrackRecord> tracks = new ArrayList<>();
                    Map<String, Tally> tallies = new HashMap<>();
                    for (int i = 0; i < scores.size(); i++) {
                        String id = "t-" + (i + 1);
                        tracks.add(new TrackRecord(id, "ref" + i, "T" + i, "A", 0L, null, "m", i + 1, 1L,
                                TrackState.QUEUED));
                        int score = scores.get(i);
                        tallies.put(id, score >= 0 ? new Tally(id, score, 0) : new Tally(id, 0, -score));
                    }
                    return new Input(tracks, tallies);
                });
    }

    @Property
    void rankingIsDeterministicAndIgnoresInputOrder(@ForAll("inputs") Input input, @ForAll Random random) {
        List<TrackView> first = RankingEngine.rankQueue(input.tracks(), input.tallies()::get);

        List<TrackRecord> shuffled = new ArrayList<>(input.tracks());
        Collections.shuffle(shuffled, random);
        List<TrackView> second = RankingEngine.rankQueue(shuffled, input.tallies()::get);

        assertThat(second).isEqualTo(first);
    }

    @Property
    void queueIsSortedByScoreThenArrival(@ForAll("inputs") Input input) {
        List<TrackView> ranked = RankingEngine.rankQueue(input.tracks(), input.tallies()::get);

        assertThat(ranked).hasSameSizeAs(input.tracks());
        for (int i = 1; i < ranked.size(); i++) {
            TrackView prev = ranked.get(i - 1);
            TrackView next = ranked.get(i);
            assertThat(prev.score()).isGreaterThanOrEqualTo(next.score());
            if (prev.score() == next.score()) {
                assertThat(prev.enqueuedSeq()).isLessThan(next.enqueuedSeq());
            }
        }
    }
}
