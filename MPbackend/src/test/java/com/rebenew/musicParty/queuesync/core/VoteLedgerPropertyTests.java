package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.model.Tally;
import com.rebenew.musicParty.queuesync.model.VoteDirection;
import net.jqwik.api.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VoteLedgerPropertyTests {

    record Cast(String memberId, VoteDirection direction, boolean clear) {}

    @Provide
    Arbitrary<List<Cast>> casts() {
        Arbitrary<String> members = Arbitraries.of("ana", "beto", "carla", "dani");
        Arbitrary<VoteDirection> directions = Arbitraries.of(VoteDirection.class);
        Arbitrary<Boolean> clears = Arbitraries.of(true, false, false, false);
        return Combinators.combine(members, directions, clears).as(Cast::new).list().ofMaxSize(40);
    }

    @Property
    void lastVotePerMemberWins(@ForAll("casts") List<Cast> casts) {
        VoteLedger ledger = new VoteLedger();
        Map<String, VoteDirection> expected = new HashMap<>();

        for (Cast c : casts) {
            if (c.clear()) {
                ledger.clear("t-1", c.memberId());
                expected.remove(c.memberId());
            } else {
                ledger.cast("t-1", c.memberId(), c.direction());
                expected.put(c.memberId(), c.direction());
            }
        }

        Tally tally = ledger.tally("t-1");
        long likes = expected.values().stream().filter(d -> d == VoteDirection.LIKE).count();
        assertThat(tally.likes()).isEqualTo((int) likes);
        assertThat(tally.dislikes()).isEqualTo(expected.size() - (int) likes);
        // nunca más de un voto por miembro
        assertThat(tally.likes() + tally.dislikes()).isLessThanOrEqualTo(4);
        expected.forEach((member, direction) -> assertThat(ledger.voteOf("t-1", member)).isEqualTo(direction));
    }

    @Example
    void discardDropsAllVotesOfTrack() {
        VoteLedger ledger = new VoteLedger();
        ledger.cast("t-1", "ana", VoteDirection.LIKE);
        ledger.cast("t-1", "beto", VoteDirection.DISLIKE);
        ledger.cast("t-2", "ana", VoteDirection.LIKE);

        ledger.discard("t-1");

        assertThat(ledger.tally("t-1")).isEqualTo(Tally.empty("t-1"));
        assertThat(ledger.tally("t-2").likes()).isEqualTo(1);
    }

    @Example
    void sameDirectionTwiceCountsOnce() {
        VoteLedger ledger = new VoteLedger();
        ledger.cast("t-1", "ana", VoteDirection.LIKE);
        Tally tally = ledger.cast("t-1", "ana", VoteDirection.LIKE);

        assertThat(tally).isEqualTo(new Tally("t-1", 1, 0));
    }
}
