package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.error.InvalidTargetException;
import com.rebenew.musicParty.queuesync.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateTest {

    private SessionState state;

    @BeforeEach
    void setUp() {
        state = new SessionState("s1", "host");
    }

    private TrackRecord add(String title, long durationMs) {
        return state.addTrack(new TrackMetadata("ref-" + title, title, "Artist", durationMs, null), "host");
    }

    @Test
    void hostIsRecognizedOnJoinAndOthersAreParticipants() {
        assertThat(state.addConnection("host")).isTrue();
        assertThat(state.addConnection("guest")).isTrue();

        assertThat(state.roleOf("host")).isEqualTo(MemberRole.HOST);
        assertThat(state.roleOf("guest")).isEqualTo(MemberRole.PARTICIPANT);
        assertThat(state.roleOf("stranger")).isNull();
        assertThat(state.getVersion()).isEqualTo(2);
    }

    @Test
    void memberStaysUntilLastConnectionCloses() {
        state.addConnection("guest");
        assertThat(state.addConnection("guest")).isFalse();
        long version = state.getVersion();

        assertThat(state.removeConnection("guest")).isFalse();
        assertThat(state.isMember("guest")).isTrue();
        assertThat(state.getVersion()).isEqualTo(version);

        assertThat(state.removeConnection("guest")).isTrue();
        assertThat(state.isEmpty()).isTrue();
    }

    @Test
    void advanceWithConsumedVersionIsNoOp() {
        state.addConnection("host");
        add("A", 0);
        add("B", 0);
        add("C", 0);
        state.addConnection("guest");
        assertThat(state.getVersion()).isEqualTo(5);

        AdvanceOutcome first = state.advance(5);
        assertThat(first.applied()).isTrue();
        assertThat(first.version()).isEqualTo(6);
        String current = state.getCurrentTrackId();
        assertThat(current).isEqualTo("t-1");

        AdvanceOutcome retry = state.advance(5);
        assertThat(retry.applied()).isFalse();
        assertThat(state.getVersion()).isEqualTo(6);
        assertThat(state.getCurrentTrackId()).isEqualTo(current);
    }

    @Test
    void votesBetweenObservationAndAdvanceDoNotMakeItStale() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        add("B", 0);
        long observed = state.getVersion();
        state.vote(a.id(), "host", VoteDirection.LIKE);

        assertThat(state.advance(observed).applied()).isTrue();
    }

    @Test
    void advanceFromTheFutureIsRejected() {
        state.addConnection("host");
        assertThatThrownBy(() -> state.advance(state.getVersion() + 1))
                .isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void advancePromotesTopRankedAndMarksPreviousPlayed() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        TrackRecord b = add("B", 0);
        state.advance(state.getVersion());
        state.vote(b.id(), "host", VoteDirection.LIKE);
        TrackRecord c = add("C", 0);

        AdvanceOutcome outcome = state.advance(state.getVersion());

        assertThat(outcome.previousTrackId()).isEqualTo(a.id());
        assertThat(outcome.currentTrackId()).isEqualTo(b.id());
        assertThat(state.track(a.id()).state()).isEqualTo(TrackState.PLAYED);
        assertThat(state.track(b.id()).state()).isEqualTo(TrackState.CURRENT);
        assertThat(state.track(c.id()).state()).isEqualTo(TrackState.QUEUED);
        assertThat(state.playHistory()).containsExactly(a.id(), b.id());
        assertThat(state.getTransport().playing()).isFalse();
        assertThat(state.getTransport().positionMs()).isZero();
    }

    @Test
    void advanceOnEmptyQueueGoesIdle() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        state.advance(state.getVersion());

        AdvanceOutcome outcome = state.advance(state.getVersion());

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.currentTrackId()).isNull();
        assertThat(state.getCurrentTrackId()).isNull();
        assertThat(state.track(a.id()).state()).isEqualTo(TrackState.PLAYED);
    }

    @Test
    void removingCurrentPromotesNextRanked() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        TrackRecord b = add("B", 0);
        state.advance(state.getVersion());
        long before = state.getVersion();

        TrackRecord removed = state.removeTrack(a.id());
        AdvanceOutcome outcome = state.promoteAfterRemoval();

        assertThat(removed.state()).isEqualTo(TrackState.REMOVED);
        assertThat(outcome.currentTrackId()).isEqualTo(b.id());
        assertThat(state.getVersion()).isEqualTo(before + 2);
        assertThat(state.rankedTracks()).extracting(TrackView::id).containsExactly(b.id());
        // el historial no se reescribe; el ranking filtra los eliminados
        assertThat(state.playHistory()).containsExactly(a.id(), b.id());
        state.verifyInvariants();
    }

    @Test
    void advanceWhileIdleWithEmptyQueueChangesNothing() {
        state.addConnection("host");
        long before = state.getVersion();

        AdvanceOutcome outcome = state.advance(before);

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.currentTrackId()).isNull();
        assertThat(state.getVersion()).isEqualTo(before);

        // con algo en cola el avance sí se aplica
        TrackRecord a = add("A", 0);
        assertThat(state.advance(state.getVersion()).currentTrackId()).isEqualTo(a.id());
    }

    @Test
    void noVotesOnCurrentOrPlayedTracks() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        add("B", 0);
        state.advance(state.getVersion());

        assertThatThrownBy(() -> state.vote(a.id(), "host", VoteDirection.LIKE))
                .isInstanceOf(InvalidTargetException.class);

        state.advance(state.getVersion());
        assertThat(state.track(a.id()).state()).isEqualTo(TrackState.PLAYED);
        assertThatThrownBy(() -> state.vote(a.id(), "host", VoteDirection.DISLIKE))
                .isInstanceOf(InvalidTargetException.class);
        assertThatThrownBy(() -> state.clearVote(a.id(), "host"))
                .isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void playedTracksCannotBeRemoved() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        state.advance(state.getVersion());
        state.advance(state.getVersion());

        assertThatThrownBy(() -> state.removeTrack(a.id())).isInstanceOf(InvalidTargetException.class);
        assertThatThrownBy(() -> state.removeTrack("t-99")).isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void removedTrackVotesAreDiscarded() {
        state.addConnection("host");
        TrackRecord a = add("A", 0);
        state.vote(a.id(), "host", VoteDirection.LIKE);

        state.removeTrack(a.id());

        assertThat(state.rankedTracks()).isEmpty();
        assertThatThrownBy(() -> state.vote(a.id(), "host", VoteDirection.LIKE))
                .isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void setPlaybackValidatesPositionAgainstDuration() {
        state.addConnection("host");
        assertThatThrownBy(() -> state.setPlayback(true, 0L)).isInstanceOf(InvalidTargetException.class);

        add("A", 60_000L);
        state.advance(state.getVersion());

        Transport t = state.setPlayback(true, 30_000L);
        assertThat(t.playing()).isTrue();
        assertThat(t.positionMs()).isEqualTo(30_000L);

        assertThatThrownBy(() -> state.setPlayback(true, 60_001L)).isInstanceOf(InvalidTargetException.class);
        assertThatThrownBy(() -> state.setPlayback(false, -1L)).isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void suggestionsBecomeQueuedWithFreshSequenceOnApproval() {
        state.addConnection("host");
        state.addConnection("guest");
        Suggestion s = state.propose(new TrackMetadata("ref-S", "S", "Artist", 0, null), "guest");
        TrackRecord direct = add("D", 0);

        TrackRecord approved = state.approve(s.id());

        assertThat(approved.addedBy()).isEqualTo("guest");
        assertThat(approved.enqueuedSeq()).isGreaterThan(direct.enqueuedSeq());
        assertThat(state.snapshot().pendingSuggestions()).isEmpty();
        assertThatThrownBy(() -> state.approve(s.id())).isInstanceOf(InvalidTargetException.class);
    }

    @Test
    void snapshotForParticipantHidesPendingSuggestions() {
        state.addConnection("host");
        state.addConnection("guest");
        state.propose(new TrackMetadata("ref-S", "S", null, 0, null), "guest");

        SessionSnapshot full = state.snapshot();

        assertThat(full.forRole(MemberRole.HOST).pendingSuggestions()).hasSize(1);
        assertThat(full.forRole(MemberRole.DELEGATE).pendingSuggestions()).hasSize(1);
        assertThat(full.forRole(MemberRole.PARTICIPANT).pendingSuggestions()).isNull();
    }

    @Test
    void hostRoleCannotBeChanged() {
        state.addConnection("host");
        state.addConnection("guest");

        assertThat(state.setRole("guest", MemberRole.DELEGATE).role()).isEqualTo(MemberRole.DELEGATE);
        assertThatThrownBy(() -> state.setRole("host", MemberRole.PARTICIPANT))
                .isInstanceOf(InvalidTargetException.class);
        assertThatThrownBy(() -> state.setRole("nobody", MemberRole.DELEGATE))
                .isInstanceOf(InvalidTargetException.class);
    }
}
