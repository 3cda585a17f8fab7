package com.rebenew.musicParty.queuesync.model;

/**
 * Eventos difundidos a todos los miembros de una sesión.
 */
public enum EventType {
    TRACK_ADDED("track-added"),
    TRACK_REMOVED("track-removed"),
    VOTE_UPDATED("vote-updated"),
    NOW_PLAYING("now-playing"),
    PLAYBACK_STATE_CHANGED("playback-state-changed"),
    MEMBER_JOINED("member-joined"),
    MEMBER_LEFT("member-left"),
    SUGGESTION_ADDED("suggestion-added"),
    SUGGESTION_REJECTED("suggestion-rejected"),
    DELEGATE_CHANGED("delegate-changed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
