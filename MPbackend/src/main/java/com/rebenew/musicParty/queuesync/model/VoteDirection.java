package com.rebenew.musicParty.queuesync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VoteDirection {
    LIKE,
    DISLIKE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Acepta también los nombres antiguos de los clientes web ("upvote"/"downvote").
     */
    @JsonCreator
    public static VoteDirection fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("direction no puede ser nulo");
        }
        switch (value.trim().toLowerCase()) {
            case "like":
            case "upvote":
                return LIKE;
            case "dislike":
            case "downvote":
                return DISLIKE;
            default:
                throw new IllegalArgumentException("direction desconocida: " + value);
        }
    }
}
