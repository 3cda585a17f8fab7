package com.rebenew.musicParty.queuesync.error;

/**
 * Códigos de error que viajan al cliente en los frames {@code error} y en las respuestas REST.
 */
public enum ErrorCode {
    NOT_AUTHORIZED("not_authorized"),
    INVALID_TARGET("invalid_target"),
    SESSION_NOT_FOUND("session_not_found"),
    BAD_REQUEST("bad_request"),
    INTERNAL_ERROR("internal_error");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
