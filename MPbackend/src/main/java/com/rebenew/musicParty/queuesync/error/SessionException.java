package com.rebenew.musicParty.queuesync.error;

/**
 * Base de los rechazos de comandos. Se reportan solo al emisor, nunca se difunden.
 */
public abstract class SessionException extends RuntimeException {
    private final ErrorCode code;

    protected SessionException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
