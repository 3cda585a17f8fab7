package com.rebenew.musicParty.queuesync.error;

public class SessionNotFoundException extends SessionException {
    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Sesión no encontrada: " + sessionId);
    }
}
