package com.rebenew.musicParty.queuesync.model;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class CreateSessionRequest {
    private String hostId;
    // Opcional: si falta se genera uno
    private String sessionId;

    public CreateSessionRequest() {}

    public CreateSessionRequest(String hostId, String sessionId) {
        this.hostId = hostId;
        this.sessionId = sessionId;
    }
}
