package com.rebenew.musicParty.queuesync.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberRole {
    HOST,        // dueño de la sesión
    DELEGATE,    // controla el transporte por delegación del host
    PARTICIPANT; // vota y propone

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean canControl() {
        return this == HOST || this == DELEGATE;
    }
}
