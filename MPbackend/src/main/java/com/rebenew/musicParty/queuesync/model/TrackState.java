package com.rebenew.musicParty.queuesync.model;

import com.fasterxml.jackson.annotation.JsonValue;

// Ciclo de vida de un track dentro de la cola de una sesión.
public enum TrackState {
    QUEUED,   // en cola, votable
    CURRENT,  // sonando ahora, ya no votable
    PLAYED,   // reemplazado por el siguiente current
    REMOVED;  // eliminado explícitamente

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isVotable() {
        return this == QUEUED;
    }

    public boolean isRemovable() {
        return this == QUEUED || this == CURRENT;
    }
}
