package com.rebenew.musicParty.queuesync.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.rebenew.musicParty.queuesync.history.SessionHistory;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Eventos de ciclo de vida de las sesiones, publicados por el registro.
 */
public class SessionLifecycleSystem {

    public enum Action {
        CREATED,        // primera unión a una sesión nueva
        EMPTIED,        // el último miembro se fue, teardown armado
        RESUMED,        // alguien volvió durante el periodo de gracia
        TORN_DOWN,      // desmontada tras el periodo de gracia
        FAILED          // desmontada por violación de invariante
    }

    @Getter
    public static class Event extends ApplicationEvent {
        private final String sessionId;
        private final Action action;
        private final SessionHistory history; // solo en TORN_DOWN / FAILED

        public Event(Object source, String sessionId, Action action) {
            this(source, sessionId, action, null);
        }

        public Event(Object source, String sessionId, Action action, SessionHistory history) {
            super(source);
            this.sessionId = sessionId;
            this.action = action;
            this.history = history;
        }

        @JsonProperty("timestamp")
        public long getEventTimestamp() {
            return super.getTimestamp();
        }

        public static Event created(Object source, String sessionId) {
            return new Event(source, sessionId, Action.CREATED);
        }

        public static Event emptied(Object source, String sessionId) {
            return new Event(source, sessionId, Action.EMPTIED);
        }

        public static Event resumed(Object source, String sessionId) {
            return new Event(source, sessionId, Action.RESUMED);
        }

        public static Event tornDown(Object source, SessionHistory history) {
            return new Event(source, history.sessionId(), Action.TORN_DOWN, history);
        }

        public static Event failed(Object source, SessionHistory history) {
            return new Event(source, history.sessionId(), Action.FAILED, history);
        }

        public boolean isEnd() {
            return action == Action.TORN_DOWN || action == Action.FAILED;
        }

        @Override
        public String toString() {
            return "SessionLifecycleEvent{" +
                    "sessionId='" + sessionId + '\'' +
                    ", action=" + action +
                    ", timestamp=" + super.getTimestamp() +
                    '}';
        }
    }
}
