package com.rebenew.musicParty.queuesync.history;

import com.rebenew.musicParty.queuesync.service.SessionLifecycleSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Entrega el historial de cada sesión desmontada al {@link SessionHistoryStore}.
 */
@Component
public class SessionHistoryRecorder {
    private static final Logger logger = LoggerFactory.getLogger(SessionHistoryRecorder.class);

    private final SessionHistoryStore store;

    public SessionHistoryRecorder(SessionHistoryStore store) {
        this.store = store;
    }

    @EventListener
    public void onLifecycle(SessionLifecycleSystem.Event event) {
        if (!event.isEnd() || event.getHistory() == null) {
            return;
        }
        try {
            store.save(event.getHistory());
        } catch (RuntimeException e) {
            logger.error("❌ No se pudo guardar el historial de la sesión {}: {}",
                    event.getSessionId(), e.getMessage(), e);
        }
    }
}
