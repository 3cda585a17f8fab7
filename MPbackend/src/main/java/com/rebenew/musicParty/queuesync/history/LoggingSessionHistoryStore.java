package com.rebenew.musicParty.queuesync.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sin almacenamiento durable: deja un resumen de la sesión en el log.
 */
@Component
public class LoggingSessionHistoryStore implements SessionHistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(LoggingSessionHistoryStore.class);

    @Override
    public void save(SessionHistory history) {
        long minutes = Math.max(0L, history.endedAt() - history.startedAt()) / 60_000L;
        logger.info("📼 Historial de sesión {} (host {}, {}): {} tracks en {} min",
                history.sessionId(), history.hostId(), history.reason(), history.played().size(), minutes);
        if (logger.isDebugEnabled()) {
            history.played().forEach(t -> logger.debug("   {} - {} ({} likes / {} dislikes)",
                    t.artist(), t.title(), t.likes(), t.dislikes()));
        }
    }
}
