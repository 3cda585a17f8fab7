package com.rebenew.musicParty.queuesync.controller;

import com.rebenew.musicParty.queuesync.core.SessionRegistry;
import com.rebenew.musicParty.queuesync.model.CreateSessionRequest;
import com.rebenew.musicParty.queuesync.model.MemberRole;
import com.rebenew.musicParty.queuesync.model.SessionSnapshot;
import com.rebenew.musicParty.queuesync.model.TrackView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lectura de sesiones y reclamo de host.
 * Las mutaciones van siempre por WebSocket ({@code /ws/music-sync}).
 *
 * Flujo principal:
 * 1. Host reclama sesión → 2. Comparte sessionId → 3. Miembros se unen vía WebSocket
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {
    private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

    private final SessionRegistry registry;

    public SessionController(SessionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Reclama una sesión para un host y la crea vacía.
     *
     * @param request {"hostId": "host1", "sessionId": "opcional"}
     * @return {"sessionId": "...", "hostId": "..."}
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> create(@RequestBody CreateSessionRequest request) {
        String hostId = request.getHostId();
        logger.info("📝 Solicitud de sesión para host: {}", hostId);

        if (hostId == null || hostId.trim().isEmpty()) {
            logger.warn("❌ Intento de crear sesión sin hostId");
            return ResponseEntity.badRequest().body(Map.of("error", "missing_hostId"));
        }

        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId().trim()
                : UUID.randomUUID().toString().substring(0, 8);

        // sin uniones dentro del periodo de gracia el reclamo se libera
        String owner = registry.open(sessionId, hostId);
        if (!owner.equals(hostId)) {
            logger.warn("⚠️ Sesión {} ya reclamada por {}", sessionId, owner);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "session_already_claimed"));
        }

        logger.info("✅ Sesión {} reclamada por host {}", sessionId, hostId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("sessionId", sessionId, "hostId", hostId));
    }

    /**
     * Snapshot de la sesión con la vista de participante (sin sugerencias pendientes).
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionSnapshot> getSession(@PathVariable String sessionId) {
        logger.debug("🔍 Consultando sesión: {}", sessionId);
        SessionSnapshot snapshot = registry.snapshot(sessionId)
                .forRole(MemberRole.PARTICIPANT)
                .at(System.currentTimeMillis());
        return ResponseEntity.ok(snapshot);
    }

    // Historial + cola ordenada por votos
    @GetMapping("/{sessionId}/queue")
    public ResponseEntity<List<TrackView>> getQueue(@PathVariable String sessionId) {
        return ResponseEntity.ok(registry.snapshot(sessionId).tracks());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(registry.getServiceStats());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>(registry.getHealthStats());
        healthInfo.put("service", "music-party-queue-sync");
        healthInfo.put("version", "1.0.0");
        return ResponseEntity.ok(healthInfo);
    }
}
