package com.rebenew.musicParty.queuesync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ajustes de sesión bajo {@code musicparty.session.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "musicparty.session")
public class SessionProperties {
    // Tiempo que una sesión vacía sobrevive antes de desmontarse
    private Duration teardownGrace = Duration.ofSeconds(30);
    // Avanzar solo al terminar el track (si se conoce su duración)
    private boolean autoAdvance = true;
    // Conexiones sin actividad se cierran tras este tiempo
    private Duration clientIdleTimeout = Duration.ofMinutes(5);
    private Duration sweepInterval = Duration.ofSeconds(60);
    // Límites de ConcurrentWebSocketSessionDecorator por conexión
    private int sendTimeLimitMs = 10_000;
    private int sendBufferSizeLimit = 512 * 1024;
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
