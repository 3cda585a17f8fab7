package com.rebenew.musicParty.queuesync.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.musicParty.queuesync.config.CatalogProperties;
import com.rebenew.musicParty.queuesync.model.TrackMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Catálogo sobre la API pública de Deezer ({@code GET /track/{id}}).
 * Acepta referencias {@code deezer:123} o el id numérico sin prefijo.
 */
@Component
@ConditionalOnProperty(prefix = "musicparty.catalog", name = "provider", havingValue = "deezer")
public class DeezerTrackCatalog implements TrackCatalog {
    private static final Logger logger = LoggerFactory.getLogger(DeezerTrackCatalog.class);
    private static final String PREFIX = "deezer:";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public DeezerTrackCatalog(RestTemplate catalogRestTemplate, CatalogProperties properties) {
        this.restTemplate = catalogRestTemplate;
        String url = properties.getBaseUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public Optional<TrackMetadata> lookup(String sourceRef) {
        String trackId = toDeezerId(sourceRef);
        if (trackId == null) {
            logger.debug("Referencia no reconocida por Deezer: {}", sourceRef);
            return Optional.empty();
        }

        JsonNode body;
        try {
            body = restTemplate.getForObject(baseUrl + "/track/{id}", JsonNode.class, trackId);
        } catch (RestClientException e) {
            logger.warn("⚠️ Catálogo Deezer no disponible para {}: {}", sourceRef, e.getMessage());
            return Optional.empty();
        }

        // Deezer responde 200 con {"error": {...}} cuando el track no existe
        if (body == null || body.has("error") || !body.hasNonNull("id")) {
            logger.debug("Track {} no encontrado en Deezer", trackId);
            return Optional.empty();
        }

        String title = body.path("title").asText(null);
        String artist = body.path("artist").path("name").asText(null);
        long durationMs = body.path("duration").asLong(0L) * 1000L;
        String artwork = body.path("album").path("cover_medium").asText(null);
        return Optional.of(new TrackMetadata(sourceRef, title, artist, durationMs, artwork));
    }

    static String toDeezerId(String sourceRef) {
        if (sourceRef == null) {
            return null;
        }
        String ref = sourceRef.trim();
        if (ref.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            ref = ref.substring(PREFIX.length());
        }
        if (ref.isEmpty() || !ref.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return ref;
    }
}
