package com.rebenew.musicParty.queuesync.catalog;

import com.rebenew.musicParty.queuesync.model.TrackMetadata;

import java.util.Optional;

/**
 * Resolución de metadatos {@code sourceRef → título/artista/duración/carátula}.
 * Puede hacer I/O de red: nunca se invoca con el lock de una sesión tomado.
 */
public interface TrackCatalog {

    Optional<TrackMetadata> lookup(String sourceRef);
}
