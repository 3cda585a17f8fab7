package com.rebenew.musicParty.queuesync.catalog;

import com.rebenew.musicParty.queuesync.model.TrackMetadata;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Sin catálogo: siempre se usan los datos que manda el cliente.
 */
@Component
@ConditionalOnProperty(prefix = "musicparty.catalog", name = "provider", havingValue = "offline", matchIfMissing = true)
public class OfflineTrackCatalog implements TrackCatalog {

    @Override
    public Optional<TrackMetadata> lookup(String sourceRef) {
        return Optional.empty();
    }
}
