package com.rebenew.musicParty.queuesync.catalog;

import com.rebenew.musicParty.queuesync.config.CatalogProperties;
import com.rebenew.musicParty.queuesync.model.TrackMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DeezerTrackCatalogTest {

    private MockRestServiceServer server;
    private DeezerTrackCatalog catalog;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        CatalogProperties properties = new CatalogProperties();
        properties.setBaseUrl("https://api.deezer.test/");
        catalog = new DeezerTrackCatalog(restTemplate, properties);
    }

    @Test
    void mapsDeezerTrackToMetadata() {
        server.expect(requestTo("https://api.deezer.test/track/3135556"))
                .andExpect(method(org.springframework.http.HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"id":3135556,"title":"Harder, Better, Faster, Stronger","duration":224,
                         "artist":{"name":"Daft Punk"},
                         "album":{"cover_medium":"https://cdn.test/cover.jpg"}}
                        """, MediaType.APPLICATION_JSON));

        Optional<TrackMetadata> found = catalog.lookup("deezer:3135556");

        assertThat(found).isPresent();
        TrackMetadata m = found.get();
        assertThat(m.sourceRef()).isEqualTo("deezer:3135556");
        assertThat(m.title()).isEqualTo("Harder, Better, Faster, Stronger");
        assertThat(m.artist()).isEqualTo("Daft Punk");
        assertThat(m.durationMs()).isEqualTo(224_000L);
        assertThat(m.artworkUrl()).isEqualTo("https://cdn.test/cover.jpg");
        server.verify();
    }

    @Test
    void errorPayloadMeansNotFound() {
        server.expect(requestTo("https://api.deezer.test/track/1"))
                .andRespond(withSuccess("{\"error\":{\"type\":\"DataException\",\"message\":\"no data\",\"code\":800}}",
                        MediaType.APPLICATION_JSON));

        assertThat(catalog.lookup("1")).isEmpty();
    }

    @Test
    void serverFailureFallsBackToEmpty() {
        server.expect(requestTo("https://api.deezer.test/track/2"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThat(catalog.lookup("deezer:2")).isEmpty();
    }

    @Test
    void nonDeezerReferencesAreNotLookedUp() {
        assertThat(catalog.lookup("spotify:track:abc")).isEmpty();
        assertThat(DeezerTrackCatalog.toDeezerId("DEEZER:42")).isEqualTo("42");
        assertThat(DeezerTrackCatalog.toDeezerId("")).isNull();
        server.verify();
    }
}
