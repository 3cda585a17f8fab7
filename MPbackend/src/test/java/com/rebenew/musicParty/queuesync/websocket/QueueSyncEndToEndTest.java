package com.rebenew.musicParty.queuesync.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Dos clientes reales contra {@code /ws/music-sync}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "musicparty.session.auto-advance=false",
        "musicparty.session.teardown-grace=200ms"
})
class QueueSyncEndToEndTest {

    private static final String SESSION = "e2e-party";

    @LocalServerPort
    private int port;

    @Autowired
    private ObjectMapper objectMapper;

    private final List<Client> clients = new ArrayList<>();

    @AfterEach
    void closeClients() throws Exception {
        for (Client client : clients) {
            if (client.session.isOpen()) {
                client.session.close();
            }
        }
    }

    @Test
    void hostAndGuestShareQueueVotesAndAdvance() throws Exception {
        Client host = connect();
        host.send("session", "join", "host", "c1", Map.of());
        JsonNode hostSnapshot = host.await(m -> "snapshot".equals(m.path("type").asText()));
        assertThat(hostSnapshot.path("correlationId").asText()).isEqualTo("c1");
        assertThat(hostSnapshot.path("data").path("hostId").asText()).isEqualTo("host");

        Client guest = connect();
        guest.send("session", "join", "guest", "g1", Map.of());
        guest.await(m -> "snapshot".equals(m.path("type").asText()));
        JsonNode joined = host.await(event("member-joined"));
        assertThat(joined.path("data").path("memberId").asText()).isEqualTo("guest");

        host.send("queue", "add", "host", "c2", Map.of("sourceRef", "local:a", "title", "A"));
        JsonNode added = host.await(ack("c2"));
        String trackA = added.path("data").path("trackId").asText();
        host.send("queue", "add", "host", "c3", Map.of("sourceRef", "local:b", "title", "B"));
        String trackB = host.await(ack("c3")).path("data").path("trackId").asText();

        guest.await(m -> isEvent(m, "track-added")
                && trackB.equals(m.path("data").path("track").path("id").asText()));

        guest.send("queue", "vote", "guest", "g2", Map.of("trackId", trackB, "direction", "like"));
        JsonNode voted = guest.await(ack("g2"));
        assertThat(voted.path("data").path("likes").asInt()).isEqualTo(1);
        JsonNode tally = host.await(event("vote-updated"));
        assertThat(tally.path("data").path("trackId").asText()).isEqualTo(trackB);
        long observed = tally.path("version").asLong();

        // el participante no puede avanzar
        guest.send("playback", "advance", "guest", "g3", Map.of("observedVersion", observed));
        JsonNode denied = guest.await(m -> "error".equals(m.path("type").asText())
                && "g3".equals(m.path("correlationId").asText()));
        assertThat(denied.path("data").path("code").asText()).isEqualTo("not_authorized");

        host.send("playback", "advance", "host", "c4", Map.of("observedVersion", observed));
        JsonNode advanced = host.await(ack("c4"));
        assertThat(advanced.path("data").path("reason").asText()).isEqualTo("advanced");
        assertThat(advanced.path("data").path("currentTrackId").asText()).isEqualTo(trackB);

        JsonNode nowPlaying = guest.await(event("now-playing"));
        assertThat(nowPlaying.path("data").path("trackId").asText()).isEqualTo(trackB);

        // reintento con la misma versión observada
        host.send("playback", "advance", "host", "c5", Map.of("observedVersion", observed));
        JsonNode stale = host.await(ack("c5"));
        assertThat(stale.path("data").path("reason").asText()).isEqualTo("stale_version");
        assertThat(stale.path("data").path("applied").asBoolean()).isFalse();

        guest.send("session", "sync", "guest", "g4", Map.of());
        JsonNode synced = guest.await(m -> "snapshot".equals(m.path("type").asText())
                && "g4".equals(m.path("correlationId").asText()));
        assertThat(synced.path("data").path("currentTrackId").asText()).isEqualTo(trackB);
        assertThat(synced.path("data").path("tracks").get(1).path("id").asText()).isEqualTo(trackA);
    }

    @Test
    void commandsBeforeJoinAreRejected() throws Exception {
        Client stranger = connect();
        stranger.send("queue", "add", "nobody", "x1", Map.of("sourceRef", "local:x", "title", "X"));
        JsonNode error = stranger.await(m -> "error".equals(m.path("type").asText()));
        assertThat(error.path("correlationId").asText()).isEqualTo("x1");
        assertThat(error.path("data").path("code").asText()).isEqualTo("not_authorized");
    }

    // ==================== UTILIDADES ====================

    private static Predicate<JsonNode> ack(String correlationId) {
        return m -> "ack".equals(m.path("type").asText()) && correlationId.equals(m.path("correlationId").asText());
    }

    private static Predicate<JsonNode> event(String name) {
        return m -> isEvent(m, name);
    }

    private static boolean isEvent(JsonNode m, String name) {
        return "event".equals(m.path("type").asText()) && name.equals(m.path("subType").asText());
    }

    private Client connect() throws Exception {
        Client client = new Client();
        client.session = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/ws/music-sync")
                .get(5, TimeUnit.SECONDS);
        clients.add(client);
        return client;
    }

    private class Client extends TextWebSocketHandler {
        private final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
            inbox.add(objectMapper.readTree(message.getPayload()));
        }

        @Override
        public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
            // nada que limpiar
        }

        void send(String type, String subType, String senderId, String correlationId, Map<String, Object> data)
                throws Exception {
            Map<String, Object> msg = new LinkedHashMap<>();
            msg.put("type", type);
            msg.put("subType", subType);
            msg.put("sessionId", SESSION);
            msg.put("senderId", senderId);
            msg.put("correlationId", correlationId);
            msg.put("data", data);
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(msg)));
        }

        // Descarta mensajes hasta encontrar uno que cumpla la condición
        JsonNode await(Predicate<JsonNode> condition) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (System.currentTimeMillis() < deadline) {
                JsonNode next = inbox.poll(deadline - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
                if (next != null && condition.test(next)) {
                    return next;
                }
            }
            throw new AssertionError("No llegó el mensaje esperado en 5 s");
        }
    }
}
