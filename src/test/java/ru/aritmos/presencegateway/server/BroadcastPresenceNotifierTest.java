package ru.aritmos.presencegateway.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.support.MutableClock;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastPresenceNotifierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(mapper);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final PresenceNotifier notifier = new BroadcastPresenceNotifier(new Broadcaster(registry, codec), codec);

    private RecordingFrameSink register(String userId) {
        RecordingFrameSink sink = new RecordingFrameSink("c-" + userId);
        registry.register(userId, new PushConnection(sink, Runnable::run, clock, 16, registry::unregister));
        return sink;
    }

    @Test
    void shouldIgnoreNotificationForOfflineUser() {
        int delivered = assertDoesNotThrow(() ->
                notifier.notify(NotificationTarget.user("7"), "doctorUpdate", Map.of("isAvailable", false)));

        assertEquals(0, delivered);
        assertEquals(0, registry.connectionCount());
    }

    @Test
    void shouldNotifySingleUserWithDomainPayload() throws Exception {
        RecordingFrameSink seven = register("7");
        RecordingFrameSink eight = register("8");

        assertEquals(1, notifier.notify(NotificationTarget.parse("7"), "doctorUpdate", Map.of("isAvailable", false)));

        JsonNode json = mapper.readTree(seven.frames.get(0));
        assertEquals("doctorUpdate", json.get("type").asText());
        assertFalse(json.get("data").get("isAvailable").asBoolean());
        assertTrue(eight.frames.isEmpty());
    }

    @Test
    void shouldNotifyEveryoneForAllTarget() {
        RecordingFrameSink a = register("1");
        RecordingFrameSink b = register("2");

        assertEquals(2, notifier.notify(NotificationTarget.parse(" ALL "), "newEmergencyTransport", Map.of("id", 4)));
        assertEquals(1, a.frames.size());
        assertEquals(1, b.frames.size());
    }

    @Test
    void shouldParseTargets() {
        assertTrue(NotificationTarget.parse("all").isAll());
        assertEquals("42", NotificationTarget.parse(" 42 ").userId());
        assertThrows(IllegalArgumentException.class, () -> NotificationTarget.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> NotificationTarget.user(null));
    }
}
