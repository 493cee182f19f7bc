package ru.aritmos.presencegateway.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.support.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BroadcasterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(mapper);
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final Broadcaster broadcaster = new Broadcaster(registry, codec);

    private PushConnection register(String userId, RecordingFrameSink sink) {
        PushConnection c = new PushConnection(sink, Runnable::run, clock, 16, registry::unregister);
        registry.register(userId, c);
        return c;
    }

    private EventEnvelope event(String kind, Object payload) {
        return EventEnvelope.of(kind, codec.toPayload(payload));
    }

    private String kindOf(String frame) throws Exception {
        return mapper.readTree(frame).get("type").asText();
    }

    @Test
    void shouldNotLeakEventsToOtherUsers() {
        RecordingFrameSink u1 = new RecordingFrameSink("u1");
        RecordingFrameSink u2 = new RecordingFrameSink("u2");
        register("1", u1);
        register("2", u2);

        assertEquals(1, broadcaster.sendToUser("1", event("appointmentUpdate", Map.of("id", 5))));

        assertEquals(1, u1.frames.size());
        assertTrue(u2.frames.isEmpty());
    }

    @Test
    void shouldFanOutToEveryConnectionOfUser() throws Exception {
        RecordingFrameSink tab = new RecordingFrameSink("tab");
        RecordingFrameSink phone = new RecordingFrameSink("phone");
        register("1", tab);
        register("1", phone);

        int delivered = broadcaster.sendToUser("1", event("doctorUpdate", Map.of("isAvailable", true)));

        assertEquals(2, delivered);
        assertEquals("doctorUpdate", kindOf(tab.frames.get(0)));
        assertEquals(tab.frames, phone.frames, "кадр кодируется один раз и одинаков для всех соединений");
    }

    @Test
    void shouldPreserveCallOrderPerConnection() throws Exception {
        RecordingFrameSink sink = new RecordingFrameSink("c");
        register("1", sink);

        broadcaster.sendToUser("1", event("e1", null));
        broadcaster.sendToAll(event("e2", null));
        broadcaster.sendToUser("1", event("e3", null));

        assertEquals(3, sink.frames.size());
        assertEquals("e1", kindOf(sink.frames.get(0)));
        assertEquals("e2", kindOf(sink.frames.get(1)));
        assertEquals("e3", kindOf(sink.frames.get(2)));
    }

    @Test
    void shouldIsolateWriteFailureToOneConnection() {
        RecordingFrameSink broken = new RecordingFrameSink("broken");
        broken.failWrites = true;
        RecordingFrameSink healthy = new RecordingFrameSink("healthy");
        RecordingFrameSink other = new RecordingFrameSink("other");
        PushConnection brokenConnection = register("1", broken);
        PushConnection healthyConnection = register("1", healthy);
        register("2", other);

        broadcaster.sendToAll(event("emergencyTransportsUpdate", List.of()));

        assertEquals(1, healthy.frames.size());
        assertEquals(1, other.frames.size());
        assertTrue(brokenConnection.isClosed());
        assertEquals(CloseCause.WRITE_FAILED, brokenConnection.closeCause());
        assertEquals(Set.of(healthyConnection), registry.connectionsFor("1"));

        broadcaster.sendToUser("1", event("doctorUpdate", null));
        assertEquals(2, healthy.frames.size());
    }

    @Test
    void shouldBeNoOpForUserWithoutConnections() {
        RecordingFrameSink sink = new RecordingFrameSink("c");
        register("1", sink);

        int delivered = assertDoesNotThrow(() -> broadcaster.sendToUser("7", event("doctorUpdate", Map.of("isAvailable", false))));

        assertEquals(0, delivered);
        assertTrue(sink.frames.isEmpty());

        // Пользователь 7 подключается позже: отложенных событий для него нет.
        RecordingFrameSink late = new RecordingFrameSink("late");
        register("7", late);
        assertTrue(late.frames.isEmpty());
    }

    @Test
    void shouldSendToAllRegisteredConnections() throws Exception {
        RecordingFrameSink a = new RecordingFrameSink("a");
        RecordingFrameSink b = new RecordingFrameSink("b");
        register("1", a);
        register("2", b);

        assertEquals(2, broadcaster.sendToAll(event("doctor-availability-changed", Map.of("doctorId", 3))));

        JsonNode data = mapper.readTree(b.frames.get(0)).get("data");
        assertEquals(3, data.get("doctorId").asInt());
    }

    @Test
    void shouldRejectMissingTarget() {
        assertThrows(IllegalArgumentException.class, () -> broadcaster.sendToUser(" ", event("x", null)));
        assertThrows(IllegalArgumentException.class, () -> broadcaster.sendToUser("1", null));
    }
}
