package ru.aritmos.presencegateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.Test;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.server.BroadcastPresenceNotifier;
import ru.aritmos.presencegateway.server.Broadcaster;
import ru.aritmos.presencegateway.server.ConnectionRegistry;
import ru.aritmos.presencegateway.server.FrameSink;
import ru.aritmos.presencegateway.server.PushConnection;
import ru.aritmos.presencegateway.support.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PresenceAdminControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final EnvelopeCodec codec = new EnvelopeCodec(mapper);
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final PresenceAdminController controller = new PresenceAdminController(
            registry, new BroadcastPresenceNotifier(new Broadcaster(registry, codec), codec));

    private List<String> connect(String userId, String connectionId) {
        List<String> frames = new CopyOnWriteArrayList<>();
        FrameSink sink = new FrameSink() {
            @Override
            public String id() {
                return connectionId;
            }

            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public void sendText(String frame) {
                frames.add(frame);
            }

            @Override
            public void sendPing() {
            }

            @Override
            public void close(int code, String reason) {
            }
        };
        registry.register(userId, new PushConnection(sink, Runnable::run, clock, 8, registry::unregister));
        return frames;
    }

    @Test
    void shouldSummarizeRegistry() {
        connect("1", "a");
        connect("1", "b");
        connect("2", "c");

        PresenceAdminController.ConnectionsResponse summary = controller.connections();

        assertEquals(2, summary.users());
        assertEquals(3, summary.connections());
        assertEquals(2, summary.byUser().get("1"));
        assertEquals(1, summary.byUser().get("2"));
    }

    @Test
    void shouldNotifyTargetUser() throws Exception {
        List<String> frames = connect("7", "a");

        HttpResponse<PresenceAdminController.NotifyResponse> response = controller.notify(
                new PresenceAdminController.NotifyRequest("7", "doctorUpdate", mapper.readTree("{\"isAvailable\":true}")));

        assertEquals(HttpStatus.OK, response.getStatus());
        assertEquals(1, response.body().delivered());
        assertEquals("doctorUpdate", mapper.readTree(frames.get(0)).get("type").asText());
    }

    @Test
    void shouldReportZeroForOfflineTarget() {
        HttpResponse<PresenceAdminController.NotifyResponse> response = controller.notify(
                new PresenceAdminController.NotifyRequest("all", "newEmergencyTransport", null));

        assertEquals(HttpStatus.OK, response.getStatus());
        assertEquals(0, response.body().delivered());
    }

    @Test
    void shouldRejectRequestWithoutKindOrTarget() {
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.notify(new PresenceAdminController.NotifyRequest("7", " ", null)).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST,
                controller.notify(new PresenceAdminController.NotifyRequest(null, "doctorUpdate", null)).getStatus());
        assertEquals(HttpStatus.BAD_REQUEST, controller.notify(null).getStatus());
    }
}
