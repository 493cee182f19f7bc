package ru.aritmos.presencegateway.client;

import org.junit.jupiter.api.Test;
import ru.aritmos.presencegateway.model.ConnectionPhase;
import ru.aritmos.presencegateway.model.EventEnvelope;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventDispatcherTest {

    @Test
    void shouldDeliverByKindAndToCatchAllSubscribers() {
        EventDispatcher dispatcher = new EventDispatcher(Runnable::run);
        List<String> seen = new ArrayList<>();
        dispatcher.subscribe("appointments", e -> seen.add("kind:" + e.kind()));
        dispatcher.subscribeAll(e -> seen.add("any:" + e.kind()));

        dispatcher.dispatch(EventEnvelope.of("appointments", null));
        dispatcher.dispatch(EventEnvelope.of("doctorUpdate", null));

        assertEquals(List.of("kind:appointments", "any:appointments", "any:doctorUpdate"), seen);
    }

    @Test
    void shouldStopDeliveryAfterUnsubscribe() {
        EventDispatcher dispatcher = new EventDispatcher(Runnable::run);
        List<String> seen = new ArrayList<>();
        EventSubscription sub = dispatcher.subscribe("appointments", e -> seen.add(e.kind()));

        sub.close();
        sub.close();
        dispatcher.dispatch(EventEnvelope.of("appointments", null));

        assertTrue(seen.isEmpty());
    }

    @Test
    void shouldDecoupleDeliveryFromCaller() {
        List<Runnable> queued = new ArrayList<>();
        EventDispatcher dispatcher = new EventDispatcher(queued::add);
        List<String> seen = new ArrayList<>();
        dispatcher.subscribe("appointments", e -> seen.add(e.kind()));

        dispatcher.dispatch(EventEnvelope.of("appointments", null));

        assertTrue(seen.isEmpty(), "подписчик не вызывается в потоке приёма кадров");
        queued.forEach(Runnable::run);
        assertEquals(List.of("appointments"), seen);
    }

    @Test
    void shouldIsolateFailingSubscribers() {
        EventDispatcher dispatcher = new EventDispatcher(Runnable::run);
        List<String> seen = new ArrayList<>();
        dispatcher.subscribe("x", e -> {
            throw new IllegalStateException("ui crashed");
        });
        dispatcher.subscribe("x", e -> seen.add("second"));
        dispatcher.addPhaseListener((from, to) -> {
            throw new IllegalStateException("listener crashed");
        });
        dispatcher.addPhaseListener((from, to) -> seen.add(from + "->" + to));

        dispatcher.dispatch(EventEnvelope.of("x", null));
        dispatcher.phaseChanged(ConnectionPhase.CONNECTED, ConnectionPhase.DISCONNECTED);
        dispatcher.phaseChanged(ConnectionPhase.CONNECTED, ConnectionPhase.CONNECTED);

        assertEquals(List.of("second", "CONNECTED->DISCONNECTED"), seen);
    }
}
