package ru.aritmos.presencegateway.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.model.ConnectionPhase;
import ru.aritmos.presencegateway.model.EventEnvelope;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Таблица подписчиков по kind.
 * <p>
 * Доставка идёт через отдельный исполнитель, поэтому медленный подписчик не задерживает приём кадров.
 * Исключение подписчика логируется и не влияет на остальных.
 */
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final Executor executor;
    private final Map<String, List<EventHandler>> byKind = new ConcurrentHashMap<>();
    private final List<EventHandler> anyHandlers = new CopyOnWriteArrayList<>();
    private final List<ConnectionPhaseListener> phaseListeners = new CopyOnWriteArrayList<>();

    public EventDispatcher(Executor executor) {
        this.executor = executor;
    }

    public EventSubscription subscribe(String kind, EventHandler handler) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind обязателен");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler обязателен");
        }
        List<EventHandler> list = byKind.computeIfAbsent(kind.trim(), k -> new CopyOnWriteArrayList<>());
        list.add(handler);
        return () -> list.remove(handler);
    }

    public EventSubscription subscribeAll(EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler обязателен");
        }
        anyHandlers.add(handler);
        return () -> anyHandlers.remove(handler);
    }

    public EventSubscription addPhaseListener(ConnectionPhaseListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener обязателен");
        }
        phaseListeners.add(listener);
        return () -> phaseListeners.remove(listener);
    }

    public void dispatch(EventEnvelope event) {
        List<EventHandler> handlers = byKind.getOrDefault(event.kind(), List.of());
        if (handlers.isEmpty() && anyHandlers.isEmpty()) {
            log.debug("[PRESENCE][CLIENT] Нет подписчиков для kind={}", event.kind());
            return;
        }
        executor.execute(() -> {
            for (EventHandler h : handlers) {
                invoke(h, event);
            }
            for (EventHandler h : anyHandlers) {
                invoke(h, event);
            }
        });
    }

    public void phaseChanged(ConnectionPhase previous, ConnectionPhase current) {
        if (previous == current || phaseListeners.isEmpty()) {
            return;
        }
        executor.execute(() -> {
            for (ConnectionPhaseListener l : phaseListeners) {
                try {
                    l.onPhaseChanged(previous, current);
                } catch (RuntimeException e) {
                    log.warn("[PRESENCE][CLIENT] Ошибка наблюдателя фазы: {}", SensitiveDataSanitizer.sanitizeText(e.getMessage()));
                }
            }
        });
    }

    private static void invoke(EventHandler h, EventEnvelope event) {
        try {
            h.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("[PRESENCE][CLIENT] Ошибка подписчика kind={}: {}", event.kind(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
        }
    }
}
