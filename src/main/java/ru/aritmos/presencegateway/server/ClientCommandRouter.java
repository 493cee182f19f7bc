package ru.aritmos.presencegateway.server;

import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.core.EnvelopeDecodeException;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.model.EventEnvelope;
import ru.aritmos.presencegateway.model.PresenceEventKinds;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Маршрутизация кадров аутентифицированного соединения.
 * <p>
 * Битый кадр логируется и отбрасывается, соединение продолжает работать.
 */
@Singleton
public class ClientCommandRouter {

    private static final Logger log = LoggerFactory.getLogger(ClientCommandRouter.class);

    private final EnvelopeCodec codec;
    private final Map<String, ClientCommandHandler> handlers;
    private final Executor executor;

    public ClientCommandRouter(EnvelopeCodec codec,
                               List<ClientCommandHandler> handlers,
                               @Named(TaskExecutors.IO) Executor executor) {
        this.codec = codec;
        this.executor = executor;
        Map<String, ClientCommandHandler> byKind = new HashMap<>();
        if (handlers != null) {
            for (ClientCommandHandler h : handlers) {
                ClientCommandHandler prev = byKind.putIfAbsent(h.kind(), h);
                if (prev != null) {
                    throw new IllegalStateException("Дублирующийся обработчик команды: " + h.kind());
                }
            }
        }
        this.handlers = Map.copyOf(byKind);
    }

    public void route(PushConnection connection, String frame) {
        EventEnvelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (EnvelopeDecodeException e) {
            log.warn("[PRESENCE][COMMAND] Битый кадр отброшен: connectionId={}, code={}", connection.id(), e.code());
            return;
        }

        String kind = envelope.kind();
        if (PresenceEventKinds.PING.equals(kind)) {
            connection.enqueue(codec.encode(EventEnvelope.of(PresenceEventKinds.PONG, null)));
            return;
        }
        if (PresenceEventKinds.AUTH.equals(kind)) {
            log.debug("[PRESENCE][COMMAND] Повторный auth проигнорирован: connectionId={}", connection.id());
            return;
        }
        if (PresenceEventKinds.PONG.equals(kind)) {
            return;
        }

        ClientCommandHandler handler = handlers.get(kind);
        if (handler == null) {
            log.debug("[PRESENCE][COMMAND] Неизвестная команда отброшена: connectionId={}, kind={}", connection.id(), kind);
            return;
        }

        String userId = connection.ownerUserId();
        executor.execute(() -> {
            try {
                handler.handle(userId, envelope);
            } catch (RuntimeException e) {
                log.warn("[PRESENCE][COMMAND] Ошибка обработки команды {} от userId={}: {}",
                        kind, userId, SensitiveDataSanitizer.sanitizeText(e.getMessage()));
            }
        });
    }

    public boolean hasHandler(String kind) {
        return handlers.containsKey(kind);
    }
}
