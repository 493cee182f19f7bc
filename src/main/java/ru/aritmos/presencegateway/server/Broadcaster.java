package ru.aritmos.presencegateway.server;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.presencegateway.core.EnvelopeCodec;
import ru.aritmos.presencegateway.core.SensitiveDataSanitizer;
import ru.aritmos.presencegateway.model.EventEnvelope;

import java.util.Collection;

/**
 * Рассылка событий по живым соединениям.
 * <p>
 * Конверт кодируется один раз, затем кадр ставится в очередь каждого целевого соединения.
 * Запись выполняется без удержания монитора реестра: берётся снимок целей, дальше работа идёт по нему.
 * <p>
 * Ошибка на одном соединении не прерывает рассылку остальным: проблемное соединение закрывается
 * (и тем самым снимается с регистрации), повторов нет.
 */
@Singleton
public class Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;

    public Broadcaster(ConnectionRegistry registry, EnvelopeCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Доставить событие во все соединения пользователя.
     * <p>
     * Если у пользователя нет соединений - no-op, событие никуда не откладывается.
     *
     * @return число соединений, в очередь которых поставлен кадр
     */
    public int sendToUser(String userId, EventEnvelope envelope) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId обязателен");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope обязателен");
        }
        Collection<PushConnection> targets = registry.connectionsFor(userId.trim());
        if (targets.isEmpty()) {
            log.debug("[PRESENCE][BROADCAST] Нет живых соединений: userId={}, kind={}", userId, envelope.kind());
            return 0;
        }
        return deliver(targets, envelope);
    }

    /**
     * Доставить событие во все зарегистрированные соединения.
     * <p>
     * Стоимость O(число соединений), использовать для глобальных событий.
     */
    public int sendToAll(EventEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope обязателен");
        }
        Collection<PushConnection> targets = registry.allConnections();
        if (targets.isEmpty()) {
            return 0;
        }
        return deliver(targets, envelope);
    }

    private int deliver(Collection<PushConnection> targets, EventEnvelope envelope) {
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (PushConnection c : targets) {
            try {
                if (c.enqueue(frame)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.warn("[PRESENCE][BROADCAST] Ошибка доставки в соединение {}: {}", c.id(), SensitiveDataSanitizer.sanitizeText(e.getMessage()));
                c.close(CloseCause.WRITE_FAILED);
            }
        }
        log.debug("[PRESENCE][BROADCAST] kind={}, targets={}, delivered={}, bytes={}",
                envelope.kind(), targets.size(), delivered, frame.length());
        return delivered;
    }
}
