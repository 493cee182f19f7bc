package ru.aritmos.presencegateway.client;

import ru.aritmos.presencegateway.model.EventEnvelope;

/**
 * Подписчик push-событий UI-слоя. Не должен блокироваться надолго.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(EventEnvelope event);
}
