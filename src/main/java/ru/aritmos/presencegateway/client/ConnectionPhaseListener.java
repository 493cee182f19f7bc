package ru.aritmos.presencegateway.client;

import ru.aritmos.presencegateway.model.ConnectionPhase;

/**
 * Наблюдатель переходов фазы подключения.
 * <p>
 * Через него polling-слой узнаёт о переходе в {@link ConnectionPhase#DEGRADED} и о восстановлении.
 */
@FunctionalInterface
public interface ConnectionPhaseListener {

    void onPhaseChanged(ConnectionPhase previous, ConnectionPhase current);
}
