package ru.aritmos.presencegateway.client;

import java.time.Duration;

/**
 * Однократные таймеры клиентского автомата (повтор, таймаут подключения, heartbeat).
 */
public interface ClientTimer {

    Handle schedule(Duration delay, Runnable task);

    /**
     * Отмена запланированной задачи. Повторная отмена - no-op.
     */
    interface Handle {
        void cancel();
    }
}
