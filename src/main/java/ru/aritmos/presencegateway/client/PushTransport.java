package ru.aritmos.presencegateway.client;

import java.util.concurrent.CompletableFuture;

/**
 * Фабрика клиентских транспортов. Одна попытка подключения - один вызов {@link #open(Listener)}.
 * <p>
 * Отмена возвращённого future означает, что канал больше не нужен: если он всё же откроется, транспорт его закроет.
 */
public interface PushTransport {

    CompletableFuture<PushChannel> open(Listener listener);

    interface Listener {

        void onText(String frame);

        /**
         * Транспорт закрыт (штатно или по ошибке). Вызывается не более одного раза.
         */
        void onClosed(String reason);
    }
}
