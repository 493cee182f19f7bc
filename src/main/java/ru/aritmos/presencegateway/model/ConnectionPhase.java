package ru.aritmos.presencegateway.model;

/**
 * Фаза клиентского подключения.
 */
public enum ConnectionPhase {
    /** Подключения нет, повтор может быть запланирован. */
    DISCONNECTED,
    /** Транспорт открывается либо ожидается первый кадр от сервера. */
    CONNECTING,
    /** Сервер подтвердил сессию, push-события доставляются. */
    CONNECTED,
    /** Попытки исчерпаны: приложение работает через polling, восстановление - по длинному таймеру. */
    DEGRADED
}
