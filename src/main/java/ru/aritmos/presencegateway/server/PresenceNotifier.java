package ru.aritmos.presencegateway.server;

/**
 * Точка входа доменного слоя: вызывается при изменении записи, консультации, статуса врача или заявки на транспорт.
 * <p>
 * Доставка best-effort: если адресат не подключён, уведомление теряется.
 */
public interface PresenceNotifier {

    /**
     * @return число соединений, в которые поставлено событие
     */
    int notify(NotificationTarget target, String kind, Object payload);
}
