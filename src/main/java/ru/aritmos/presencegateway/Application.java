package ru.aritmos.presencegateway;

import io.micronaut.runtime.Micronaut;

/**
 * Точка входа Presence Gateway.
 * <p>
 * Сервис держит постоянные WebSocket-подключения пациентов и врачей телемедицинского приложения
 * и доставляет в них уже принятые доменные события (запись на приём, доступность врача,
 * статус экстренной транспортировки).
 * <p>
 * Важно: шлюз не принимает бизнес-решений. Он знает только «кому» отправить событие, но не «почему».
 * Бизнес-слой вызывает {@link ru.aritmos.presencegateway.server.PresenceNotifier}.
 */
public final class Application {

    private Application() {
        // утилитарный класс
    }

    public static void main(String[] args) {
        Micronaut.run(Application.class, args);
    }
}
