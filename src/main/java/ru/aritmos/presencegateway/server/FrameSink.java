package ru.aritmos.presencegateway.server;

/**
 * Низкоуровневый путь записи в транспорт одного соединения.
 * <p>
 * Вызывается только writer-задачей {@link PushConnection}, поэтому реализации не обязаны быть потокобезопасными
 * относительно параллельных {@link #sendText(String)}.
 */
public interface FrameSink {

    /**
     * @return идентификатор транспорта (уникален в пределах процесса)
     */
    String id();

    boolean isOpen();

    /**
     * Записать текстовый кадр. Метод может блокировать до подтверждения записи.
     *
     * @throws Exception любая ошибка записи; соединение после неё закрывается
     */
    void sendText(String frame) throws Exception;

    /**
     * Отправить протокольный ping без ожидания подтверждения. Ответный pong приходит как входящая активность.
     * <p>
     * Вызывается вне writer-задачи: транспорт пишет управляющий кадр целиком и не перемешивает его с текстовыми.
     */
    void sendPing();

    void close(int code, String reason);
}
